package com.trade.signalengine.service.market;

import com.trade.signalengine.common.exception.SourceUnavailableException;
import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.dto.Instrument;
import com.trade.signalengine.enums.CandleInterval;

import java.util.List;

/**
 * One upstream OHLCV provider.
 */
public interface MarketDataSource {

    /**
     * Stable lower-case id used in configuration ({@code source-order}) and metrics.
     */
    String name();

    /**
     * False when credentials or the enabled flag are missing; such sources are skipped without a call.
     */
    boolean isConfigured();

    /**
     * @return candles in any order; the caller normalizes
     * @throws SourceUnavailableException on quota, timeout, HTTP, provider or payload errors
     */
    List<Candle> fetchCandles(Instrument instrument, CandleInterval interval, int outputSize);
}
