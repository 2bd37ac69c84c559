package com.trade.signalengine.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.exception.SourceUnavailableException;
import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.dto.Instrument;
import com.trade.signalengine.enums.CandleInterval;
import com.trade.signalengine.enums.SourceErrorKind;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Binance public klines on the USDT-quoted proxy of the instrument. No API key needed.
 */
@Component
public class BinanceSource extends AbstractHttpMarketDataSource {

    public static final String NAME = "binance";

    /** Binance rejects limits above this. */
    private static final int MAX_LIMIT = 1000;

    public BinanceSource(@Qualifier("marketDataRestTemplate") RestTemplate template, ObjectMapper mapper,
                         SignalEngineProperties props) {
        super(template, mapper, props.getSources().getBinance());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected boolean requiresApiKey() {
        return false;
    }

    @Override
    protected URI buildUri(Instrument instrument, CandleInterval interval, int outputSize) {
        return UriComponentsBuilder.fromHttpUrl(provider.getBaseUrl())
                .path("/api/v3/klines")
                .queryParam("symbol", instrument.binanceSymbol())
                .queryParam("interval", interval.getBinance())
                .queryParam("limit", Math.min(outputSize, MAX_LIMIT))
                .build()
                .toUri();
    }

    @Override
    protected void checkEnvelope(JsonNode body) {
        if (body.isArray()) return;
        int code = body.path("code").asInt(0);
        String msg = body.path("msg").asText("unexpected payload");
        if (code == -1003 || code == -1015) {
            throw new SourceUnavailableException(NAME, SourceErrorKind.QUOTA, msg);
        }
        if (body.has("code")) {
            throw new SourceUnavailableException(NAME, SourceErrorKind.PROVIDER_ERROR, msg);
        }
        throw malformed("expected kline array");
    }

    @Override
    protected List<Candle> parseCandles(JsonNode body, CandleInterval interval) {
        List<Candle> out = new ArrayList<>(body.size());
        for (JsonNode k : body) {
            if (!k.isArray() || k.size() < 6 || !k.get(0).canConvertToLong()) continue;
            out.add(new Candle(Instant.ofEpochMilli(k.get(0).asLong()),
                    num(k, 1), num(k, 2), num(k, 3), num(k, 4), num(k, 5)));
        }
        return out;
    }
}
