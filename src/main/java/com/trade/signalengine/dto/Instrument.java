package com.trade.signalengine.dto;

/**
 * An instrument and its symbol on every upstream provider.
 *
 * @param symbol        internal symbol, e.g. EURUSD
 * @param pair          slash form used by Twelve Data, e.g. EUR/USD
 * @param binanceSymbol USDT-quoted proxy used by the crypto fallback
 * @param fx            subject to the FX weekend closure
 */
public record Instrument(
        String symbol,
        String pair,
        String fromCurrency,
        String toCurrency,
        String binanceSymbol,
        double defaultPrice,
        boolean fx
) {
}
