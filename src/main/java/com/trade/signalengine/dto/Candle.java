package com.trade.signalengine.dto;

import java.time.Instant;

/**
 * One OHLCV bar. Immutable once fetched.
 */
public record Candle(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
    public boolean isFinite() {
        return timestamp != null
                && Double.isFinite(open) && Double.isFinite(high)
                && Double.isFinite(low) && Double.isFinite(close);
    }

    public double getRange() {
        return high - low;
    }

    public double getTrueRange(Candle previous) {
        if (previous == null) return getRange();
        double tr1 = high - low;
        double tr2 = Math.abs(high - previous.close());
        double tr3 = Math.abs(low - previous.close());
        return Math.max(tr1, Math.max(tr2, tr3));
    }
}
