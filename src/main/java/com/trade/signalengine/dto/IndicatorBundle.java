package com.trade.signalengine.dto;

/**
 * Read-only indicator snapshot for exactly one {@link SeriesVersion}.
 *
 * @param bollingerPercent position of the close inside the bands, 0 = lower band, 100 = upper band
 * @param volumeRatio      last volume over its 20-bar average, 0 when the provider reports no volume
 */
public record IndicatorBundle(
        SeriesVersion version,
        double price,
        double rsi,
        double macdLine,
        double macdSignal,
        double macdDiff,
        double bollingerPercent,
        double atr,
        double adx,
        double stochK,
        double stochD,
        double volumeRatio,
        TrendState trend,
        MomentumState momentum
) {
    /**
     * ATR as a percentage of price.
     */
    public double atrPercent() {
        if (price <= 0 || !Double.isFinite(atr)) return 0.0;
        return atr / price * 100.0;
    }

    public IndicatorBundle withTrendAndMomentum(TrendState trend, MomentumState momentum) {
        return new IndicatorBundle(version, price, rsi, macdLine, macdSignal, macdDiff, bollingerPercent,
                atr, adx, stochK, stochD, volumeRatio, trend, momentum);
    }
}
