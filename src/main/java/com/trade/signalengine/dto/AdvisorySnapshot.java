package com.trade.signalengine.dto;

/**
 * Market state sent to the advisory service.
 */
public record AdvisorySnapshot(
        String instrument,
        double price,
        double rsi,
        double macdDiff,
        double bollingerPercent,
        double adx,
        double stochK,
        TrendState trend,
        MomentumState momentum
) {
    public static AdvisorySnapshot of(String instrument, IndicatorBundle b) {
        return new AdvisorySnapshot(instrument, b.price(), b.rsi(), b.macdDiff(), b.bollingerPercent(),
                b.adx(), b.stochK(), b.trend(), b.momentum());
    }
}
