package com.trade.signalengine.test.support;

import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.dto.CandleSeries;
import com.trade.signalengine.dto.IndicatorBundle;
import com.trade.signalengine.dto.MomentumState;
import com.trade.signalengine.dto.SeriesVersion;
import com.trade.signalengine.dto.TrendState;
import com.trade.signalengine.enums.CandleInterval;
import com.trade.signalengine.enums.MomentumDirection;
import com.trade.signalengine.enums.TrendDirection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    /** A Wednesday, well inside FX trading hours. */
    public static final Instant T0 = Instant.parse("2024-03-06T10:00:00Z");

    private Fixtures() {
    }

    /**
     * One-minute candles ending just before {@link #T0}; high/low sit 0.0002 around the close.
     */
    public static List<Candle> candles(double[] closes, double volume) {
        List<Candle> out = new ArrayList<>(closes.length);
        Instant start = T0.minusSeconds(60L * closes.length);
        double prev = closes[0];
        for (int i = 0; i < closes.length; i++) {
            double c = closes[i];
            double hi = Math.max(prev, c) + 0.0002;
            double lo = Math.min(prev, c) - 0.0002;
            out.add(new Candle(start.plusSeconds(60L * i), prev, hi, lo, c, volume));
            prev = c;
        }
        return out;
    }

    public static double[] trend(int n, double start, double step) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = start + i * step;
        return out;
    }

    /**
     * Deterministic zig-zag around a drift, so every oscillator has both gains and losses.
     */
    public static double[] wave(int n, double start, double drift, double amplitude) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = start + i * drift + amplitude * Math.sin(i * 0.7);
        }
        return out;
    }

    public static CandleSeries series(String instrument, double[] closes) {
        return CandleSeries.normalize(instrument, CandleInterval.ONE_MINUTE, "test", candles(closes, 0.0), 500, T0);
    }

    public static IndicatorBundle bundle(double rsi, double macdDiff, double bb, double adx, double stochK) {
        return new IndicatorBundle(
                new SeriesVersion("EURUSD", CandleInterval.ONE_MINUTE, T0, 100),
                1.0850, rsi, macdDiff, 0.0, macdDiff, bb, 0.0010, adx, stochK, stochK, 0.0,
                TrendState.ranging(adx), MomentumState.neutral());
    }

    public static TrendState trend(TrendDirection direction, double adx) {
        return direction == TrendDirection.RANGING
                ? TrendState.ranging(adx)
                : new TrendState(direction, Math.min(100, adx * 2), adx);
    }

    public static MomentumState momentum(MomentumDirection direction) {
        return switch (direction) {
            case UP -> new MomentumState(0.03, MomentumDirection.UP, 3.0);
            case DOWN -> new MomentumState(-0.03, MomentumDirection.DOWN, 3.0);
            case NEUTRAL -> MomentumState.neutral();
        };
    }
}
