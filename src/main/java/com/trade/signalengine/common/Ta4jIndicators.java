package com.trade.signalengine.common;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.dto.Candle;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.MMAIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.StochasticOscillatorKIndicator;
import org.ta4j.core.indicators.adx.ADXIndicator;
import org.ta4j.core.indicators.bollinger.PercentBIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.GainIndicator;
import org.ta4j.core.indicators.helpers.LossIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.num.DoubleNum;
import org.ta4j.core.num.Num;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * Thin ta4j wrapper for the indicator engine. Every accessor reads the value at the last bar and maps
 * undefined results (flat prices, zero ranges) to a neutral value instead of NaN.
 * Works with ta4j 0.17, whose series builder still takes {@code ZonedDateTime}.
 */
public class Ta4jIndicators {

    public static final double NEUTRAL = 50.0;

    private final SignalEngineProperties.Indicators p;

    public Ta4jIndicators(SignalEngineProperties.Indicators params) {
        this.p = Objects.requireNonNull(params, "params");
    }

    /**
     * Longest look-back any indicator needs before its last value is meaningful.
     */
    public int minimumHistory() {
        int need = p.getMacdSlow() + p.getMacdSignal();
        need = Math.max(need, 2 * p.getAdxPeriod());
        need = Math.max(need, p.getBollingerPeriod());
        need = Math.max(need, p.getStochasticPeriod() + p.getStochasticSmoothing());
        need = Math.max(need, p.getRsiPeriod() + 1);
        return need;
    }

    /**
     * Bars end at candle open + interval, all in UTC.
     */
    public BarSeries buildSeries(String name, List<Candle> candles, Duration timeframe) {
        Objects.requireNonNull(timeframe, "timeframe");
        BarSeries series = new BaseBarSeriesBuilder()
                .withName(name == null ? "series" : name)
                .withNumTypeOf(DoubleNum.class)
                .build();
        for (Candle c : candles) {
            series.addBar(timeframe, c.timestamp().plus(timeframe).atZone(ZoneOffset.UTC),
                    c.open(), c.high(), c.low(), c.close(), c.volume());
        }
        return series;
    }

    /**
     * Wilder RSI. Flat prices give 50, no losses give 100.
     */
    public double rsi(BarSeries s) {
        ClosePriceIndicator close = new ClosePriceIndicator(s);
        double gain = last(new MMAIndicator(new GainIndicator(close), p.getRsiPeriod()));
        double loss = last(new MMAIndicator(new LossIndicator(close), p.getRsiPeriod()));
        if (!Double.isFinite(gain) || !Double.isFinite(loss)) return NEUTRAL;
        if (gain == 0.0 && loss == 0.0) return NEUTRAL;
        if (loss == 0.0) return 100.0;
        double rsi = 100.0 - 100.0 / (1.0 + gain / loss);
        return clamp(rsi);
    }

    /**
     * @return {line, signal, line - signal}
     */
    public double[] macd(BarSeries s) {
        MACDIndicator macd = new MACDIndicator(new ClosePriceIndicator(s), p.getMacdFast(), p.getMacdSlow());
        EMAIndicator signal = new EMAIndicator(macd, p.getMacdSignal());
        double line = finiteOr(last(macd), 0.0);
        double sig = finiteOr(last(signal), 0.0);
        return new double[]{line, sig, line - sig};
    }

    /**
     * Position of the close inside the bands on a 0..100 scale; 50 when the bands collapse.
     */
    public double bollingerPercent(BarSeries s) {
        PercentBIndicator pb = new PercentBIndicator(new ClosePriceIndicator(s), p.getBollingerPeriod(), p.getBollingerK());
        double v = last(pb);
        return Double.isFinite(v) ? v * 100.0 : NEUTRAL;
    }

    public double atr(BarSeries s) {
        return finiteOr(last(new ATRIndicator(s, p.getAtrPeriod())), 0.0);
    }

    public double adx(BarSeries s) {
        return clamp(finiteOr(last(new ADXIndicator(s, p.getAdxPeriod())), 0.0));
    }

    /**
     * @return {%K, %D}; 50 when the high-low range is zero
     */
    public double[] stochastic(BarSeries s) {
        StochasticOscillatorKIndicator k = new StochasticOscillatorKIndicator(s, p.getStochasticPeriod());
        SMAIndicator d = new SMAIndicator(k, p.getStochasticSmoothing());
        return new double[]{clamp(finiteOr(last(k), NEUTRAL)), clamp(finiteOr(last(d), NEUTRAL))};
    }

    /**
     * Last volume over its moving average; 0 when the provider reports no volume.
     */
    public double volumeRatio(BarSeries s) {
        VolumeIndicator vol = new VolumeIndicator(s);
        double avg = last(new SMAIndicator(vol, p.getVolumeAveragePeriod()));
        double lastVol = last(vol);
        if (!Double.isFinite(avg) || avg <= 0.0 || !Double.isFinite(lastVol)) return 0.0;
        return lastVol / avg;
    }

    private static double last(Indicator<Num> ind) {
        int end = ind.getBarSeries().getEndIndex();
        if (end < 0) return Double.NaN;
        Num v = ind.getValue(end);
        return (v == null || v.isNaN()) ? Double.NaN : v.doubleValue();
    }

    private static double finiteOr(double v, double fallback) {
        return Double.isFinite(v) ? v : fallback;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
