package com.trade.signalengine.service.trend;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.dto.CandleSeries;
import com.trade.signalengine.dto.IndicatorBundle;
import com.trade.signalengine.dto.MomentumState;
import com.trade.signalengine.dto.TrendState;
import com.trade.signalengine.enums.MomentumDirection;
import com.trade.signalengine.enums.TrendDirection;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Trend state from ADX, MACD and RSI; momentum from the close-to-close change over the last few bars.
 */
@Component
public class TrendDetector {

    private final double macdNeutralBand;
    private final double momentumDeadBandPct;

    @Autowired
    public TrendDetector(SignalEngineProperties props) {
        this(props.getIndicators().getMacdNeutralBand(), props.getIndicators().getMomentumDeadBandPct());
    }

    public TrendDetector(double macdNeutralBand, double momentumDeadBandPct) {
        this.macdNeutralBand = macdNeutralBand;
        this.momentumDeadBandPct = momentumDeadBandPct;
    }

    /**
     * UP needs ADX above the trend floor, MACD diff above the neutral band and RSI above the trend floor;
     * DOWN mirrors it. Anything else is RANGING. Strength is twice the ADX, capped at 100.
     */
    public TrendState detectTrend(IndicatorBundle ind, SignalTuning tuning) {
        double adx = ind.adx();
        if (!(adx > tuning.getAdxTrendThreshold())) {
            return TrendState.ranging(adx);
        }
        double strength = Math.min(100.0, adx * 2.0);
        if (ind.macdDiff() > macdNeutralBand && ind.rsi() > tuning.getRsiTrendFloor()) {
            return new TrendState(TrendDirection.UP, strength, adx);
        }
        if (ind.macdDiff() < -macdNeutralBand && ind.rsi() < tuning.getRsiTrendCeiling()) {
            return new TrendState(TrendDirection.DOWN, strength, adx);
        }
        return TrendState.ranging(adx);
    }

    /**
     * Percent change of the close over {@code periods} bars. Inside the dead band the direction is NEUTRAL.
     * Strength is {@code |change%| * 100}, capped at 100.
     */
    public MomentumState computeMomentum(CandleSeries series, int periods) {
        List<Candle> candles = series.getCandles();
        if (periods < 1 || candles.size() <= periods) return MomentumState.neutral();
        double now = candles.get(candles.size() - 1).close();
        double then = candles.get(candles.size() - 1 - periods).close();
        if (!(then > 0) || !Double.isFinite(now)) return MomentumState.neutral();

        double changePct = (now - then) / then * 100.0;
        if (changePct > momentumDeadBandPct) {
            return new MomentumState(changePct, MomentumDirection.UP, Math.min(100.0, Math.abs(changePct) * 100.0));
        }
        if (changePct < -momentumDeadBandPct) {
            return new MomentumState(changePct, MomentumDirection.DOWN, Math.min(100.0, Math.abs(changePct) * 100.0));
        }
        return new MomentumState(changePct, MomentumDirection.NEUTRAL, 0.0);
    }
}
