package com.trade.signalengine.service.decision;

import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.dto.Evaluation;
import com.trade.signalengine.dto.IndicatorBundle;
import com.trade.signalengine.dto.ScoreResult;
import com.trade.signalengine.dto.Signal;
import com.trade.signalengine.dto.Thresholds;
import com.trade.signalengine.enums.SignalAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * BUY / SELL / NO_SIGNAL from the final score and confidence. A score between the sell and buy thresholds is
 * always NO_SIGNAL; there is no weaker fallback rule.
 */
@Slf4j
@Service
public class DecisionService {

    /**
     * Volatility-adjusted thresholds. The result is never looser than the configured thresholds.
     */
    public Thresholds thresholds(double atrPercent, SignalTuning t) {
        if (!t.isAdaptiveThresholds()) {
            return new Thresholds(t.getMinBuyScore(), t.getMaxSellScore(), "CONFIGURED");
        }
        double buy;
        double sell;
        String label;
        if (atrPercent > t.getHighVolatilityPct()) {
            buy = 60;
            sell = 40;
            label = "HIGH VOLATILITY";
        } else if (atrPercent < t.getLowVolatilityPct()) {
            buy = 52;
            sell = 48;
            label = "LOW VOLATILITY";
        } else {
            buy = 55;
            sell = 45;
            label = "NORMAL VOLATILITY";
        }
        return new Thresholds(Math.max(buy, t.getMinBuyScore()), Math.min(sell, t.getMaxSellScore()), label);
    }

    public Evaluation decide(String instrument, String dataSource, IndicatorBundle ind, ScoreResult score,
                             SignalTuning t, Instant at) {
        Thresholds th = thresholds(ind.atrPercent(), t);
        List<String> reasons = new ArrayList<>(score.notes());
        double fin = score.finalScore();
        double conf = score.confidence();
        double price = ind.price();

        SignalAction action = SignalAction.NO_SIGNAL;
        if (fin >= th.minBuyScore()) {
            action = gate(SignalAction.BUY, ind, conf, t, reasons);
        } else if (fin <= th.maxSellScore()) {
            action = gate(SignalAction.SELL, ind, conf, t, reasons);
        } else {
            reasons.add(String.format("score %.1f inside neutral zone (%.0f, %.0f)", fin, th.maxSellScore(), th.minBuyScore()));
        }

        Signal signal;
        if (action.isDirectional()) {
            double[] levels = riskLevels(action, price, ind.atr(), t);
            signal = new Signal(instrument, action, price, fin, conf, levels[0], levels[1], at);
        } else {
            signal = Signal.none(instrument, price, fin, conf, at);
        }
        log.info("{} {} | trend={} momentum={} ta={} advisory={} final={} conf={} thresholds={}/{} ({}) | {}",
                instrument, action, ind.trend().direction(), ind.momentum().direction(),
                fmt(score.taScore()), score.advisoryScore() == null ? "-" : fmt(score.advisoryScore()),
                fmt(fin), fmt(conf), fmt(th.minBuyScore()), fmt(th.maxSellScore()), th.label(), reasons);
        return new Evaluation(signal, ind, score, th, List.copyOf(reasons), dataSource);
    }

    /**
     * Stop distance is ATR times the multiplier, or the fallback percent of price when ATR is not positive.
     *
     * @return {stopLoss, takeProfit}
     */
    public double[] riskLevels(SignalAction action, double price, double atr, SignalTuning t) {
        double distance = (Double.isFinite(atr) && atr > 0)
                ? atr * t.getAtrStopMultiplier()
                : price * t.getStopLossPct();
        double reward = distance * t.getRiskRewardRatio();
        if (action == SignalAction.BUY) return new double[]{price - distance, price + reward};
        return new double[]{price + distance, price - reward};
    }

    private SignalAction gate(SignalAction candidate, IndicatorBundle ind, double confidence, SignalTuning t,
                              List<String> reasons) {
        if (confidence < t.getMinConfidence()) {
            reasons.add(String.format("%s rejected: confidence %.1f < %.0f", candidate, confidence, t.getMinConfidence()));
            return SignalAction.NO_SIGNAL;
        }
        if (t.isRequireMomentum() && ind.momentum().direction().opposes(candidate)) {
            reasons.add(candidate + " rejected: momentum " + ind.momentum().direction());
            return SignalAction.NO_SIGNAL;
        }
        return candidate;
    }

    private static String fmt(double v) {
        return String.format("%.1f", v);
    }
}
