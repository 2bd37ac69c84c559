package com.trade.signalengine.service.scoring;

import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.dto.AdvisoryOpinion;
import com.trade.signalengine.dto.IndicatorBundle;
import com.trade.signalengine.dto.MomentumState;
import com.trade.signalengine.dto.ScoreResult;
import com.trade.signalengine.dto.TrendState;
import com.trade.signalengine.enums.SignalAction;
import com.trade.signalengine.enums.TrendDirection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns indicators, trend and momentum into a 0..100 TA score, a confirmation count and a confidence.
 * <p>
 * In a directional trend only confirmations pointing the same way are eligible. In a ranging market both sides
 * are tallied, and each tier needs {@code rangingExtraConfirmations} more of them.
 * Above 50 is bullish, below 50 bearish, 50 means no edge.
 */
@Component
public class ScoringEngine {

    /** Number of confirmation predicates per side. */
    public static final int PREDICATES = 6;

    static final double BASE_CONFIDENCE = 40.0;
    static final double CONVERGENCE_SPAN = 45.0;
    static final double ALIGNMENT_BONUS = 7.5;

    public ScoreResult score(IndicatorBundle ind, TrendState trend, MomentumState momentum,
                             AdvisoryOpinion advisory, SignalTuning t) {
        List<String> notes = new ArrayList<>();
        List<String> bull = bullishConfirmations(ind, momentum, t);
        List<String> bear = bearishConfirmations(ind, momentum, t);

        TrendDirection dir = trend.direction();
        if (dir == TrendDirection.UP && !bear.isEmpty()) {
            notes.add("uptrend: ignored " + bear.size() + " bearish confirmation(s)");
            bear = List.of();
        } else if (dir == TrendDirection.DOWN && !bull.isEmpty()) {
            notes.add("downtrend: ignored " + bull.size() + " bullish confirmation(s)");
            bull = List.of();
        }

        int extra = dir == TrendDirection.RANGING ? t.getRangingExtraConfirmations() : 0;
        int strongNeed = t.getStrongConfirmations() + extra;
        int moderateNeed = t.getModerateConfirmations() + extra;
        int bullTier = tier(bull.size(), strongNeed, moderateNeed);
        int bearTier = tier(bear.size(), strongNeed, moderateNeed);

        SignalAction candidate = SignalAction.NO_SIGNAL;
        if (bullTier > bearTier || (bullTier == bearTier && bullTier > 0 && bull.size() > bear.size())) {
            candidate = SignalAction.BUY;
        } else if (bearTier > bullTier || (bullTier == bearTier && bearTier > 0 && bear.size() > bull.size())) {
            candidate = SignalAction.SELL;
        }

        List<String> winning = candidate == SignalAction.SELL ? bear : bull;
        int confirmations = candidate == SignalAction.NO_SIGNAL ? Math.max(bull.size(), bear.size()) : winning.size();
        double ta = 50.0;
        if (candidate != SignalAction.NO_SIGNAL) {
            int tier = Math.max(bullTier, bearTier);
            double offset = tier == 2 ? t.getStrongTierOffset() : t.getModerateTierOffset();
            double sign = candidate == SignalAction.BUY ? 1.0 : -1.0;
            ta = 50.0 + sign * offset;
            notes.add((tier == 2 ? "strong " : "moderate ") + candidate + " tier: " + String.join(", ", winning));

            if (momentum.direction().opposes(candidate)) {
                ta = candidate == SignalAction.BUY
                        ? Math.max(50.0, ta - t.getMomentumPenaltyScore())
                        : Math.min(50.0, ta + t.getMomentumPenaltyScore());
                notes.add("momentum " + momentum.direction() + " against " + candidate + ": -" + t.getMomentumPenaltyScore());
            }
            if (t.isVolumeBonus()) {
                double bonus = volumeBonus(ind.volumeRatio());
                if (bonus > 0) {
                    ta += sign * bonus;
                    notes.add(String.format("volume x%.2f: +%.0f", ind.volumeRatio(), bonus));
                }
            }
        } else {
            notes.add("not enough confirmations (bull=" + bull.size() + ", bear=" + bear.size()
                    + ", need " + moderateNeed + ")");
        }
        ta = clamp(ta);

        double confidence = confidence(confirmations, candidate, trend, momentum, t);

        Double advisoryScore = null;
        String rationale = null;
        double finalScore = ta;
        if (advisory != null && Double.isFinite(advisory.score())) {
            advisoryScore = clamp(advisory.score());
            rationale = advisory.rationale();
            finalScore = clamp(t.getAdvisoryWeight() * advisoryScore + t.getTaWeight() * ta);
        }
        return new ScoreResult(ta, confirmations, candidate, advisoryScore, rationale, finalScore, confidence,
                List.copyOf(notes));
    }

    /**
     * Convergence of the eligible confirmations plus trend and momentum alignment. Independent of the score.
     */
    double confidence(int confirmations, SignalAction candidate, TrendState trend, MomentumState momentum,
                      SignalTuning t) {
        double c = BASE_CONFIDENCE + (Math.min(confirmations, PREDICATES) / (double) PREDICATES) * CONVERGENCE_SPAN;
        if (candidate.isDirectional()) {
            boolean trendAligned = (candidate == SignalAction.BUY && trend.direction() == TrendDirection.UP)
                    || (candidate == SignalAction.SELL && trend.direction() == TrendDirection.DOWN);
            if (trendAligned) c += ALIGNMENT_BONUS;
            if (momentum.direction().supports(candidate)) c += ALIGNMENT_BONUS;
            if (momentum.direction().opposes(candidate)) c -= t.getMomentumPenaltyConfidence();
        }
        return clamp(c);
    }

    List<String> bullishConfirmations(IndicatorBundle ind, MomentumState momentum, SignalTuning t) {
        List<String> out = new ArrayList<>(PREDICATES);
        if (ind.rsi() < t.getRsiOversold()) out.add("RSI oversold");
        if (ind.macdDiff() > t.getMacdStrongThreshold()) out.add("MACD strong positive");
        if (ind.bollingerPercent() < t.getBollingerOversold()) out.add("price near lower band");
        if (ind.stochK() < t.getStochasticOversold()) out.add("stochastic oversold");
        if (momentum.direction().supports(SignalAction.BUY)) out.add("momentum up");
        if (ind.adx() > t.getAdxTrendThreshold()) out.add("ADX trending");
        return out;
    }

    List<String> bearishConfirmations(IndicatorBundle ind, MomentumState momentum, SignalTuning t) {
        List<String> out = new ArrayList<>(PREDICATES);
        if (ind.rsi() > t.getRsiOverbought()) out.add("RSI overbought");
        if (ind.macdDiff() < -t.getMacdStrongThreshold()) out.add("MACD strong negative");
        if (ind.bollingerPercent() > t.getBollingerOverbought()) out.add("price near upper band");
        if (ind.stochK() > t.getStochasticOverbought()) out.add("stochastic overbought");
        if (momentum.direction().supports(SignalAction.SELL)) out.add("momentum down");
        if (ind.adx() > t.getAdxTrendThreshold()) out.add("ADX trending");
        return out;
    }

    /**
     * Bonus points for above-average volume; 0 when the provider reports none.
     */
    static double volumeBonus(double ratio) {
        if (!Double.isFinite(ratio)) return 0.0;
        if (ratio > 2.0) return 10.0;
        if (ratio > 1.5) return 7.0;
        if (ratio > 1.2) return 4.0;
        if (ratio > 1.0) return 2.0;
        return 0.0;
    }

    static int tier(int count, int strongNeed, int moderateNeed) {
        if (count >= strongNeed) return 2;
        if (count >= moderateNeed) return 1;
        return 0;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 50.0;
        return Math.max(0.0, Math.min(100.0, v));
    }
}
