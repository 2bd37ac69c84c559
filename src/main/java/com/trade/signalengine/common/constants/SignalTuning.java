package com.trade.signalengine.common.constants;

import com.trade.signalengine.common.exception.ValidationException;
import lombok.Data;

/**
 * Hot-reloadable thresholds. Instances handed to an evaluation are private copies and are never
 * changed afterwards; updates go through {@code EngineSettings}, which swaps in a new copy.
 */
@Data
public class SignalTuning {

    // decision
    private double minBuyScore = 60;
    private double maxSellScore = 40;
    private double minConfidence = 65;
    private boolean requireMomentum = true;
    private boolean adaptiveThresholds = true;
    private double highVolatilityPct = 0.15;
    private double lowVolatilityPct = 0.05;

    // confirmation predicates
    private double rsiOversold = 35;
    private double rsiOverbought = 65;
    private double macdStrongThreshold = 0.0001;
    private double bollingerOversold = 20;
    private double bollingerOverbought = 80;
    private double stochasticOversold = 20;
    private double stochasticOverbought = 80;
    private double adxTrendThreshold = 25;
    private double rsiTrendFloor = 40;
    private double rsiTrendCeiling = 60;

    // tiers
    private int strongConfirmations = 4;
    private int moderateConfirmations = 3;
    private int rangingExtraConfirmations = 1;
    private double strongTierOffset = 20;
    private double moderateTierOffset = 10;
    private double momentumPenaltyScore = 7;
    private double momentumPenaltyConfidence = 5;
    private boolean volumeBonus = true;

    // advisory blend; the TA weight is 1 - advisoryWeight
    private double advisoryWeight = 0.35;

    // risk
    private double atrStopMultiplier = 2.0;
    private double riskRewardRatio = 1.8;
    private double stopLossPct = 0.002;

    // pacing
    private int maxSignalsPerHour = 12;

    public double getTaWeight() {
        return 1.0 - advisoryWeight;
    }

    public SignalTuning copy() {
        SignalTuning t = new SignalTuning();
        t.minBuyScore = minBuyScore;
        t.maxSellScore = maxSellScore;
        t.minConfidence = minConfidence;
        t.requireMomentum = requireMomentum;
        t.adaptiveThresholds = adaptiveThresholds;
        t.highVolatilityPct = highVolatilityPct;
        t.lowVolatilityPct = lowVolatilityPct;
        t.rsiOversold = rsiOversold;
        t.rsiOverbought = rsiOverbought;
        t.macdStrongThreshold = macdStrongThreshold;
        t.bollingerOversold = bollingerOversold;
        t.bollingerOverbought = bollingerOverbought;
        t.stochasticOversold = stochasticOversold;
        t.stochasticOverbought = stochasticOverbought;
        t.adxTrendThreshold = adxTrendThreshold;
        t.rsiTrendFloor = rsiTrendFloor;
        t.rsiTrendCeiling = rsiTrendCeiling;
        t.strongConfirmations = strongConfirmations;
        t.moderateConfirmations = moderateConfirmations;
        t.rangingExtraConfirmations = rangingExtraConfirmations;
        t.strongTierOffset = strongTierOffset;
        t.moderateTierOffset = moderateTierOffset;
        t.momentumPenaltyScore = momentumPenaltyScore;
        t.momentumPenaltyConfidence = momentumPenaltyConfidence;
        t.volumeBonus = volumeBonus;
        t.advisoryWeight = advisoryWeight;
        t.atrStopMultiplier = atrStopMultiplier;
        t.riskRewardRatio = riskRewardRatio;
        t.stopLossPct = stopLossPct;
        t.maxSignalsPerHour = maxSignalsPerHour;
        return t;
    }

    /**
     * Cross-field checks that annotations cannot express.
     */
    public void validate() {
        requireRange("min-buy-score", minBuyScore, 0, 100);
        requireRange("max-sell-score", maxSellScore, 0, 100);
        if (maxSellScore >= minBuyScore) {
            throw new ValidationException("max-sell-score (" + maxSellScore
                    + ") must be below min-buy-score (" + minBuyScore + ")");
        }
        requireRange("min-confidence", minConfidence, 0, 100);
        requireRange("advisory-weight", advisoryWeight, 0, 1);
        requireRange("rsi-oversold", rsiOversold, 0, 100);
        requireRange("rsi-overbought", rsiOverbought, 0, 100);
        if (rsiOversold >= rsiOverbought) {
            throw new ValidationException("rsi-oversold must be below rsi-overbought");
        }
        requireRange("bollinger-oversold", bollingerOversold, 0, 100);
        requireRange("bollinger-overbought", bollingerOverbought, 0, 100);
        requireRange("stochastic-oversold", stochasticOversold, 0, 100);
        requireRange("stochastic-overbought", stochasticOverbought, 0, 100);
        requireRange("adx-trend-threshold", adxTrendThreshold, 0, 100);
        if (macdStrongThreshold < 0) throw new ValidationException("macd-strong-threshold must be >= 0");
        if (moderateConfirmations < 1 || strongConfirmations < moderateConfirmations) {
            throw new ValidationException("need 1 <= moderate-confirmations <= strong-confirmations");
        }
        if (rangingExtraConfirmations < 0) throw new ValidationException("ranging-extra-confirmations must be >= 0");
        requireRange("strong-tier-offset", strongTierOffset, 0, 50);
        requireRange("moderate-tier-offset", moderateTierOffset, 0, strongTierOffset);
        if (momentumPenaltyScore < 0 || momentumPenaltyConfidence < 0) {
            throw new ValidationException("momentum penalties must be >= 0");
        }
        if (lowVolatilityPct < 0 || highVolatilityPct <= lowVolatilityPct) {
            throw new ValidationException("need 0 <= low-volatility-pct < high-volatility-pct");
        }
        if (atrStopMultiplier <= 0 || riskRewardRatio <= 0 || stopLossPct <= 0) {
            throw new ValidationException("risk multipliers must be positive");
        }
        if (maxSignalsPerHour < 0) throw new ValidationException("max-signals-per-hour must be >= 0");
    }

    private static void requireRange(String key, double v, double lo, double hi) {
        if (!Double.isFinite(v) || v < lo || v > hi) {
            throw new ValidationException(key + " must be within [" + lo + ", " + hi + "], got " + v);
        }
    }
}
