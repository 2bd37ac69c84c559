package com.trade.signalengine.config;

import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.common.exception.ValidationException;

import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Whitelist of tuning options that may be changed at runtime, by their configuration key.
 */
public enum TuningKey {
    MIN_BUY_SCORE("min-buy-score", SignalTuning::getMinBuyScore, (t, v) -> t.setMinBuyScore(num(v))),
    MAX_SELL_SCORE("max-sell-score", SignalTuning::getMaxSellScore, (t, v) -> t.setMaxSellScore(num(v))),
    MIN_CONFIDENCE("min-confidence", SignalTuning::getMinConfidence, (t, v) -> t.setMinConfidence(num(v))),
    REQUIRE_MOMENTUM("require-momentum", SignalTuning::isRequireMomentum, (t, v) -> t.setRequireMomentum(bool(v))),
    ADAPTIVE_THRESHOLDS("adaptive-thresholds", SignalTuning::isAdaptiveThresholds, (t, v) -> t.setAdaptiveThresholds(bool(v))),
    HIGH_VOLATILITY_PCT("high-volatility-pct", SignalTuning::getHighVolatilityPct, (t, v) -> t.setHighVolatilityPct(num(v))),
    LOW_VOLATILITY_PCT("low-volatility-pct", SignalTuning::getLowVolatilityPct, (t, v) -> t.setLowVolatilityPct(num(v))),
    RSI_OVERSOLD("rsi-oversold", SignalTuning::getRsiOversold, (t, v) -> t.setRsiOversold(num(v))),
    RSI_OVERBOUGHT("rsi-overbought", SignalTuning::getRsiOverbought, (t, v) -> t.setRsiOverbought(num(v))),
    MACD_STRONG_THRESHOLD("macd-strong-threshold", SignalTuning::getMacdStrongThreshold, (t, v) -> t.setMacdStrongThreshold(num(v))),
    BOLLINGER_OVERSOLD("bollinger-oversold", SignalTuning::getBollingerOversold, (t, v) -> t.setBollingerOversold(num(v))),
    BOLLINGER_OVERBOUGHT("bollinger-overbought", SignalTuning::getBollingerOverbought, (t, v) -> t.setBollingerOverbought(num(v))),
    STOCHASTIC_OVERSOLD("stochastic-oversold", SignalTuning::getStochasticOversold, (t, v) -> t.setStochasticOversold(num(v))),
    STOCHASTIC_OVERBOUGHT("stochastic-overbought", SignalTuning::getStochasticOverbought, (t, v) -> t.setStochasticOverbought(num(v))),
    ADX_TREND_THRESHOLD("adx-trend-threshold", SignalTuning::getAdxTrendThreshold, (t, v) -> t.setAdxTrendThreshold(num(v))),
    RSI_TREND_FLOOR("rsi-trend-floor", SignalTuning::getRsiTrendFloor, (t, v) -> t.setRsiTrendFloor(num(v))),
    RSI_TREND_CEILING("rsi-trend-ceiling", SignalTuning::getRsiTrendCeiling, (t, v) -> t.setRsiTrendCeiling(num(v))),
    STRONG_CONFIRMATIONS("strong-confirmations", SignalTuning::getStrongConfirmations, (t, v) -> t.setStrongConfirmations(integer(v))),
    MODERATE_CONFIRMATIONS("moderate-confirmations", SignalTuning::getModerateConfirmations, (t, v) -> t.setModerateConfirmations(integer(v))),
    RANGING_EXTRA_CONFIRMATIONS("ranging-extra-confirmations", SignalTuning::getRangingExtraConfirmations, (t, v) -> t.setRangingExtraConfirmations(integer(v))),
    STRONG_TIER_OFFSET("strong-tier-offset", SignalTuning::getStrongTierOffset, (t, v) -> t.setStrongTierOffset(num(v))),
    MODERATE_TIER_OFFSET("moderate-tier-offset", SignalTuning::getModerateTierOffset, (t, v) -> t.setModerateTierOffset(num(v))),
    MOMENTUM_PENALTY_SCORE("momentum-penalty-score", SignalTuning::getMomentumPenaltyScore, (t, v) -> t.setMomentumPenaltyScore(num(v))),
    MOMENTUM_PENALTY_CONFIDENCE("momentum-penalty-confidence", SignalTuning::getMomentumPenaltyConfidence, (t, v) -> t.setMomentumPenaltyConfidence(num(v))),
    VOLUME_BONUS("volume-bonus", SignalTuning::isVolumeBonus, (t, v) -> t.setVolumeBonus(bool(v))),
    ADVISORY_WEIGHT("advisory-weight", SignalTuning::getAdvisoryWeight, (t, v) -> t.setAdvisoryWeight(num(v))),
    ATR_STOP_MULTIPLIER("atr-stop-multiplier", SignalTuning::getAtrStopMultiplier, (t, v) -> t.setAtrStopMultiplier(num(v))),
    RISK_REWARD_RATIO("risk-reward-ratio", SignalTuning::getRiskRewardRatio, (t, v) -> t.setRiskRewardRatio(num(v))),
    STOP_LOSS_PCT("stop-loss-pct", SignalTuning::getStopLossPct, (t, v) -> t.setStopLossPct(num(v))),
    MAX_SIGNALS_PER_HOUR("max-signals-per-hour", SignalTuning::getMaxSignalsPerHour, (t, v) -> t.setMaxSignalsPerHour(integer(v)));

    private final String key;
    private final Function<SignalTuning, Object> getter;
    private final BiConsumer<SignalTuning, String> setter;

    TuningKey(String key, Function<SignalTuning, Object> getter, BiConsumer<SignalTuning, String> setter) {
        this.key = key;
        this.getter = getter;
        this.setter = setter;
    }

    public String key() {
        return key;
    }

    public Object read(SignalTuning tuning) {
        return getter.apply(tuning);
    }

    void apply(SignalTuning tuning, String value) {
        setter.accept(tuning, value);
    }

    /**
     * Resolves "min-buy-score", "min_buy_score" or "MIN_BUY_SCORE".
     */
    public static TuningKey of(String key) {
        if (key == null) throw new ValidationException("key is required");
        String k = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (TuningKey t : values()) {
            if (t.key.equals(k)) return t;
        }
        throw new ValidationException("Unknown tuning key: " + key);
    }

    private static double num(String v) {
        try {
            return Double.parseDouble(v.trim());
        } catch (RuntimeException e) {
            throw new ValidationException("Not a number: " + v, e);
        }
    }

    private static int integer(String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (RuntimeException e) {
            throw new ValidationException("Not an integer: " + v, e);
        }
    }

    private static boolean bool(String v) {
        String s = v == null ? "" : v.trim().toLowerCase(Locale.ROOT);
        if (s.equals("true") || s.equals("false")) return Boolean.parseBoolean(s);
        throw new ValidationException("Not a boolean: " + v);
    }
}
