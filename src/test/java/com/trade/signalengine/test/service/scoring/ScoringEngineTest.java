package com.trade.signalengine.test.service.scoring;

import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.dto.AdvisoryOpinion;
import com.trade.signalengine.dto.IndicatorBundle;
import com.trade.signalengine.dto.ScoreResult;
import com.trade.signalengine.enums.MomentumDirection;
import com.trade.signalengine.enums.SignalAction;
import com.trade.signalengine.enums.TrendDirection;
import com.trade.signalengine.service.scoring.ScoringEngine;
import org.junit.jupiter.api.Test;

import static com.trade.signalengine.test.support.Fixtures.bundle;
import static com.trade.signalengine.test.support.Fixtures.momentum;
import static com.trade.signalengine.test.support.Fixtures.trend;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();
    private final SignalTuning tuning = new SignalTuning();

    @Test
    void strongBullishSetupInUptrend() {
        // RSI, MACD, momentum and ADX agree; bands and stochastic neutral
        IndicatorBundle ind = bundle(28, 0.00015, 50, 30, 50);

        ScoreResult r = engine.score(ind, trend(TrendDirection.UP, 30), momentum(MomentumDirection.UP), null, tuning);

        assertThat(r.candidate()).isEqualTo(SignalAction.BUY);
        assertThat(r.confirmations()).isEqualTo(4);
        assertThat(r.taScore()).isCloseTo(70.0, within(1e-9));
        assertThat(r.confidence()).isCloseTo(85.0, within(1e-9));
        assertThat(r.finalScore()).isEqualTo(r.taScore());
        assertThat(r.hasAdvisory()).isFalse();
    }

    @Test
    void strongAdxAloneIsNotASignal() {
        IndicatorBundle ind = bundle(38, 0.00005, 50, 80, 50);

        ScoreResult r = engine.score(ind, trend(TrendDirection.UP, 80), momentum(MomentumDirection.DOWN), null, tuning);

        assertThat(r.candidate()).isEqualTo(SignalAction.NO_SIGNAL);
        assertThat(r.taScore()).isEqualTo(50.0);
        assertThat(r.confirmations()).isEqualTo(1);
        assertThat(r.confidence()).isCloseTo(47.5, within(1e-9));
    }

    @Test
    void counterTrendConfirmationsAreIgnored() {
        // every bearish predicate true, but the trend is up
        IndicatorBundle ind = bundle(80, -0.0005, 95, 30, 95);

        ScoreResult r = engine.score(ind, trend(TrendDirection.UP, 30), momentum(MomentumDirection.DOWN), null, tuning);

        assertThat(r.candidate()).isEqualTo(SignalAction.NO_SIGNAL);
        assertThat(r.taScore()).isEqualTo(50.0);
        assertThat(r.notes()).anyMatch(n -> n.startsWith("uptrend: ignored"));
    }

    @Test
    void rangingMarketNeedsOneMoreConfirmationPerTier() {
        IndicatorBundle ind = bundle(28, 0.00015, 50, 30, 50);

        ScoreResult trending = engine.score(ind, trend(TrendDirection.UP, 30), momentum(MomentumDirection.UP), null, tuning);
        ScoreResult ranging = engine.score(ind, trend(TrendDirection.RANGING, 30), momentum(MomentumDirection.UP), null, tuning);

        assertThat(trending.taScore()).isCloseTo(70.0, within(1e-9));
        assertThat(ranging.candidate()).isEqualTo(SignalAction.BUY);
        assertThat(ranging.taScore()).isCloseTo(60.0, within(1e-9));
        // no trend alignment bonus in a ranging market
        assertThat(ranging.confidence()).isCloseTo(77.5, within(1e-9));
    }

    @Test
    void opposingMomentumLowersScoreAndConfidence() {
        IndicatorBundle ind = bundle(28, 0.00015, 10, 30, 10);

        ScoreResult with = engine.score(ind, trend(TrendDirection.UP, 30), momentum(MomentumDirection.NEUTRAL), null, tuning);
        ScoreResult against = engine.score(ind, trend(TrendDirection.UP, 30), momentum(MomentumDirection.DOWN), null, tuning);

        assertThat(with.taScore()).isCloseTo(70.0, within(1e-9));
        assertThat(against.taScore()).isCloseTo(63.0, within(1e-9));
        assertThat(against.confidence()).isLessThan(with.confidence());
    }

    @Test
    void momentumPenaltyNeverCrossesNeutral() {
        tuning.setMomentumPenaltyScore(30);
        IndicatorBundle ind = bundle(80, -0.0005, 95, 30, 50);

        ScoreResult r = engine.score(ind, trend(TrendDirection.DOWN, 30), momentum(MomentumDirection.UP), null, tuning);

        assertThat(r.candidate()).isEqualTo(SignalAction.SELL);
        assertThat(r.taScore()).isEqualTo(50.0);
    }

    @Test
    void moreConfirmationsNeverLowerTheScore() {
        double prev = 50.0;
        IndicatorBundle[] growing = {
                bundle(50, 0.0, 50, 20, 50),
                bundle(28, 0.0, 50, 20, 50),
                bundle(28, 0.00015, 50, 20, 50),
                bundle(28, 0.00015, 10, 20, 50),
                bundle(28, 0.00015, 10, 20, 10),
                bundle(28, 0.00015, 10, 30, 10),
        };
        for (IndicatorBundle ind : growing) {
            ScoreResult r = engine.score(ind, trend(TrendDirection.UP, 30), momentum(MomentumDirection.NEUTRAL), null, tuning);
            assertThat(r.taScore()).isGreaterThanOrEqualTo(prev);
            prev = r.taScore();
        }
        assertThat(prev).isCloseTo(70.0, within(1e-9));
    }

    @Test
    void volumeBonusAddsInTheCandidateDirection() {
        IndicatorBundle base = bundle(80, -0.0005, 95, 30, 95);
        IndicatorBundle loud = new IndicatorBundle(base.version(), base.price(), base.rsi(), base.macdLine(),
                base.macdSignal(), base.macdDiff(), base.bollingerPercent(), base.atr(), base.adx(),
                base.stochK(), base.stochD(), 2.5, base.trend(), base.momentum());

        ScoreResult r = engine.score(loud, trend(TrendDirection.DOWN, 30), momentum(MomentumDirection.DOWN), null, tuning);

        assertThat(r.candidate()).isEqualTo(SignalAction.SELL);
        assertThat(r.taScore()).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void scoresStayWithinBounds() {
        tuning.setStrongTierOffset(50);
        tuning.setModerateTierOffset(50);
        IndicatorBundle base = bundle(5, 0.01, 0, 90, 0);
        IndicatorBundle loud = new IndicatorBundle(base.version(), base.price(), base.rsi(), base.macdLine(),
                base.macdSignal(), base.macdDiff(), base.bollingerPercent(), base.atr(), base.adx(),
                base.stochK(), base.stochD(), 5.0, base.trend(), base.momentum());

        ScoreResult r = engine.score(loud, trend(TrendDirection.UP, 90), momentum(MomentumDirection.UP),
                new AdvisoryOpinion(250, "very bullish", "test"), tuning);

        assertThat(r.taScore()).isEqualTo(100.0);
        assertThat(r.advisoryScore()).isEqualTo(100.0);
        assertThat(r.finalScore()).isBetween(0.0, 100.0);
        assertThat(r.confidence()).isBetween(0.0, 100.0);
    }

    @Test
    void advisoryScoreIsBlendedByWeight() {
        IndicatorBundle ind = bundle(28, 0.00015, 50, 30, 50);

        ScoreResult r = engine.score(ind, trend(TrendDirection.UP, 30), momentum(MomentumDirection.UP),
                new AdvisoryOpinion(30, "bearish news", "test"), tuning);

        // 0.35 * 30 + 0.65 * 70
        assertThat(r.finalScore()).isCloseTo(56.0, within(1e-9));
        assertThat(r.taScore()).isCloseTo(70.0, within(1e-9));
        assertThat(r.advisoryRationale()).isEqualTo("bearish news");
    }
}
