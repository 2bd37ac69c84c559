package com.trade.signalengine.test.config;

import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.common.exception.ValidationException;
import com.trade.signalengine.config.EngineSettings;
import com.trade.signalengine.config.TuningKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineSettingsTest {

    private final EngineSettings settings = new EngineSettings(new SignalTuning());

    @Test
    void updateAcceptsAnyKeySpelling() {
        assertThat(settings.update("min-confidence", "70")).isEqualTo(70.0);
        assertThat(settings.update("MAX_SIGNALS_PER_HOUR", "3")).isEqualTo(3);
        assertThat(settings.update("require_momentum", "false")).isEqualTo(false);

        SignalTuning t = settings.snapshot();
        assertThat(t.getMinConfidence()).isEqualTo(70.0);
        assertThat(t.getMaxSignalsPerHour()).isEqualTo(3);
        assertThat(t.isRequireMomentum()).isFalse();
    }

    @Test
    void unknownKeyIsRejected() {
        assertThatThrownBy(() -> settings.update("api-key", "secret"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown tuning key");
    }

    @Test
    void invalidValueKeepsPreviousSnapshot() {
        assertThatThrownBy(() -> settings.update("max-sell-score", "65"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("max-sell-score");
        assertThatThrownBy(() -> settings.update("advisory-weight", "abc"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> settings.update("volume-bonus", "yes"))
                .isInstanceOf(ValidationException.class);

        SignalTuning t = settings.snapshot();
        assertThat(t.getMaxSellScore()).isEqualTo(40.0);
        assertThat(t.getAdvisoryWeight()).isEqualTo(0.35);
        assertThat(t.isVolumeBonus()).isTrue();
    }

    @Test
    void snapshotsAreIsolatedFromLaterUpdates() {
        SignalTuning before = settings.snapshot();
        settings.update("min-buy-score", "65");

        assertThat(before.getMinBuyScore()).isEqualTo(60.0);
        assertThat(settings.snapshot().getMinBuyScore()).isEqualTo(65.0);

        before.setMinBuyScore(99);
        assertThat(settings.snapshot().getMinBuyScore()).isEqualTo(65.0);
    }

    @Test
    void describeListsEveryWhitelistedKey() {
        assertThat(settings.describe())
                .containsKeys(TuningKey.MIN_BUY_SCORE.key(), TuningKey.ADVISORY_WEIGHT.key(), "ta-weight")
                .hasSize(TuningKey.values().length + 1);
    }

    @Test
    void invalidStartupTuningIsRejected() {
        SignalTuning bad = new SignalTuning();
        bad.setModerateConfirmations(5);
        bad.setStrongConfirmations(4);

        assertThatThrownBy(() -> new EngineSettings(bad)).isInstanceOf(ValidationException.class);
    }
}
