package com.trade.signalengine.dto;

import com.trade.signalengine.enums.SignalAction;

import java.util.List;

/**
 * Output of the scoring stage. Recomputed every evaluation, never persisted here.
 *
 * @param candidate      direction the confirmations point to, NO_SIGNAL when neither side qualifies
 * @param advisoryScore  null when the advisory input was disabled, failed or arrived too late
 */
public record ScoreResult(
        double taScore,
        int confirmations,
        SignalAction candidate,
        Double advisoryScore,
        String advisoryRationale,
        double finalScore,
        double confidence,
        List<String> notes
) {
    public boolean hasAdvisory() {
        return advisoryScore != null;
    }
}
