package com.trade.signalengine.dto;

import java.util.List;

/**
 * One finished evaluation: the signal plus the scoring metadata that produced it.
 * Handed unchanged to every publisher.
 */
public record Evaluation(
        Signal signal,
        IndicatorBundle indicators,
        ScoreResult score,
        Thresholds thresholds,
        List<String> reasons,
        String dataSource
) {
}
