package com.trade.signalengine.dto;

import com.trade.signalengine.enums.SignalAction;

import java.time.Instant;

/**
 * Terminal decision record handed to delivery and storage collaborators.
 * Risk levels are null for {@link SignalAction#NO_SIGNAL}.
 */
public record Signal(
        String instrument,
        SignalAction action,
        double price,
        double score,
        double confidence,
        Double stopLoss,
        Double takeProfit,
        Instant timestamp
) {
    public static Signal none(String instrument, double price, double score, double confidence, Instant at) {
        return new Signal(instrument, SignalAction.NO_SIGNAL, price, score, confidence, null, null, at);
    }

    public boolean isDirectional() {
        return action.isDirectional();
    }
}
