package com.trade.signalengine.dto;

import com.trade.signalengine.enums.MomentumDirection;

/**
 * @param changePct percent change of close over the look-back window
 * @param strength  0..100, scaled from the magnitude of the change
 */
public record MomentumState(double changePct, MomentumDirection direction, double strength) {

    public static MomentumState neutral() {
        return new MomentumState(0.0, MomentumDirection.NEUTRAL, 0.0);
    }
}
