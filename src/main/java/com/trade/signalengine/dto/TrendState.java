package com.trade.signalengine.dto;

import com.trade.signalengine.enums.TrendDirection;

/**
 * @param strength 0..100, scaled from ADX; 0 for a ranging market
 */
public record TrendState(TrendDirection direction, double strength, double adx) {

    public static TrendState ranging(double adx) {
        return new TrendState(TrendDirection.RANGING, 0.0, adx);
    }

    public boolean isDirectional() {
        return direction != TrendDirection.RANGING;
    }
}
