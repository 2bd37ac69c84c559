package com.trade.signalengine.enums;

public enum MomentumDirection {
    UP,
    DOWN,
    NEUTRAL;

    /**
     * True when this momentum points against the given candidate action.
     */
    public boolean opposes(SignalAction action) {
        return (action == SignalAction.BUY && this == DOWN)
                || (action == SignalAction.SELL && this == UP);
    }

    public boolean supports(SignalAction action) {
        return (action == SignalAction.BUY && this == UP)
                || (action == SignalAction.SELL && this == DOWN);
    }
}
