package com.trade.signalengine.enums;

public enum SignalAction {
    BUY,
    SELL,
    NO_SIGNAL;

    public boolean isDirectional() {
        return this != NO_SIGNAL;
    }
}
