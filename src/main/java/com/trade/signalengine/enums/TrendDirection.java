package com.trade.signalengine.enums;

public enum TrendDirection {
    UP,
    DOWN,
    RANGING
}
