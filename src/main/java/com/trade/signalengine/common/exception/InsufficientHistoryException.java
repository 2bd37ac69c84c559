package com.trade.signalengine.common.exception;

import lombok.Getter;

@Getter
public class InsufficientHistoryException extends SignalEngineException {

    private final int available;
    private final int required;

    public InsufficientHistoryException(int available, int required) {
        super("Series has " + available + " candles, indicators need at least " + required);
        this.available = available;
        this.required = required;
    }

    @Override
    protected String getDefaultErrorCode() {
        return "INSUFFICIENT_HISTORY";
    }
}
