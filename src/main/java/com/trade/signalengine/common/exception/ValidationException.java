package com.trade.signalengine.common.exception;

/**
 * Rejected configuration value or request parameter.
 */
public class ValidationException extends SignalEngineException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-VAL-001";
    }
}
