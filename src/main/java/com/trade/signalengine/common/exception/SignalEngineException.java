package com.trade.signalengine.common.exception;

import lombok.Getter;

/**
 * Base exception for the signal pipeline. Every subclass is recoverable at cycle level:
 * the worst outcome is a skipped evaluation, never a stopped scheduler.
 */
@Getter
public abstract class SignalEngineException extends RuntimeException {

    private final String errorCode;

    protected SignalEngineException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected SignalEngineException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
