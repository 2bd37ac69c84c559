package com.trade.signalengine.common.exception;

/**
 * The advisory score did not arrive within the wait budget. Scoring continues on technicals only.
 */
public class AdvisoryTimeoutException extends SignalEngineException {

    public AdvisoryTimeoutException(String message) {
        super(message);
    }

    public AdvisoryTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ADVISORY_TIMEOUT";
    }
}
