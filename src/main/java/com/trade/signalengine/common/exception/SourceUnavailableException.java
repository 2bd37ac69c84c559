package com.trade.signalengine.common.exception;

import com.trade.signalengine.enums.SourceErrorKind;
import lombok.Getter;

/**
 * A single upstream provider could not deliver a usable series. Triggers fallback to the next source.
 */
@Getter
public class SourceUnavailableException extends SignalEngineException {

    private final String source;
    private final SourceErrorKind kind;

    public SourceUnavailableException(String source, SourceErrorKind kind, String message) {
        super(source + " [" + kind + "]: " + message);
        this.source = source;
        this.kind = kind;
    }

    public SourceUnavailableException(String source, SourceErrorKind kind, String message, Throwable cause) {
        super(source + " [" + kind + "]: " + message, cause);
        this.source = source;
        this.kind = kind;
    }

    @Override
    protected String getDefaultErrorCode() {
        return "SOURCE_UNAVAILABLE";
    }
}
