package com.trade.signalengine.enums;

public enum SourceErrorKind {
    /** Rate limit or plan quota reached. */
    QUOTA,
    TIMEOUT,
    HTTP_ERROR,
    /** Provider answered with its own error envelope. */
    PROVIDER_ERROR,
    MALFORMED,
    NOT_CONFIGURED
}
