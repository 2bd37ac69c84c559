package com.trade.signalengine.common;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Outcome envelope handed from services to the web layer.
 * A failure carries a machine-readable code (e.g. {@code NO_DATA}) and a message.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    public static <T> Result<T> fail(String code, Throwable t) {
        String msg = (t == null)
                ? "Unknown error"
                : (t.getMessage() == null ? t.toString() : t.getMessage());
        return new Result<>(false, null, msg, code);
    }

    public boolean isOk() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
