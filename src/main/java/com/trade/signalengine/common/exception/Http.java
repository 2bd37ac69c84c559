package com.trade.signalengine.common.exception;

import com.trade.signalengine.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        }
        String errorCode = r.getErrorCode();
        if (errorCode == null) {
            return ResponseEntity.badRequest().body(r.getError());
        }

        HttpStatus status = switch (errorCode) {
            case "ERR-VAL-001", "UNKNOWN_INSTRUMENT" -> HttpStatus.BAD_REQUEST;
            case "THROTTLED", "RATE_LIMITED" -> HttpStatus.TOO_MANY_REQUESTS;
            case "NO_DATA", "SOURCE_UNAVAILABLE" -> HttpStatus.BAD_GATEWAY;
            case "INSUFFICIENT_HISTORY", "MARKET_CLOSED" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "ADVISORY_TIMEOUT" -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        return ResponseEntity.status(status).body(new ErrorResponse(r.getErrorCode(), r.getError(), r.getTimestamp()));
    }

    /**
     * Error body returned to clients.
     */
    public record ErrorResponse(String code, String message, java.time.Instant timestamp) {}
}
