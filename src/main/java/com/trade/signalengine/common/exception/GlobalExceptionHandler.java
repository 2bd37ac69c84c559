package com.trade.signalengine.common.exception;

import com.trade.signalengine.common.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SignalEngineException.class)
    public ResponseEntity<?> handleEngine(SignalEngineException ex) {
        log.warn("Request failed [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return Http.from(Result.fail(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException ex) {
        return Http.from(Result.fail("ERR-VAL-001", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return Http.from(Result.fail("ERR-SYS-001", "Internal error"));
    }
}
