package com.signalplatform.orchestrator.exception;

import com.signalplatform.common.exception.InsufficientHistoryException;
import com.signalplatform.common.exception.MissedTickException;
import com.signalplatform.common.exception.PredictorException;
import com.signalplatform.common.exception.ReplayDivergenceException;
import com.signalplatform.common.exception.SchemaMismatchException;
import com.signalplatform.common.exception.SignalPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.NoSuchElementException;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /** No decision this tick: the caller skips, it is not a server fault. */
    @ExceptionHandler(InsufficientHistoryException.class)
    public ResponseEntity<ApiError> handleInsufficientHistory(InsufficientHistoryException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "INSUFFICIENT_HISTORY", ex);
    }

    @ExceptionHandler(MissedTickException.class)
    public ResponseEntity<ApiError> handleMissedTick(MissedTickException ex) {
        return build(HttpStatus.GATEWAY_TIMEOUT, "MISSED_TICK", ex);
    }

    @ExceptionHandler(SchemaMismatchException.class)
    public ResponseEntity<ApiError> handleSchemaMismatch(SchemaMismatchException ex) {
        return build(HttpStatus.CONFLICT, "SCHEMA_MISMATCH", ex);
    }

    /** Only reaches here from a registry reload; cycle-time predictor failures are absorbed. */
    @ExceptionHandler(PredictorException.class)
    public ResponseEntity<ApiError> handleInvalidRegistry(PredictorException ex) {
        return build(HttpStatus.CONFLICT, "INVALID_REGISTRY_ENTRY", ex);
    }

    @ExceptionHandler(ReplayDivergenceException.class)
    public ResponseEntity<ApiError> handleReplayDivergence(ReplayDivergenceException ex) {
        log.error("[ErrorHandler] Replay divergence. instrument={} message={}", ex.getInstrument(), ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "REPLAY_DIVERGENCE", ex);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
            .map(e -> e.getField() + ": " + e.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("VALIDATION_FAILED", message.isEmpty() ? ex.getReason() : message));
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiError> handleNotFound(NoSuchElementException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex);
    }

    @ExceptionHandler(SignalPlatformException.class)
    public ResponseEntity<ApiError> handlePlatform(SignalPlatformException ex) {
        log.error("[ErrorHandler] Platform error. message={}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "PLATFORM_ERROR", ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("[ErrorHandler] Unexpected error. type={} message={}", ex.getClass().getSimpleName(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError("INTERNAL_ERROR", "unexpected error"));
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String code, Exception ex) {
        if (status.is4xxClientError()) {
            log.debug("[ErrorHandler] {} {}. message={}", status.value(), code, ex.getMessage());
        }
        return ResponseEntity.status(status).body(new ApiError(code, ex.getMessage()));
    }
}
