package com.securityops.devicesync.controller;

import com.securityops.devicesync.exception.CrossSyncException;
import com.securityops.devicesync.exception.CrossSyncInProgressException;
import com.securityops.devicesync.exception.InvalidQueryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(InvalidQueryException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidQuery(InvalidQueryException e) {
        log.warn("Rejected query: {}", e.getMessage());
        return errorBody("BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Rejected query parameter {}: {}", e.getName(), e.getValue());
        return errorBody("BAD_REQUEST", "Invalid value for parameter '" + e.getName() + "'");
    }

    @ExceptionHandler(CrossSyncInProgressException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleInProgress(CrossSyncInProgressException e) {
        return errorBody("SYNC_IN_PROGRESS", e.getMessage());
    }

    @ExceptionHandler(CrossSyncException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleCrossSyncFailure(CrossSyncException e) {
        log.error("❌ Device cross-sync request failed during {}: {}", e.getPhase(), e.getMessage());
        return errorBody("CROSS_SYNC_FAILED", e.getMessage());
    }

    private Map<String, Object> errorBody(String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("timestamp", Instant.now(clock).toString());
        return body;
    }
}
