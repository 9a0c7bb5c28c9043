package com.tomeqa.index.controller;

import com.tomeqa.index.dto.ApiError;
import com.tomeqa.index.exception.IndexException;
import com.tomeqa.index.exception.RebuildInProgressException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

/** Maps exceptions of the REST layer to {@link ApiError} responses. */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RebuildInProgressException.class)
    public ResponseEntity<ApiError> handleRebuildInProgress(RebuildInProgressException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("[API] Rebuild conflict [{}]: {}", errorId, ex.getMessage());
        return error(HttpStatus.CONFLICT, errorId, ApiError.REBUILD_CONFLICT, ex.getMessage(), request,
                Map.of("conflictingBases", ex.getConflictingBases()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.debug("[API] Bad request [{}]: {}", errorId, ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, errorId, ApiError.BAD_REQUEST, "Validation error: " + ex.getMessage(),
                request, Map.of());
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ApiError> handleRejected(RejectedExecutionException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("[API] Rebuild executor rejected work [{}]", errorId, ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.UNAVAILABLE, "Rebuild capacity exhausted",
                request, Map.of());
    }

    @ExceptionHandler(IndexException.class)
    public ResponseEntity<ApiError> handleIndexError(IndexException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("[API] Index error [{}]: {}", errorId, ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INDEX_ERROR, ex.getMessage(), request,
                Map.of());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String errorId, String code, String message,
                                                  HttpServletRequest request, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now(), details));
    }

    private static String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
