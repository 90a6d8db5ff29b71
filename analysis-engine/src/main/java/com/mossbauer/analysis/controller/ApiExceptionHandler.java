package com.mossbauer.analysis.controller;

import com.mossbauer.analysis.dto.ApiError;
import com.mossbauer.common.exception.DataFormatException;
import com.mossbauer.common.exception.DataTypeException;
import com.mossbauer.common.exception.FitConvergenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps analysis failures to HTTP responses.
 *
 * <ul>
 *   <li>{@link DataFormatException}, {@link DataTypeException}, bad request options → 400</li>
 *   <li>{@link FitConvergenceException} → 422; the caller may retry with other options</li>
 *   <li>anything else → 500</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DataFormatException.class)
    public ResponseEntity<ApiError> handleDataFormat(DataFormatException ex) {
        log.warn("[ApiExceptionHandler] Rejected spectrum file. reason={}", ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of("DATA_FORMAT", ex.getReason(), ex.getStage()));
    }

    @ExceptionHandler(DataTypeException.class)
    public ResponseEntity<ApiError> handleDataType(DataTypeException ex) {
        log.warn("[ApiExceptionHandler] Non-numeric spectrum value. row={} column={}", ex.getRow(), ex.getColumn());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of("DATA_TYPE", ex.getMessage(), ex.getStage()));
    }

    @ExceptionHandler(FitConvergenceException.class)
    public ResponseEntity<ApiError> handleFitConvergence(FitConvergenceException ex) {
        log.warn("[ApiExceptionHandler] Fit failed. lineShape={} sites={} variables={} reason={}",
            ex.getLineShape(), ex.getSiteCount(), ex.getVariableCount(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(ApiError.of("FIT_CONVERGENCE", ex.getMessage(), ex.getStage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleInvalidOptions(IllegalArgumentException ex) {
        log.warn("[ApiExceptionHandler] Invalid fitting options. reason={}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of("INVALID_OPTIONS", ex.getMessage(), null));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex) {
        log.warn("[ApiExceptionHandler] Request rejected. status={} reason={}", ex.getStatusCode(), ex.getReason());
        return ResponseEntity.status(ex.getStatusCode())
            .body(ApiError.of("REQUEST_REJECTED", ex.getReason(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("[ApiExceptionHandler] Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiError.of("INTERNAL_ERROR", "An unexpected error occurred", null));
    }
}
