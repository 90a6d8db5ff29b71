package com.mossbauer.analysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body returned by the HTTP layer.
 *
 * @param stage pipeline stage that failed, absent for request-level errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    String errorCode,
    String message,
    String stage,
    Instant timestamp
) {
    public static ApiError of(String errorCode, String message, String stage) {
        return new ApiError(errorCode, message, stage, Instant.now());
    }
}
