package com.telemetry.pipeline.rest.dto;

import com.telemetry.pipeline.context.CorrelationContextHolder;

import java.time.Instant;

/**
 * Error body returned by the telemetry read API.
 *
 * <p>{@code traceId} is the trace of the failing request, taken from the current correlation
 * context, so a client can look the failure up under {@code /traces/{traceId}}.</p>
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        String traceId,
        Instant timestamp
) {
    static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(status, error, message, path, CorrelationContextHolder.getTraceId(), Instant.now());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return of(400, "Bad Request", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return of(404, "Not Found", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return of(500, "Internal Server Error", message, path);
    }
}
