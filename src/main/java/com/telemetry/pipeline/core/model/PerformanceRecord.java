package com.telemetry.pipeline.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Running statistics for one operation name.
 * Instances are immutable; {@link #record(double, boolean, Instant)} produces the successor
 * record using running sums only.
 *
 * @param operationName      operation the statistics belong to
 * @param totalRequests      number of finished spans observed
 * @param successfulRequests spans finished with {@link SpanStatus#OK}
 * @param failedRequests     spans finished with {@link SpanStatus#ERROR}
 * @param totalDuration      sum of durations in milliseconds
 * @param minDuration        smallest observed duration in milliseconds
 * @param maxDuration        largest observed duration in milliseconds
 * @param lastUpdated        time of the latest observation
 */
public record PerformanceRecord(
        String operationName,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double totalDuration,
        double minDuration,
        double maxDuration,
        Instant lastUpdated
) {
    public PerformanceRecord {
        Objects.requireNonNull(operationName, "operationName is required");
        if (totalRequests != successfulRequests + failedRequests) {
            throw new IllegalArgumentException("totalRequests must equal successful + failed requests");
        }
    }

    /**
     * Creates the record for the first observation of an operation.
     */
    public static PerformanceRecord first(String operationName, double durationMs, boolean success, Instant at) {
        return new PerformanceRecord(operationName, 1, success ? 1 : 0, success ? 0 : 1,
                durationMs, durationMs, durationMs, at);
    }

    /**
     * Returns the record updated with one more observation.
     */
    public PerformanceRecord record(double durationMs, boolean success, Instant at) {
        return new PerformanceRecord(
                operationName,
                totalRequests + 1,
                successfulRequests + (success ? 1 : 0),
                failedRequests + (success ? 0 : 1),
                totalDuration + durationMs,
                Math.min(minDuration, durationMs),
                Math.max(maxDuration, durationMs),
                at);
    }

    /**
     * Average duration in milliseconds, 0.0 when nothing was recorded.
     */
    public double avgDuration() {
        return totalRequests == 0 ? 0.0 : totalDuration / totalRequests;
    }

    /**
     * Fraction of successful requests (0.0 to 1.0), 0.0 when nothing was recorded.
     */
    public double successRate() {
        return totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests;
    }
}
