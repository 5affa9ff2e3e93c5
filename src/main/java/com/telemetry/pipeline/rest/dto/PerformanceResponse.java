package com.telemetry.pipeline.rest.dto;

import com.telemetry.pipeline.core.model.PerformanceRecord;

/**
 * JSON view of a performance record including its derived averages.
 */
public record PerformanceResponse(
        String operationName,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double avgDuration,
        double minDuration,
        double maxDuration,
        double successRate,
        String lastUpdated
) {
    public static PerformanceResponse from(PerformanceRecord record) {
        return new PerformanceResponse(
                record.operationName(),
                record.totalRequests(),
                record.successfulRequests(),
                record.failedRequests(),
                record.avgDuration(),
                record.minDuration(),
                record.maxDuration(),
                record.successRate(),
                record.lastUpdated() != null ? record.lastUpdated().toString() : null);
    }
}
