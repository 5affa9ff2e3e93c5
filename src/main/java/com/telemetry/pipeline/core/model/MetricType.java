package com.telemetry.pipeline.core.model;

/**
 * Kinds of metric samples accepted by the ingestion pipeline.
 */
public enum MetricType {
    COUNTER,
    GAUGE,
    HISTOGRAM;

    /**
     * Parses a metric type name case-insensitively.
     *
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static MetricType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric type must not be null or blank");
        }
        try {
            return MetricType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown metric type: " + value);
        }
    }
}
