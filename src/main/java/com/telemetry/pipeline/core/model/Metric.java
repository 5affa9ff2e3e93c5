package com.telemetry.pipeline.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable metric sample owned by exactly one tenant.
 */
public record Metric(
        String name,
        MetricType type,
        double value,
        Instant timestamp,
        Map<String, String> labels,
        String tenantId
) {
    /** Maximum allowed length for metric names. */
    public static final int MAX_NAME_LENGTH = 255;

    public Metric {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be null or blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Metric name exceeds maximum length of " + MAX_NAME_LENGTH + " characters");
        }
        Objects.requireNonNull(type, "type is required");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Metric value must be finite, got " + value);
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        timestamp = timestamp != null ? timestamp : Instant.now();
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    public static Metric counter(String tenantId, String name, double value) {
        return new Metric(name, MetricType.COUNTER, value, Instant.now(), Map.of(), tenantId);
    }

    public static Metric gauge(String tenantId, String name, double value) {
        return new Metric(name, MetricType.GAUGE, value, Instant.now(), Map.of(), tenantId);
    }

    public static Metric histogram(String tenantId, String name, double value) {
        return new Metric(name, MetricType.HISTOGRAM, value, Instant.now(), Map.of(), tenantId);
    }

    /**
     * Returns a copy carrying the given labels.
     */
    public Metric withLabels(Map<String, String> newLabels) {
        return new Metric(name, type, value, timestamp, newLabels, tenantId);
    }
}
