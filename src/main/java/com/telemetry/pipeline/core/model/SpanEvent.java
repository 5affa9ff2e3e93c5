package com.telemetry.pipeline.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A timestamped annotation on a span, such as a retry or a cache miss.
 */
public record SpanEvent(String name, Instant timestamp, Map<String, Object> attributes) {

    public SpanEvent {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name must not be null or blank");
        }
        Objects.requireNonNull(timestamp, "timestamp is required");
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }
}
