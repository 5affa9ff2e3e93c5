package com.telemetry.pipeline.core.model;

import com.telemetry.pipeline.context.CorrelationContext;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable structured log entry owned by exactly one tenant.
 * Correlation identifiers are optional and normally copied from the current
 * {@link CorrelationContext} through {@link Builder#correlation(CorrelationContext)}.
 */
public record LogEntry(
        String id,
        Instant timestamp,
        LogLevel level,
        String message,
        String tenantId,
        String service,
        String component,
        Map<String, Object> fields,
        String requestId,
        String correlationId,
        String userId,
        String traceId,
        String spanId
) {
    public LogEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(message, "message is required");
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private Instant timestamp = Instant.now();
        private LogLevel level = LogLevel.INFO;
        private String message;
        private String tenantId;
        private String service;
        private String component;
        private Map<String, Object> fields;
        private String requestId;
        private String correlationId;
        private String userId;
        private String traceId;
        private String spanId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder component(String component) {
            this.component = component;
            return this;
        }

        public Builder fields(Map<String, Object> fields) {
            this.fields = fields;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder spanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        /**
         * Copies tenant, user and correlation identifiers from a context snapshot.
         * Values already set explicitly on this builder are kept.
         */
        public Builder correlation(CorrelationContext context) {
            if (context == null) {
                return this;
            }
            if (tenantId == null) {
                tenantId = context.tenantId();
            }
            if (userId == null) {
                userId = context.userId();
            }
            if (correlationId == null) {
                correlationId = context.correlationId();
            }
            if (requestId == null) {
                requestId = context.correlationId();
            }
            if (traceId == null) {
                traceId = context.traceId();
            }
            if (spanId == null) {
                spanId = context.spanId();
            }
            return this;
        }

        public LogEntry build() {
            return new LogEntry(id, timestamp, level, message, tenantId, service, component, fields,
                    requestId, correlationId, userId, traceId, spanId);
        }
    }
}
