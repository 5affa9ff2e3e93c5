package com.telemetry.pipeline.storage;

import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanStatus;

import java.time.Instant;

/**
 * Tenant-scoped span query. The tenant is mandatory; every other filter is optional.
 *
 * @param tenantId      tenant whose spans are returned
 * @param serviceName   service filter, or null
 * @param operationName operation filter, or null
 * @param status        status filter, or null
 * @param minDurationMs lower bound on the duration, or null
 * @param startTime     inclusive lower bound on the span start time, or null
 * @param endTime       inclusive upper bound on the span start time, or null
 * @param limit         maximum number of results (most recent kept)
 */
public record TraceQuery(
        String tenantId,
        String serviceName,
        String operationName,
        SpanStatus status,
        Double minDurationMs,
        Instant startTime,
        Instant endTime,
        int limit
) {
    public TraceQuery {
        QueryLimits.requireTenant(tenantId);
        QueryLimits.validateRange(startTime, endTime);
        QueryLimits.validate(limit);
        if (minDurationMs != null && (minDurationMs < 0 || !Double.isFinite(minDurationMs))) {
            throw new IllegalArgumentException("minDurationMs must be a finite value >= 0");
        }
    }

    public static TraceQuery forTenant(String tenantId) {
        return builder(tenantId).build();
    }

    public boolean matches(Span span) {
        return tenantId.equals(span.tenantId())
                && (serviceName == null || serviceName.equals(span.serviceName()))
                && (operationName == null || operationName.equals(span.operationName()))
                && (status == null || status == span.status())
                && (minDurationMs == null || (span.durationMs() != null && span.durationMs() >= minDurationMs))
                && QueryLimits.inRange(span.startTime(), startTime, endTime);
    }

    public static Builder builder(String tenantId) {
        return new Builder(tenantId);
    }

    public static class Builder {
        private final String tenantId;
        private String serviceName;
        private String operationName;
        private SpanStatus status;
        private Double minDurationMs;
        private Instant startTime;
        private Instant endTime;
        private int limit = QueryLimits.DEFAULT_LIMIT;

        private Builder(String tenantId) {
            this.tenantId = tenantId;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public Builder status(SpanStatus status) {
            this.status = status;
            return this;
        }

        public Builder minDurationMs(Double minDurationMs) {
            this.minDurationMs = minDurationMs;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public TraceQuery build() {
            return new TraceQuery(tenantId, serviceName, operationName, status, minDurationMs,
                    startTime, endTime, limit);
        }
    }
}
