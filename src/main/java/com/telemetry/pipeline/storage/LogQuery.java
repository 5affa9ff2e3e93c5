package com.telemetry.pipeline.storage;

import com.telemetry.pipeline.core.model.LogEntry;
import com.telemetry.pipeline.core.model.LogLevel;

import java.time.Instant;
import java.util.Set;

/**
 * Tenant-scoped log query. The tenant is mandatory; every other filter is optional.
 *
 * @param tenantId  tenant whose entries are returned
 * @param levels    levels to include, empty for all
 * @param service   service name filter, or null
 * @param traceId   trace filter, or null
 * @param startTime inclusive lower bound on the timestamp, or null
 * @param endTime   inclusive upper bound on the timestamp, or null
 * @param limit     maximum number of results (most recent kept)
 */
public record LogQuery(
        String tenantId,
        Set<LogLevel> levels,
        String service,
        String traceId,
        Instant startTime,
        Instant endTime,
        int limit
) {
    public LogQuery {
        QueryLimits.requireTenant(tenantId);
        QueryLimits.validateRange(startTime, endTime);
        QueryLimits.validate(limit);
        levels = levels != null ? Set.copyOf(levels) : Set.of();
    }

    public static LogQuery forTenant(String tenantId) {
        return builder(tenantId).build();
    }

    public boolean matches(LogEntry entry) {
        return tenantId.equals(entry.tenantId())
                && (levels.isEmpty() || levels.contains(entry.level()))
                && (service == null || service.equals(entry.service()))
                && (traceId == null || traceId.equals(entry.traceId()))
                && QueryLimits.inRange(entry.timestamp(), startTime, endTime);
    }

    public static Builder builder(String tenantId) {
        return new Builder(tenantId);
    }

    public static class Builder {
        private final String tenantId;
        private Set<LogLevel> levels;
        private String service;
        private String traceId;
        private Instant startTime;
        private Instant endTime;
        private int limit = QueryLimits.DEFAULT_LIMIT;

        private Builder(String tenantId) {
            this.tenantId = tenantId;
        }

        public Builder levels(Set<LogLevel> levels) {
            this.levels = levels;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
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

        public LogQuery build() {
            return new LogQuery(tenantId, levels, service, traceId, startTime, endTime, limit);
        }
    }
}
