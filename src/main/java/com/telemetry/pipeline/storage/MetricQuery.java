package com.telemetry.pipeline.storage;

import com.telemetry.pipeline.core.model.Metric;

import java.time.Instant;
import java.util.Set;

/**
 * Tenant-scoped metric query. The tenant is mandatory; every other filter is optional.
 *
 * @param tenantId    tenant whose metrics are returned
 * @param metricNames metric names to include, empty for all
 * @param startTime   inclusive lower bound on the timestamp, or null
 * @param endTime     inclusive upper bound on the timestamp, or null
 * @param limit       maximum number of results (most recent kept)
 */
public record MetricQuery(
        String tenantId,
        Set<String> metricNames,
        Instant startTime,
        Instant endTime,
        int limit
) {
    public MetricQuery {
        QueryLimits.requireTenant(tenantId);
        QueryLimits.validateRange(startTime, endTime);
        QueryLimits.validate(limit);
        metricNames = metricNames != null ? Set.copyOf(metricNames) : Set.of();
    }

    public static MetricQuery forTenant(String tenantId) {
        return builder(tenantId).build();
    }

    public boolean matches(Metric metric) {
        return tenantId.equals(metric.tenantId())
                && (metricNames.isEmpty() || metricNames.contains(metric.name()))
                && QueryLimits.inRange(metric.timestamp(), startTime, endTime);
    }

    public static Builder builder(String tenantId) {
        return new Builder(tenantId);
    }

    public static class Builder {
        private final String tenantId;
        private Set<String> metricNames;
        private Instant startTime;
        private Instant endTime;
        private int limit = QueryLimits.DEFAULT_LIMIT;

        private Builder(String tenantId) {
            this.tenantId = tenantId;
        }

        public Builder metricNames(Set<String> metricNames) {
            this.metricNames = metricNames;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricNames = Set.of(metricName);
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

        public MetricQuery build() {
            return new MetricQuery(tenantId, metricNames, startTime, endTime, limit);
        }
    }
}
