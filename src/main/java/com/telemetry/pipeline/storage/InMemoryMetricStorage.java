package com.telemetry.pipeline.storage;

import com.telemetry.pipeline.core.model.Metric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * In-memory implementation of {@link MetricStorage} for development and tests.
 * Thread-safe; metrics are partitioned by tenant.
 */
public class InMemoryMetricStorage implements MetricStorage {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMetricStorage.class);

    private final TenantPartitionedStore<Metric> store;

    public InMemoryMetricStorage() {
        this(0);
    }

    /**
     * @param maxEntriesPerTenant per-tenant cap with oldest-first eviction, 0 for unbounded
     */
    public InMemoryMetricStorage(int maxEntriesPerTenant) {
        if (maxEntriesPerTenant < 0) {
            throw new IllegalArgumentException("maxEntriesPerTenant must be >= 0");
        }
        this.store = new TenantPartitionedStore<>(Metric::tenantId, Metric::timestamp, maxEntriesPerTenant);
    }

    @Override
    public boolean storeMetric(Metric metric) {
        Objects.requireNonNull(metric, "metric is required");
        return storeMetrics(List.of(metric)) == 1;
    }

    @Override
    public int storeMetrics(List<Metric> metrics) {
        int evicted = store.addAll(metrics);
        if (evicted > 0) {
            log.debug("storage.metrics.evicted count={}", evicted);
        }
        return metrics.size();
    }

    @Override
    public List<Metric> queryMetrics(MetricQuery query) {
        Objects.requireNonNull(query, "query is required");
        return store.query(query.tenantId(), query::matches, query.limit());
    }

    public int count(String tenantId) {
        return store.size(tenantId);
    }

    public void clear() {
        store.clear();
    }
}
