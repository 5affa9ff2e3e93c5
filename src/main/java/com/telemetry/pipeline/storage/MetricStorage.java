package com.telemetry.pipeline.storage;

import com.telemetry.pipeline.core.model.Metric;

import java.util.List;

/**
 * Storage adapter for metric samples.
 * Implementations report expected failures by returning {@code false} rather than throwing.
 */
public interface MetricStorage {

    /**
     * Stores one metric.
     *
     * @return true if the metric was stored
     */
    boolean storeMetric(Metric metric);

    /**
     * Stores a batch of metrics. The default implementation stores them one by one.
     *
     * @return the number of metrics stored
     */
    default int storeMetrics(List<Metric> metrics) {
        int stored = 0;
        for (Metric metric : metrics) {
            if (storeMetric(metric)) {
                stored++;
            }
        }
        return stored;
    }

    /**
     * Returns the tenant's metrics matching the query, oldest first.
     */
    List<Metric> queryMetrics(MetricQuery query);
}
