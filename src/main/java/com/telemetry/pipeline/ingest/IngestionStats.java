package com.telemetry.pipeline.ingest;

/**
 * Point-in-time statistics of the ingestion pipeline.
 *
 * @param metricsQueueDepth items waiting in the metrics queue
 * @param logsQueueDepth    items waiting in the logs queue
 * @param queueCapacity     capacity of each queue
 * @param metricsAccepted   metrics accepted by {@code submitMetric}
 * @param metricsDropped    metrics rejected because the queue was full
 * @param logsAccepted      log entries accepted by {@code submitLog}
 * @param logsDropped       log entries rejected because the queue was full
 * @param metricsFlushed    metrics reported stored by the metric storage
 * @param logsFlushed       log entries reported stored by the log storage
 * @param batchesFlushed    bulk flush calls that completed
 * @param flushFailures     bulk flush calls that threw
 * @param discardedOnStop   queued items discarded by {@code stop()}
 * @param running           whether the consumers are running
 */
public record IngestionStats(
        int metricsQueueDepth,
        int logsQueueDepth,
        int queueCapacity,
        long metricsAccepted,
        long metricsDropped,
        long logsAccepted,
        long logsDropped,
        long metricsFlushed,
        long logsFlushed,
        long batchesFlushed,
        long flushFailures,
        long discardedOnStop,
        boolean running
) {
    /**
     * Fill ratio of the fuller queue, between 0.0 and 1.0.
     */
    public double maxQueueUtilization() {
        return (double) Math.max(metricsQueueDepth, logsQueueDepth) / queueCapacity;
    }

    public long totalDropped() {
        return metricsDropped + logsDropped;
    }
}
