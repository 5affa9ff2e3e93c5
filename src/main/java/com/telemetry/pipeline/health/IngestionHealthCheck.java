package com.telemetry.pipeline.health;

import com.telemetry.pipeline.ingest.IngestionQueueManager;
import com.telemetry.pipeline.ingest.IngestionStats;

/**
 * Reports queue saturation of the ingestion pipeline.
 * DEGRADED from 80% queue usage, DOWN when a queue is full or the consumers are not running.
 */
public class IngestionHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.80;

    private final IngestionQueueManager queueManager;

    public IngestionHealthCheck(IngestionQueueManager queueManager) {
        this.queueManager = queueManager;
    }

    @Override
    public String getName() {
        return "ingestion";
    }

    @Override
    public HealthStatus check() {
        IngestionStats stats = queueManager.getStats();
        double usage = stats.maxQueueUtilization();

        HealthStatus base;
        if (!stats.running()) {
            base = HealthStatus.down("Ingestion consumers are not running");
        } else if (usage >= 1.0) {
            base = HealthStatus.down("Ingestion queue full");
        } else if (usage >= DEGRADED_THRESHOLD) {
            base = HealthStatus.degraded("Ingestion queue usage high: " + String.format("%.1f%%", usage * 100));
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("metricsQueueDepth", stats.metricsQueueDepth())
                .withDetail("logsQueueDepth", stats.logsQueueDepth())
                .withDetail("queueCapacity", stats.queueCapacity())
                .withDetail("dropped", stats.totalDropped())
                .withDetail("flushFailures", stats.flushFailures());
    }
}
