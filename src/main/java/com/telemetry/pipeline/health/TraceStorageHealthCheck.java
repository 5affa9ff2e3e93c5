package com.telemetry.pipeline.health;

import com.telemetry.pipeline.storage.TraceStorage;

/**
 * Checks trace storage with a lookup of a trace that does not exist.
 */
public class TraceStorageHealthCheck implements HealthCheck {

    static final String HEALTH_CHECK_TRACE_ID = "health-check";

    private final TraceStorage traceStorage;

    public TraceStorageHealthCheck(TraceStorage traceStorage) {
        this.traceStorage = traceStorage;
    }

    @Override
    public String getName() {
        return "traceStorage";
    }

    @Override
    public HealthStatus check() {
        long start = System.nanoTime();
        try {
            traceStorage.getTrace(HEALTH_CHECK_TRACE_ID);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return HealthStatus.up().withDetail("responseTimeMs", elapsedMs);
        } catch (RuntimeException e) {
            return HealthStatus.down("Trace storage unreachable: " + e.getMessage());
        }
    }
}
