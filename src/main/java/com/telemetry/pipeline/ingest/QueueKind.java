package com.telemetry.pipeline.ingest;

/**
 * The two ingestion queues.
 */
public enum QueueKind {
    METRICS("metrics"),
    LOGS("logs");

    private final String tag;

    QueueKind(String tag) {
        this.tag = tag;
    }

    /**
     * Lowercase name used in metric tags and thread names.
     */
    public String tag() {
        return tag;
    }
}
