package com.telemetry.pipeline.metrics;

import com.telemetry.pipeline.core.model.SpanStatus;
import com.telemetry.pipeline.ingest.QueueKind;

import java.time.Duration;
import java.util.function.IntSupplier;

/**
 * Self-observability of the telemetry pipeline.
 * The default {@link NoOpTelemetryMetrics} does nothing, so the pipeline works without
 * any metrics library on the classpath.
 */
public interface TelemetryMetrics {

    void recordSubmitted(QueueKind queue, boolean accepted);

    void recordFlush(QueueKind queue, int batchSize, Duration duration);

    void recordFlushFailure(QueueKind queue);

    /**
     * Registers a gauge reporting the current depth of a queue.
     */
    void registerQueueDepth(QueueKind queue, IntSupplier depth);

    void recordSpan(String operationName, SpanStatus status, double durationMs);

    void recordSpanStoreFailure();

    void recordSpanExportFailure();
}
