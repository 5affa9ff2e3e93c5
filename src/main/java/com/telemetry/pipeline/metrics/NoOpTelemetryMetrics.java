package com.telemetry.pipeline.metrics;

import com.telemetry.pipeline.core.model.SpanStatus;
import com.telemetry.pipeline.ingest.QueueKind;

import java.time.Duration;
import java.util.function.IntSupplier;

/**
 * No-op implementation of {@link TelemetryMetrics}.
 */
public class NoOpTelemetryMetrics implements TelemetryMetrics {

    @Override
    public void recordSubmitted(QueueKind queue, boolean accepted) {
    }

    @Override
    public void recordFlush(QueueKind queue, int batchSize, Duration duration) {
    }

    @Override
    public void recordFlushFailure(QueueKind queue) {
    }

    @Override
    public void registerQueueDepth(QueueKind queue, IntSupplier depth) {
    }

    @Override
    public void recordSpan(String operationName, SpanStatus status, double durationMs) {
    }

    @Override
    public void recordSpanStoreFailure() {
    }

    @Override
    public void recordSpanExportFailure() {
    }
}
