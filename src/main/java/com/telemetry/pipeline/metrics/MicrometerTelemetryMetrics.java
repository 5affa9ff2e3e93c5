package com.telemetry.pipeline.metrics;

import com.telemetry.pipeline.core.model.SpanStatus;
import com.telemetry.pipeline.ingest.QueueKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link TelemetryMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code telemetry.ingest.submitted} - Counter (tags: queue, outcome)</li>
 *   <li>{@code telemetry.ingest.flushed} - Counter of stored items (tag: queue)</li>
 *   <li>{@code telemetry.ingest.flush.failures} - Counter (tag: queue)</li>
 *   <li>{@code telemetry.ingest.flush.duration} - Timer (tag: queue)</li>
 *   <li>{@code telemetry.ingest.batch.size} - DistributionSummary (tag: queue)</li>
 *   <li>{@code telemetry.ingest.queue.depth} - Gauge (tag: queue)</li>
 *   <li>{@code telemetry.span.duration} - Timer (tags: operation, status)</li>
 *   <li>{@code telemetry.span.store.failures} - Counter</li>
 *   <li>{@code telemetry.span.export.failures} - Counter</li>
 * </ul>
 */
public class MicrometerTelemetryMetrics implements TelemetryMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<QueueKind, DistributionSummary> batchSizeSummaries = new ConcurrentHashMap<>();
    private final Counter spanStoreFailures;
    private final Counter spanExportFailures;

    public MicrometerTelemetryMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.spanStoreFailures = Counter.builder("telemetry.span.store.failures")
                .description("Finished spans that could not be written to trace storage")
                .register(registry);
        this.spanExportFailures = Counter.builder("telemetry.span.export.failures")
                .description("Finished spans the exporter failed to ship")
                .register(registry);
    }

    @Override
    public void recordSubmitted(QueueKind queue, boolean accepted) {
        String outcome = accepted ? "accepted" : "dropped";
        counter("submitted:" + queue.tag() + ":" + outcome, () ->
                Counter.builder("telemetry.ingest.submitted")
                        .description("Items offered to an ingestion queue")
                        .tag("queue", queue.tag())
                        .tag("outcome", outcome)
                        .register(registry)).increment();
    }

    @Override
    public void recordFlush(QueueKind queue, int batchSize, Duration duration) {
        counter("flushed:" + queue.tag(), () ->
                Counter.builder("telemetry.ingest.flushed")
                        .description("Items written to storage by the ingestion consumers")
                        .tag("queue", queue.tag())
                        .register(registry)).increment(batchSize);
        timerCache.computeIfAbsent("flush:" + queue.tag(), k ->
                Timer.builder("telemetry.ingest.flush.duration")
                        .description("Duration of one bulk flush")
                        .tag("queue", queue.tag())
                        .register(registry)).record(duration);
        batchSizeSummaries.computeIfAbsent(queue, q ->
                DistributionSummary.builder("telemetry.ingest.batch.size")
                        .description("Distribution of flushed batch sizes")
                        .tag("queue", q.tag())
                        .register(registry)).record(batchSize);
    }

    @Override
    public void recordFlushFailure(QueueKind queue) {
        counter("flushFailure:" + queue.tag(), () ->
                Counter.builder("telemetry.ingest.flush.failures")
                        .description("Bulk flushes that failed")
                        .tag("queue", queue.tag())
                        .register(registry)).increment();
    }

    @Override
    public void registerQueueDepth(QueueKind queue, IntSupplier depth) {
        Gauge.builder("telemetry.ingest.queue.depth", depth, IntSupplier::getAsInt)
                .description("Items currently waiting in an ingestion queue")
                .tag("queue", queue.tag())
                .strongReference(true)
                .register(registry);
    }

    @Override
    public void recordSpan(String operationName, SpanStatus status, double durationMs) {
        String key = "span:" + operationName + ":" + status.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("telemetry.span.duration")
                        .description("Duration of finished spans")
                        .tag("operation", operationName)
                        .tag("status", status.name())
                        .register(registry));
        timer.record((long) (durationMs * 1_000_000), TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordSpanStoreFailure() {
        spanStoreFailures.increment();
    }

    @Override
    public void recordSpanExportFailure() {
        spanExportFailures.increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
