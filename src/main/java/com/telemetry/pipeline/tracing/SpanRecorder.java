package com.telemetry.pipeline.tracing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.telemetry.pipeline.aggregation.PerformanceAggregator;
import com.telemetry.pipeline.context.CorrelationContext;
import com.telemetry.pipeline.context.CorrelationContextHolder;
import com.telemetry.pipeline.context.TraceIdentifiers;
import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanStatus;
import com.telemetry.pipeline.metrics.NoOpTelemetryMetrics;
import com.telemetry.pipeline.metrics.TelemetryMetrics;
import com.telemetry.pipeline.storage.TraceStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Creates, finishes and persists spans.
 *
 * <p>A new span joins the trace of the current {@link CorrelationContextHolder} context (a new
 * trace is started when there is none) and becomes the current span until it is finished, so
 * spans opened in between are recorded as its children.</p>
 *
 * <p>Finishing a span writes it to {@link TraceStorage}, updates the {@link PerformanceAggregator}
 * and hands it to the {@link SpanExporter}. Failures of any of these are logged and swallowed:
 * they never surface to the traced operation.</p>
 *
 * <p>Each new trace is offered to the {@link SamplingStrategy}; its decision is stored as the
 * {@value #SAMPLING_TAG} tag and inherited by child spans. Unrecorded spans still update the
 * aggregator. A span that finishes with {@link SpanStatus#ERROR} is stored even when its trace
 * was not recorded.</p>
 */
public class SpanRecorder {
    private static final Logger log = LoggerFactory.getLogger(SpanRecorder.class);

    public static final String SAMPLING_TAG = "sampling.decision";
    private static final Duration ACTIVE_SPAN_RETENTION = Duration.ofHours(1);
    private static final long MAX_ACTIVE_SPANS = 100_000;

    private final TraceStorage traceStorage;
    private final PerformanceAggregator aggregator;
    private final SpanExporter exporter;
    private final TelemetryMetrics metrics;
    private final TracingConfig config;
    private final Clock clock;
    private final SamplingStrategy sampler;
    // Decisions of spans started but not yet finished, keyed by span id
    private final Cache<String, SamplingDecision> activeDecisions;

    public SpanRecorder(TraceStorage traceStorage, PerformanceAggregator aggregator) {
        this(traceStorage, aggregator, new NoOpSpanExporter(), new NoOpTelemetryMetrics(),
                TracingConfig.defaults(), Clock.systemUTC());
    }

    public SpanRecorder(TraceStorage traceStorage, PerformanceAggregator aggregator, SpanExporter exporter,
                        TelemetryMetrics metrics, TracingConfig config, Clock clock) {
        this(traceStorage, aggregator, exporter, metrics, config, clock, new AlwaysSampleStrategy());
    }

    public SpanRecorder(TraceStorage traceStorage, PerformanceAggregator aggregator, SpanExporter exporter,
                        TelemetryMetrics metrics, TracingConfig config, Clock clock, SamplingStrategy sampler) {
        this.traceStorage = Objects.requireNonNull(traceStorage, "traceStorage is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.exporter = exporter != null ? exporter : new NoOpSpanExporter();
        this.metrics = metrics != null ? metrics : new NoOpTelemetryMetrics();
        this.config = config != null ? config : TracingConfig.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.sampler = sampler != null ? sampler : new AlwaysSampleStrategy();
        this.activeDecisions = Caffeine.newBuilder()
                .expireAfterWrite(ACTIVE_SPAN_RETENTION)
                .maximumSize(MAX_ACTIVE_SPANS)
                .build();
    }

    public SpanHandle startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    /**
     * Starts a span as a child of the current span and makes it current.
     *
     * @throws IllegalArgumentException if the operation name or a tag key is malformed
     */
    public SpanHandle startSpan(String operationName, Map<String, ?> tags) {
        TraceIdentifiers.validateOperationName(operationName);
        if (tags != null) {
            tags.keySet().forEach(SpanRecorder::validateTagKey);
        }

        CorrelationContext current = CorrelationContextHolder.snapshot();
        String traceId = current.traceId() != null ? current.traceId() : TraceIdentifiers.newTraceId();
        String parentSpanId = current.spanId();
        String spanId = TraceIdentifiers.newSpanId();
        String tenantId = current.tenantId() != null ? current.tenantId() : config.defaultTenantId();
        SamplingDecision decision = decide(traceId, parentSpanId, operationName, tags);

        Map<String, Object> spanTags = new LinkedHashMap<>();
        if (tags != null) {
            spanTags.putAll(tags);
        }
        spanTags.put(SAMPLING_TAG, decision.tagValue());

        Span span = Span.builder()
                .traceId(traceId)
                .spanId(spanId)
                .parentSpanId(parentSpanId)
                .operationName(operationName)
                .serviceName(config.serviceName())
                .tenantId(tenantId)
                .userId(current.userId())
                .startTime(clock.instant())
                .tags(spanTags)
                .build();

        activeDecisions.put(spanId, decision);
        CorrelationContextHolder.set(current
                .withTraceId(traceId)
                .withSpanId(spanId)
                .withParentSpanId(parentSpanId));
        log.debug("span.started operation={} traceId={} spanId={} parentSpanId={} sampling={}",
                operationName, traceId, spanId, parentSpanId, decision.tagValue());
        return new SpanHandle(this, span, current, decision);
    }

    /**
     * Finishes the span, records it and restores the parent span as current.
     *
     * @param handle       the handle returned by {@link #startSpan(String)}
     * @param status       final status
     * @param errorMessage error summary, kept only for {@link SpanStatus#ERROR}
     * @return the finished span
     * @throws IllegalStateException if the span was already finished
     */
    public Span finishSpan(SpanHandle handle, SpanStatus status, String errorMessage) {
        Objects.requireNonNull(handle, "handle is required");
        Objects.requireNonNull(status, "status is required");
        Span finished = handle.markFinished(clock.instant(), status, errorMessage);
        activeDecisions.invalidate(finished.spanId());

        SamplingDecision decision = handle.samplingDecision();
        if (decision.isRecorded() || finished.isError()) {
            persist(finished);
        }
        aggregate(finished);
        if (decision.isSampled()) {
            export(finished);
        }
        metrics.recordSpan(finished.operationName(), finished.status(), finished.durationMs());

        if (Objects.equals(CorrelationContextHolder.getSpanId(), finished.spanId())) {
            CorrelationContextHolder.set(handle.previousContext());
        }
        log.debug("span.finished operation={} spanId={} status={} durationMs={}",
                finished.operationName(), finished.spanId(), finished.status(), finished.durationMs());
        return finished;
    }

    /**
     * Runs the task inside a span. The span finishes with OK on return, or with ERROR when the
     * task throws, in which case the original exception is rethrown unchanged.
     */
    public <T> T withSpan(String operationName, Callable<T> task) throws Exception {
        return withSpan(operationName, Map.of(), task);
    }

    public <T> T withSpan(String operationName, Map<String, ?> tags, Callable<T> task) throws Exception {
        Objects.requireNonNull(task, "task is required");
        SpanHandle handle = startSpan(operationName, tags);
        T result;
        try {
            result = task.call();
        } catch (Throwable t) {
            handle.recordError(t);
            finishSpan(handle, SpanStatus.ERROR, handle.errorMessage());
            throw t;
        }
        finishSpan(handle, handle.status(), handle.errorMessage());
        return result;
    }

    /**
     * Runnable variant of {@link #withSpan(String, Callable)}.
     */
    public void withSpan(String operationName, Runnable task) {
        Objects.requireNonNull(task, "task is required");
        SpanHandle handle = startSpan(operationName);
        try {
            task.run();
        } catch (RuntimeException | Error e) {
            handle.recordError(e);
            finishSpan(handle, SpanStatus.ERROR, handle.errorMessage());
            throw e;
        }
        finishSpan(handle, handle.status(), handle.errorMessage());
    }

    Instant now() {
        return clock.instant();
    }

    /**
     * A span with a local active parent inherits the parent's decision; otherwise the sampler
     * decides. A failing sampler records the trace.
     */
    private SamplingDecision decide(String traceId, String parentSpanId, String operationName, Map<String, ?> tags) {
        if (parentSpanId != null) {
            SamplingDecision inherited = activeDecisions.getIfPresent(parentSpanId);
            if (inherited != null) {
                return inherited;
            }
        }
        try {
            SamplingDecision decision = sampler.shouldSample(traceId, operationName, tags != null ? tags : Map.of());
            return decision != null ? decision : SamplingDecision.RECORD_AND_SAMPLE;
        } catch (RuntimeException e) {
            log.warn("span.sampling.failed operation={} traceId={}", operationName, traceId, e);
            return SamplingDecision.RECORD_AND_SAMPLE;
        }
    }

    static void validateTagKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Tag key must not be null or blank");
        }
    }

    private void persist(Span span) {
        try {
            if (!traceStorage.storeTraceSpan(span)) {
                metrics.recordSpanStoreFailure();
                log.warn("span.store.rejected traceId={} spanId={}", span.traceId(), span.spanId());
            }
        } catch (RuntimeException e) {
            metrics.recordSpanStoreFailure();
            log.warn("span.store.failed traceId={} spanId={}", span.traceId(), span.spanId(), e);
        }
    }

    private void aggregate(Span span) {
        try {
            aggregator.update(span.operationName(), span.durationMs(), span.status() == SpanStatus.OK);
        } catch (RuntimeException e) {
            log.warn("span.aggregate.failed operation={}", span.operationName(), e);
        }
    }

    private void export(Span span) {
        try {
            exporter.export(span);
        } catch (RuntimeException e) {
            metrics.recordSpanExportFailure();
            log.warn("span.export.failed traceId={} spanId={}", span.traceId(), span.spanId(), e);
        }
    }
}
