package com.telemetry.pipeline.tracing;

import com.telemetry.pipeline.context.CorrelationContext;
import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanEvent;
import com.telemetry.pipeline.core.model.SpanStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An active span returned by {@link SpanRecorder#startSpan(String)}.
 * Closing the handle finishes the span with {@link SpanStatus#OK}, or with
 * {@link SpanStatus#ERROR} if an error was recorded.
 *
 * <pre>
 * try (SpanHandle span = recorder.startSpan("checkout")) {
 *     span.setTag("cart.items", cart.size());
 *     span.addEvent("inventory.reserved", Map.of("sku", sku));
 *     orders.checkout(cart);
 * }
 * </pre>
 */
public final class SpanHandle implements AutoCloseable {

    private final SpanRecorder recorder;
    private final CorrelationContext previousContext;
    private final SamplingDecision samplingDecision;
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private volatile Span span;
    private volatile SpanStatus status = SpanStatus.OK;
    private volatile String errorMessage;

    SpanHandle(SpanRecorder recorder, Span span, CorrelationContext previousContext,
               SamplingDecision samplingDecision) {
        this.recorder = recorder;
        this.span = span;
        this.previousContext = previousContext;
        this.samplingDecision = samplingDecision;
    }

    public String traceId() {
        return span.traceId();
    }

    public String spanId() {
        return span.spanId();
    }

    public String operationName() {
        return span.operationName();
    }

    /**
     * The span as currently recorded; finished once the handle is finished.
     */
    public Span span() {
        return span;
    }

    public boolean isFinished() {
        return finished.get();
    }

    public SpanHandle setTag(String key, Object value) {
        SpanRecorder.validateTagKey(key);
        synchronized (this) {
            if (finished.get()) {
                throw new IllegalStateException("Span " + span.spanId() + " is already finished");
            }
            span = span.withTag(key, value);
        }
        return this;
    }

    public SpanHandle addEvent(String name) {
        return addEvent(name, Map.of());
    }

    /**
     * Records a named, timestamped event on the span.
     *
     * @throws IllegalArgumentException if the name is blank
     * @throws IllegalStateException    if the span is already finished
     */
    public SpanHandle addEvent(String name, Map<String, ?> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (attributes != null) {
            copy.putAll(attributes);
        }
        SpanEvent event = new SpanEvent(name, recorder.now(), copy);
        synchronized (this) {
            if (finished.get()) {
                throw new IllegalStateException("Span " + span.spanId() + " is already finished");
            }
            span = span.withEvent(event);
        }
        return this;
    }

    public SamplingDecision samplingDecision() {
        return samplingDecision;
    }

    /**
     * Marks the span as failed with the exception's summary.
     */
    public SpanHandle recordError(Throwable error) {
        Objects.requireNonNull(error, "error is required");
        this.status = SpanStatus.ERROR;
        this.errorMessage = error.toString();
        return this;
    }

    public SpanHandle setStatus(SpanStatus status) {
        this.status = Objects.requireNonNull(status, "status is required");
        return this;
    }

    SpanStatus status() {
        return status;
    }

    String errorMessage() {
        return errorMessage;
    }

    CorrelationContext previousContext() {
        return previousContext;
    }

    /**
     * Transitions the handle to finished exactly once.
     *
     * @throws IllegalStateException if the handle was already finished
     */
    synchronized Span markFinished(Instant end, SpanStatus finalStatus, String error) {
        if (!finished.compareAndSet(false, true)) {
            throw new IllegalStateException("Span " + span.spanId() + " is already finished");
        }
        span = span.finish(end, finalStatus, error);
        return span;
    }

    /**
     * Finishes the span with the status recorded so far. Does nothing if already finished.
     */
    @Override
    public void close() {
        if (!finished.get()) {
            recorder.finishSpan(this, status, errorMessage);
        }
    }
}
