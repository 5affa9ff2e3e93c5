package com.telemetry.pipeline.tracing;

import com.telemetry.pipeline.core.model.Span;

/**
 * Ships finished spans to an external tracing backend.
 * The default {@link NoOpSpanExporter} does nothing, so the pipeline works without
 * any tracing library on the classpath.
 */
public interface SpanExporter extends AutoCloseable {

    /**
     * Exports one finished span. Failures are reported by throwing; the caller logs and continues.
     */
    void export(Span span);

    @Override
    default void close() {
    }
}
