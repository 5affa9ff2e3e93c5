package com.telemetry.pipeline.tracing;

import com.telemetry.pipeline.core.model.Span;

/**
 * No-op implementation of {@link SpanExporter}.
 */
public class NoOpSpanExporter implements SpanExporter {

    @Override
    public void export(Span span) {
    }
}
