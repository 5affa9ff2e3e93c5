package com.telemetry.pipeline.tracing;

import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanEvent;
import com.telemetry.pipeline.core.model.SpanStatus;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;

/**
 * Replays finished spans through an OpenTelemetry {@link Tracer}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>The OpenTelemetry span keeps the original start and end timestamps. Correlation
 * identifiers and tags become string attributes. Span events are replayed with their own
 * timestamps.</p>
 */
public class OpenTelemetrySpanExporter implements SpanExporter {

    private final Tracer tracer;

    public OpenTelemetrySpanExporter(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public void export(Span span) {
        SpanBuilder builder = tracer.spanBuilder(span.operationName())
                .setNoParent()
                .setStartTimestamp(span.startTime())
                .setAttribute("telemetry.trace_id", span.traceId())
                .setAttribute("telemetry.span_id", span.spanId())
                .setAttribute("tenant.id", span.tenantId());
        if (span.parentSpanId() != null) {
            builder.setAttribute("telemetry.parent_span_id", span.parentSpanId());
        }
        if (span.serviceName() != null) {
            builder.setAttribute("service.name", span.serviceName());
        }
        if (span.userId() != null) {
            builder.setAttribute("user.id", span.userId());
        }
        span.tags().forEach((key, value) -> builder.setAttribute(key, String.valueOf(value)));

        io.opentelemetry.api.trace.Span otelSpan = builder.startSpan();
        for (SpanEvent event : span.events()) {
            AttributesBuilder attributes = Attributes.builder();
            event.attributes().forEach((key, value) -> attributes.put(key, String.valueOf(value)));
            otelSpan.addEvent(event.name(), attributes.build(), event.timestamp());
        }
        if (span.status() == SpanStatus.ERROR) {
            otelSpan.setStatus(StatusCode.ERROR, span.errorMessage() != null ? span.errorMessage() : "");
        } else {
            otelSpan.setStatus(StatusCode.OK);
        }
        otelSpan.end(span.endTime());
    }
}
