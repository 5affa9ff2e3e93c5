package com.telemetry.pipeline.rest.dto;

import com.telemetry.pipeline.core.model.Span;

import java.util.List;
import java.util.Map;

/**
 * JSON view of a finished span. Timestamps are ISO-8601 strings.
 */
public record SpanResponse(
        String traceId,
        String spanId,
        String parentSpanId,
        String operationName,
        String serviceName,
        String tenantId,
        String userId,
        String startTime,
        String endTime,
        Double durationMs,
        String status,
        String errorMessage,
        Map<String, Object> tags,
        List<EventResponse> events
) {
    public record EventResponse(String name, String timestamp, Map<String, Object> attributes) {
    }

    public static SpanResponse from(Span span) {
        return new SpanResponse(
                span.traceId(),
                span.spanId(),
                span.parentSpanId(),
                span.operationName(),
                span.serviceName(),
                span.tenantId(),
                span.userId(),
                span.startTime().toString(),
                span.endTime() != null ? span.endTime().toString() : null,
                span.durationMs(),
                span.status() != null ? span.status().name() : null,
                span.errorMessage(),
                span.tags(),
                span.events().stream()
                        .map(e -> new EventResponse(e.name(), e.timestamp().toString(), e.attributes()))
                        .toList());
    }
}
