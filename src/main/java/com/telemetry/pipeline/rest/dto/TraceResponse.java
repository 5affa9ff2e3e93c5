package com.telemetry.pipeline.rest.dto;

import com.telemetry.pipeline.core.model.Span;

import java.time.Instant;
import java.util.List;

/**
 * All spans of one trace with its overall duration (first start to last end).
 */
public record TraceResponse(String traceId, int spanCount, double durationMs, List<SpanResponse> spans) {

    public static TraceResponse from(String traceId, List<Span> spans) {
        Instant first = null;
        Instant last = null;
        for (Span span : spans) {
            if (first == null || span.startTime().isBefore(first)) {
                first = span.startTime();
            }
            if (span.endTime() != null && (last == null || span.endTime().isAfter(last))) {
                last = span.endTime();
            }
        }
        double duration = first != null && last != null ? Span.millisBetween(first, last) : 0.0;
        return new TraceResponse(traceId, spans.size(), duration,
                spans.stream().map(SpanResponse::from).toList());
    }
}
