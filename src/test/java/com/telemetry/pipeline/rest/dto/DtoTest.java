package com.telemetry.pipeline.rest.dto;

import com.telemetry.pipeline.context.CorrelationContextHolder;
import com.telemetry.pipeline.context.TraceIdentifiers;
import com.telemetry.pipeline.core.model.PerformanceRecord;
import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DtoTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private static Span span(String id, String parent, long startMs, long endMs, SpanStatus status) {
        return Span.builder()
                .traceId("trace-1")
                .spanId(id)
                .parentSpanId(parent)
                .operationName("op-" + id)
                .tenantId("acme")
                .startTime(T0.plusMillis(startMs))
                .build()
                .finish(T0.plusMillis(endMs), status, status == SpanStatus.ERROR ? "failed" : null);
    }

    @Test
    @DisplayName("Span response should render timestamps and status as strings")
    void testSpanResponse() {
        SpanResponse response = SpanResponse.from(span("a", null, 0, 40, SpanStatus.ERROR));

        assertEquals("2024-03-01T10:00:00Z", response.startTime());
        assertEquals("2024-03-01T10:00:00.040Z", response.endTime());
        assertEquals(40.0, response.durationMs(), 0.0001);
        assertEquals("ERROR", response.status());
        assertEquals("failed", response.errorMessage());
    }

    @Test
    @DisplayName("Trace response should span from first start to last end")
    void testTraceResponse() {
        TraceResponse response = TraceResponse.from("trace-1", List.of(
                span("root", null, 0, 100, SpanStatus.OK),
                span("child", "root", 20, 150, SpanStatus.OK)));

        assertEquals(2, response.spanCount());
        assertEquals(150.0, response.durationMs(), 0.0001);
        assertEquals("root", response.spans().get(0).spanId());
    }

    @Test
    @DisplayName("Performance response should include derived values")
    void testPerformanceResponse() {
        PerformanceRecord record = PerformanceRecord.first("login", 50, true, T0).record(150, false, T0);

        PerformanceResponse response = PerformanceResponse.from(record);

        assertEquals(100.0, response.avgDuration(), 0.0001);
        assertEquals(0.5, response.successRate(), 0.0001);
        assertEquals("2024-03-01T10:00:00Z", response.lastUpdated());
    }

    @Test
    @DisplayName("Error responses should carry status and reason")
    void testErrorResponse() {
        ErrorResponse error = ErrorResponse.badRequest("limit must be >= 1", "/api/v1/telemetry/traces/slow");

        assertEquals(400, error.status());
        assertEquals("Bad Request", error.error());
        assertNotNull(error.timestamp());
        assertEquals(404, ErrorResponse.notFound("x", "/p").status());
        assertEquals(500, ErrorResponse.internalError("x", "/p").status());
    }

    @Test
    @DisplayName("Error responses should carry the trace of the failing request")
    void testErrorResponseTraceId() {
        String traceId = TraceIdentifiers.newTraceId();
        CorrelationContextHolder.setTraceId(traceId);
        try {
            assertEquals(traceId, ErrorResponse.notFound("Trace not found", "/traces/x").traceId());
        } finally {
            CorrelationContextHolder.clear();
        }
        assertNull(ErrorResponse.badRequest("x", "/p").traceId());
    }
}
