package com.telemetry.pipeline.rest;

import com.telemetry.pipeline.api.TelemetryPipeline;
import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanStatus;
import com.telemetry.pipeline.health.HealthCheckRegistry;
import com.telemetry.pipeline.health.HealthStatus;
import com.telemetry.pipeline.query.TelemetryQueryFacade;
import com.telemetry.pipeline.rest.dto.ErrorResponse;
import com.telemetry.pipeline.rest.dto.PerformanceResponse;
import com.telemetry.pipeline.rest.dto.SpanResponse;
import com.telemetry.pipeline.rest.dto.TraceResponse;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelemetryResourceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private TelemetryPipeline pipeline;
    private TelemetryResource resource;

    @BeforeEach
    void setUp() {
        pipeline = TelemetryPipeline.builder().build();
        pipeline.start();
        resource = new TelemetryResource(pipeline.queryFacade(), pipeline.healthCheckRegistry());
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    private void store(String traceId, String spanId, String tenant, long durationMs, SpanStatus status) {
        pipeline.traceStorage().storeTraceSpan(Span.builder()
                .traceId(traceId)
                .spanId(spanId)
                .operationName("checkout")
                .tenantId(tenant)
                .startTime(T0)
                .build()
                .finish(T0.plusMillis(durationMs), status, null));
    }

    private static ErrorResponse error(Response response) {
        return assertInstanceOf(ErrorResponse.class, response.getEntity());
    }

    @SuppressWarnings("unchecked")
    private static List<SpanResponse> spans(Response response) {
        return (List<SpanResponse>) response.getEntity();
    }

    @Nested
    @DisplayName("Traces")
    class Traces {

        @Test
        @DisplayName("Known trace and span should return 200")
        void testFound() {
            store("trace-1", "span-1", "acme", 50, SpanStatus.OK);

            Response trace = resource.getTrace("trace-1");
            assertEquals(200, trace.getStatus());
            assertEquals(1, assertInstanceOf(TraceResponse.class, trace.getEntity()).spanCount());

            Response span = resource.getSpan("trace-1", "span-1");
            assertEquals(200, span.getStatus());
            assertEquals("span-1", assertInstanceOf(SpanResponse.class, span.getEntity()).spanId());
        }

        @Test
        @DisplayName("Unknown trace should return 404 with the request path")
        void testUnknownTrace() {
            Response response = resource.getTrace("missing");

            assertEquals(404, response.getStatus());
            assertEquals("/api/v1/telemetry/traces/missing", error(response).path());
        }

        @Test
        @DisplayName("Unknown span of a known trace should return 404")
        void testUnknownSpan() {
            store("trace-1", "span-1", "acme", 50, SpanStatus.OK);

            Response response = resource.getSpan("trace-1", "nope");

            assertEquals(404, response.getStatus());
            assertTrue(error(response).message().contains("nope"));
        }
    }

    @Nested
    @DisplayName("Slow and failed spans")
    class SlowAndFailed {

        @Test
        @DisplayName("Missing tenant should return 400 on both listings")
        void testTenantRequired() {
            store("trace-a", "a", "tenant-a", 5_000, SpanStatus.ERROR);

            Response slow = resource.getSlowTraces(1000, 10, null);
            Response errors = resource.getErrorTraces(10, null);
            Response blank = resource.getErrorTraces(10, " ");

            assertEquals(400, slow.getStatus());
            assertEquals(400, errors.getStatus());
            assertEquals(400, blank.getStatus());
            assertEquals("/api/v1/telemetry/traces/errors", error(errors).path());
        }

        @Test
        @DisplayName("Failed spans should only list the requested tenant")
        void testErrorTracesTenantScoped() {
            store("trace-a", "a", "tenant-a", 10, SpanStatus.ERROR);
            store("trace-b", "b", "tenant-b", 10, SpanStatus.ERROR);

            Response response = resource.getErrorTraces(10, "tenant-a");

            assertEquals(200, response.getStatus());
            assertEquals(List.of("a"), spans(response).stream().map(SpanResponse::spanId).toList());
        }

        @Test
        @DisplayName("Slow spans should only list the requested tenant")
        void testSlowTracesTenantScoped() {
            store("trace-a", "a", "tenant-a", 2_000, SpanStatus.OK);
            store("trace-b", "b", "tenant-b", 3_000, SpanStatus.OK);

            Response response = resource.getSlowTraces(1000, 10, "tenant-b");

            assertEquals(200, response.getStatus());
            assertEquals(List.of("b"), spans(response).stream().map(SpanResponse::spanId).toList());
        }

        @Test
        @DisplayName("Invalid limit should return 400")
        void testInvalidLimit() {
            assertEquals(400, resource.getErrorTraces(0, "tenant-a").getStatus());
        }
    }

    @Nested
    @DisplayName("Performance")
    class Performance {

        @Test
        @DisplayName("Recorded operation should return its statistics")
        void testKnownOperation() {
            pipeline.spanRecorder().withSpan("login", () -> { });

            Response response = resource.getPerformance("login");

            assertEquals(200, response.getStatus());
            assertEquals(1, assertInstanceOf(PerformanceResponse.class, response.getEntity()).totalRequests());
        }

        @Test
        @DisplayName("Unknown operation should return 404")
        void testUnknownOperation() {
            Response response = resource.getPerformance("never-called");

            assertEquals(404, response.getStatus());
            assertEquals("/api/v1/telemetry/performance/never-called", error(response).path());
        }
    }

    @Nested
    @DisplayName("Metrics and logs")
    class MetricsAndLogs {

        @Test
        @DisplayName("Missing tenant or malformed instant should return 400")
        void testBadRequests() {
            assertEquals(400, resource.queryMetrics(null, null, null, null, 100, false).getStatus());
            assertEquals(400, resource.queryLogs("acme", null, null, "yesterday", null, 100).getStatus());
        }

        @Test
        @DisplayName("Valid tenant query should return 200")
        void testTenantQuery() {
            assertEquals(200, resource.queryLogs("acme", "ERROR", null, null, null, 100).getStatus());
        }
    }

    @Nested
    @DisplayName("Errors and health")
    class ErrorsAndHealth {

        @Test
        @DisplayName("Unexpected failure should map to 500 without leaking the cause")
        void testInternalError() {
            TelemetryQueryFacade facade = mock(TelemetryQueryFacade.class);
            when(facade.getPerformance()).thenThrow(new IllegalStateException("storage exploded"));
            TelemetryResource failing = new TelemetryResource(facade, new HealthCheckRegistry());

            Response response = failing.getAllPerformance();

            assertEquals(500, response.getStatus());
            ErrorResponse body = error(response);
            assertEquals("Internal Server Error", body.error());
            assertFalse(body.message().contains("exploded"));
        }

        @Test
        @DisplayName("Running pipeline should report 200")
        void testHealthUp() {
            Response response = resource.health();

            assertEquals(200, response.getStatus());
            assertFalse(assertInstanceOf(HealthStatus.class, response.getEntity()).isDown());
        }

        @Test
        @DisplayName("Stopped pipeline should report 503")
        void testHealthDown() {
            pipeline.close();

            Response response = resource.health();

            assertEquals(503, response.getStatus());
            assertTrue(assertInstanceOf(HealthStatus.class, response.getEntity()).isDown());
        }
    }

    @Test
    @DisplayName("CSV parameters should be split and trimmed")
    void testSplitCsv() {
        assertEquals(Set.of("cpu", "memory"), TelemetryResource.splitCsv(" cpu, memory ,,"));
        assertTrue(TelemetryResource.splitCsv(null).isEmpty());
        assertTrue(TelemetryResource.splitCsv("  ").isEmpty());
    }

    @Test
    @DisplayName("Instants should parse ISO-8601 and reject anything else")
    void testParseInstant() {
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"),
                TelemetryResource.parseInstant("2024-03-01T10:00:00Z", "start"));
        assertNull(TelemetryResource.parseInstant(null, "start"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TelemetryResource.parseInstant("yesterday", "end"));
        assertTrue(e.getMessage().startsWith("end"));
    }
}
