package com.telemetry.pipeline.tracing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanEvent;
import com.telemetry.pipeline.core.model.SpanStatus;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SpanExporterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private final ObjectMapper mapper = new ObjectMapper();

    private static Span finishedSpan(SpanStatus status, String error) {
        return Span.builder()
                .traceId("trace-1")
                .spanId("span-2")
                .parentSpanId("span-1")
                .operationName("charge-card")
                .serviceName("shop")
                .tenantId("acme")
                .startTime(T0)
                .tags(Map.of("amount", 42))
                .build()
                .finish(T0.plusMillis(25), status, error);
    }

    private static Span spanWithEvent() {
        return Span.builder()
                .traceId("trace-1")
                .spanId("span-2")
                .operationName("charge-card")
                .tenantId("acme")
                .startTime(T0)
                .events(List.of(new SpanEvent("gateway.retry", T0.plusMillis(10), Map.of("attempt", 2))))
                .build()
                .finish(T0.plusMillis(25), SpanStatus.OK, null);
    }

    @Nested
    @DisplayName("JSON lines")
    class JsonLines {

        @Test
        @DisplayName("Should write span events with ISO timestamps")
        void testEvents() throws Exception {
            StringWriter out = new StringWriter();
            new JsonLinesSpanExporter(out).export(spanWithEvent());

            JsonNode event = mapper.readTree(out.toString().trim()).get("events").get(0);
            assertEquals("gateway.retry", event.get("name").asText());
            assertEquals("2024-03-01T10:00:00.010Z", event.get("timestamp").asText());
            assertEquals("2", event.get("attributes").get("attempt").asText());
        }

        @Test
        @DisplayName("Span without events should omit the events field")
        void testNoEvents() throws Exception {
            StringWriter out = new StringWriter();
            new JsonLinesSpanExporter(out).export(finishedSpan(SpanStatus.OK, null));

            assertFalse(mapper.readTree(out.toString().trim()).has("events"));
        }

        @Test
        @DisplayName("Should write one JSON object per line")
        void testExport() throws Exception {
            StringWriter out = new StringWriter();
            JsonLinesSpanExporter exporter = new JsonLinesSpanExporter(out);

            exporter.export(finishedSpan(SpanStatus.OK, null));
            exporter.export(finishedSpan(SpanStatus.ERROR, "declined"));

            String[] lines = out.toString().split("\n");
            assertEquals(2, lines.length);
            JsonNode first = mapper.readTree(lines[0]);
            assertEquals("trace-1", first.get("traceId").asText());
            assertEquals("span-1", first.get("parentSpanId").asText());
            assertEquals("2024-03-01T10:00:00Z", first.get("startTime").asText());
            assertEquals(25.0, first.get("durationMs").asDouble(), 0.0001);
            assertEquals("OK", first.get("status").asText());
            assertEquals("42", first.get("tags").get("amount").asText());
            assertFalse(first.has("errorMessage"));
            assertFalse(first.has("userId"));

            JsonNode second = mapper.readTree(lines[1]);
            assertEquals("declined", second.get("errorMessage").asText());
        }

        @Test
        @DisplayName("Should append to a file")
        void testToFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("spans.jsonl");
            try (JsonLinesSpanExporter exporter = JsonLinesSpanExporter.toFile(file)) {
                exporter.export(finishedSpan(SpanStatus.OK, null));
            }

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            assertEquals(1, lines.size());
            assertEquals("charge-card", mapper.readTree(lines.get(0)).get("operationName").asText());
        }

        @Test
        @DisplayName("Write failures should surface as unchecked IO exceptions")
        void testWriteFailure() throws Exception {
            Writer broken = mock(Writer.class);
            doThrow(new IOException("disk full")).when(broken).write(anyString());

            JsonLinesSpanExporter exporter = new JsonLinesSpanExporter(broken);

            assertThrows(UncheckedIOException.class, () -> exporter.export(finishedSpan(SpanStatus.OK, null)));
        }
    }

    @Nested
    @DisplayName("OpenTelemetry")
    class OpenTelemetry {

        @Test
        @DisplayName("Should replay the span with timestamps, attributes and status")
        void testExport() {
            Tracer tracer = mock(Tracer.class);
            SpanBuilder builder = mock(SpanBuilder.class, RETURNS_SELF);
            io.opentelemetry.api.trace.Span otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder("charge-card")).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);

            new OpenTelemetrySpanExporter(tracer).export(finishedSpan(SpanStatus.ERROR, "declined"));

            verify(builder).setNoParent();
            verify(builder).setStartTimestamp(T0);
            verify(builder).setAttribute("telemetry.trace_id", "trace-1");
            verify(builder).setAttribute("telemetry.parent_span_id", "span-1");
            verify(builder).setAttribute("tenant.id", "acme");
            verify(builder).setAttribute("amount", "42");
            verify(otelSpan).setStatus(StatusCode.ERROR, "declined");
            verify(otelSpan).end(T0.plusMillis(25));
        }

        @Test
        @DisplayName("Should replay span events with their own timestamps")
        void testEvents() {
            Tracer tracer = mock(Tracer.class);
            SpanBuilder builder = mock(SpanBuilder.class, RETURNS_SELF);
            io.opentelemetry.api.trace.Span otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);

            new OpenTelemetrySpanExporter(tracer).export(spanWithEvent());

            verify(otelSpan).addEvent("gateway.retry",
                    Attributes.of(AttributeKey.stringKey("attempt"), "2"), T0.plusMillis(10));
        }

        @Test
        @DisplayName("Successful span should be marked OK")
        void testOkStatus() {
            Tracer tracer = mock(Tracer.class);
            SpanBuilder builder = mock(SpanBuilder.class, RETURNS_SELF);
            io.opentelemetry.api.trace.Span otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);

            new OpenTelemetrySpanExporter(tracer).export(finishedSpan(SpanStatus.OK, null));

            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan, never()).setStatus(eq(StatusCode.ERROR), anyString());
        }
    }
}
