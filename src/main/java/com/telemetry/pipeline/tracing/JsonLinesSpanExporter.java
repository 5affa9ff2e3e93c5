package com.telemetry.pipeline.tracing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes finished spans as JSON Lines, one object per span.
 * Timestamps are ISO-8601 strings; null fields are omitted.
 */
public class JsonLinesSpanExporter implements SpanExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesSpanExporter.class);

    private final Writer writer;
    private final ObjectMapper objectMapper;

    public JsonLinesSpanExporter(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer is required");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Appends to the given file, creating it if needed.
     */
    public static JsonLinesSpanExporter toFile(Path path) throws IOException {
        Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        log.info("export.jsonl.opened path={}", path);
        return new JsonLinesSpanExporter(writer);
    }

    @Override
    public void export(Span span) {
        String line = serialize(span);
        synchronized (writer) {
            try {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write span " + span.spanId(), e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (writer) {
            try {
                writer.close();
            } catch (IOException e) {
                log.warn("export.jsonl.close.failed reason={}", e.getMessage());
            }
        }
    }

    String serialize(Span span) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("traceId", span.traceId());
        json.put("spanId", span.spanId());
        putIfPresent(json, "parentSpanId", span.parentSpanId());
        json.put("operationName", span.operationName());
        putIfPresent(json, "serviceName", span.serviceName());
        json.put("tenantId", span.tenantId());
        putIfPresent(json, "userId", span.userId());
        json.put("startTime", span.startTime().toString());
        putIfPresent(json, "endTime", span.endTime() != null ? span.endTime().toString() : null);
        putIfPresent(json, "durationMs", span.durationMs());
        putIfPresent(json, "status", span.status() != null ? span.status().name() : null);
        putIfPresent(json, "errorMessage", span.errorMessage());
        if (!span.tags().isEmpty()) {
            Map<String, String> tags = new LinkedHashMap<>();
            span.tags().forEach((k, v) -> tags.put(k, String.valueOf(v)));
            json.put("tags", tags);
        }
        if (!span.events().isEmpty()) {
            List<Map<String, Object>> events = new ArrayList<>();
            for (SpanEvent event : span.events()) {
                Map<String, Object> node = new LinkedHashMap<>();
                node.put("name", event.name());
                node.put("timestamp", event.timestamp().toString());
                if (!event.attributes().isEmpty()) {
                    Map<String, String> attributes = new LinkedHashMap<>();
                    event.attributes().forEach((k, v) -> attributes.put(k, String.valueOf(v)));
                    node.put("attributes", attributes);
                }
                events.add(node);
            }
            json.put("events", events);
        }
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize span " + span.spanId(), e);
        }
    }

    private static void putIfPresent(Map<String, Object> json, String key, Object value) {
        if (value != null) {
            json.put(key, value);
        }
    }
}
