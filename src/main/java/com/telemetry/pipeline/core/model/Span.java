package com.telemetry.pipeline.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of a timed unit of work within a trace.
 *
 * <p>A span is either <em>active</em> ({@code endTime == null}) or <em>finished</em>
 * ({@code endTime}, {@code durationMs} and {@code status} set). Finishing is write-once:
 * {@link #finish(Instant, SpanStatus, String)} returns a new finished instance and
 * refuses to finish an already finished span.</p>
 *
 * <p>{@code events} are kept in the order they were added.</p>
 */
public record Span(
        String traceId,
        String spanId,
        String parentSpanId,
        String operationName,
        String serviceName,
        String tenantId,
        String userId,
        Instant startTime,
        Instant endTime,
        Double durationMs,
        SpanStatus status,
        String errorMessage,
        Map<String, Object> tags,
        List<SpanEvent> events
) {
    public Span {
        Objects.requireNonNull(traceId, "traceId is required");
        Objects.requireNonNull(spanId, "spanId is required");
        Objects.requireNonNull(operationName, "operationName is required");
        Objects.requireNonNull(tenantId, "tenantId is required");
        Objects.requireNonNull(startTime, "startTime is required");
        tags = tags != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tags)) : Map.of();
        events = events != null ? List.copyOf(events) : List.of();

        if (endTime == null) {
            if (durationMs != null || status != null || errorMessage != null) {
                throw new IllegalArgumentException(
                        "Active span must not carry duration, status or error message");
            }
        } else {
            if (endTime.isBefore(startTime)) {
                throw new IllegalArgumentException("endTime must not be before startTime");
            }
            Objects.requireNonNull(status, "status is required for a finished span");
            double expected = millisBetween(startTime, endTime);
            if (durationMs == null || Double.compare(durationMs, expected) != 0) {
                durationMs = expected;
            }
            if (status == SpanStatus.OK && errorMessage != null) {
                throw new IllegalArgumentException("errorMessage is only allowed when status is ERROR");
            }
        }
    }

    public Span(String traceId, String spanId, String parentSpanId, String operationName, String serviceName,
                String tenantId, String userId, Instant startTime, Instant endTime, Double durationMs,
                SpanStatus status, String errorMessage, Map<String, Object> tags) {
        this(traceId, spanId, parentSpanId, operationName, serviceName, tenantId, userId, startTime, endTime,
                durationMs, status, errorMessage, tags, List.of());
    }

    /**
     * Duration in milliseconds between two instants, with sub-millisecond precision.
     */
    public static double millisBetween(Instant start, Instant end) {
        return Duration.between(start, end).toNanos() / 1_000_000.0;
    }

    public boolean isActive() {
        return endTime == null;
    }

    public boolean isFinished() {
        return endTime != null;
    }

    public boolean isRoot() {
        return parentSpanId == null;
    }

    public boolean isError() {
        return status == SpanStatus.ERROR;
    }

    /**
     * Returns a finished copy of this span.
     * An end time earlier than the start time (clock adjustment) is clamped to the start time.
     *
     * @throws IllegalStateException if this span is already finished
     */
    public Span finish(Instant end, SpanStatus finalStatus, String error) {
        if (isFinished()) {
            throw new IllegalStateException("Span " + spanId + " is already finished");
        }
        Objects.requireNonNull(end, "end is required");
        Objects.requireNonNull(finalStatus, "status is required");
        Instant effectiveEnd = end.isBefore(startTime) ? startTime : end;
        String message = finalStatus == SpanStatus.ERROR ? error : null;
        return new Span(traceId, spanId, parentSpanId, operationName, serviceName, tenantId, userId,
                startTime, effectiveEnd, millisBetween(startTime, effectiveEnd), finalStatus, message, tags, events);
    }

    /**
     * Returns a copy with an additional tag. Only active spans accept new tags.
     */
    public Span withTag(String key, Object value) {
        if (isFinished()) {
            throw new IllegalStateException("Span " + spanId + " is finished and can no longer be tagged");
        }
        Objects.requireNonNull(key, "tag key is required");
        Map<String, Object> newTags = new LinkedHashMap<>(tags);
        newTags.put(key, value);
        return new Span(traceId, spanId, parentSpanId, operationName, serviceName, tenantId, userId,
                startTime, null, null, null, null, newTags, events);
    }

    /**
     * Returns a copy with the event appended. Only active spans accept new events.
     */
    public Span withEvent(SpanEvent event) {
        if (isFinished()) {
            throw new IllegalStateException("Span " + spanId + " is finished and can no longer record events");
        }
        Objects.requireNonNull(event, "event is required");
        List<SpanEvent> newEvents = new ArrayList<>(events);
        newEvents.add(event);
        return new Span(traceId, spanId, parentSpanId, operationName, serviceName, tenantId, userId,
                startTime, null, null, null, null, tags, newEvents);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String traceId;
        private String spanId;
        private String parentSpanId;
        private String operationName;
        private String serviceName;
        private String tenantId;
        private String userId;
        private Instant startTime = Instant.now();
        private Instant endTime;
        private SpanStatus status;
        private String errorMessage;
        private Map<String, Object> tags;
        private List<SpanEvent> events;

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder spanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder parentSpanId(String parentSpanId) {
            this.parentSpanId = parentSpanId;
            return this;
        }

        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder status(SpanStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder tags(Map<String, Object> tags) {
            this.tags = tags;
            return this;
        }

        public Builder events(List<SpanEvent> events) {
            this.events = events;
            return this;
        }

        public Span build() {
            Double duration = endTime != null ? millisBetween(startTime, endTime) : null;
            return new Span(traceId, spanId, parentSpanId, operationName, serviceName, tenantId, userId,
                    startTime, endTime, duration, status, errorMessage, tags, events);
        }
    }
}
