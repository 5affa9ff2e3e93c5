package com.telemetry.pipeline.context;

/**
 * Immutable correlation identifiers of one logical request.
 * All fields are optional; the {@code with*} methods return modified copies.
 *
 * @param traceId       identifier shared by every span of the request chain
 * @param spanId        identifier of the span currently in progress
 * @param parentSpanId  span id received from the caller, if any
 * @param tenantId      tenant owning all telemetry emitted by the request
 * @param userId        authenticated user, if known
 * @param correlationId request correlation identifier used by log entries
 */
public record CorrelationContext(
        String traceId,
        String spanId,
        String parentSpanId,
        String tenantId,
        String userId,
        String correlationId
) {
    private static final CorrelationContext EMPTY = new CorrelationContext(null, null, null, null, null, null);

    public static CorrelationContext empty() {
        return EMPTY;
    }

    /**
     * Creates a context for a brand new trace.
     */
    public static CorrelationContext newTrace(String tenantId) {
        return new CorrelationContext(TraceIdentifiers.newTraceId(), null, null, tenantId, null, null);
    }

    public boolean isEmpty() {
        return traceId == null && spanId == null && parentSpanId == null
                && tenantId == null && userId == null && correlationId == null;
    }

    public boolean hasTrace() {
        return traceId != null;
    }

    public CorrelationContext withTraceId(String value) {
        return new CorrelationContext(value, spanId, parentSpanId, tenantId, userId, correlationId);
    }

    public CorrelationContext withSpanId(String value) {
        return new CorrelationContext(traceId, value, parentSpanId, tenantId, userId, correlationId);
    }

    public CorrelationContext withParentSpanId(String value) {
        return new CorrelationContext(traceId, spanId, value, tenantId, userId, correlationId);
    }

    public CorrelationContext withTenantId(String value) {
        return new CorrelationContext(traceId, spanId, parentSpanId, value, userId, correlationId);
    }

    public CorrelationContext withUserId(String value) {
        return new CorrelationContext(traceId, spanId, parentSpanId, tenantId, value, correlationId);
    }

    public CorrelationContext withCorrelationId(String value) {
        return new CorrelationContext(traceId, spanId, parentSpanId, tenantId, userId, value);
    }
}
