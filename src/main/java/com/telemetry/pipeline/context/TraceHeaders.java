package com.telemetry.pipeline.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Reads and writes correlation identifiers carried as HTTP headers.
 */
public final class TraceHeaders {

    private static final Logger log = LoggerFactory.getLogger(TraceHeaders.class);

    public static final String TRACE_ID = "X-Trace-ID";
    public static final String SPAN_ID = "X-Span-ID";
    public static final String PARENT_SPAN_ID = "X-Parent-Span-ID";
    public static final String TENANT_ID = "X-Tenant-ID";
    public static final String USER_ID = "X-User-ID";
    public static final String CORRELATION_ID = "X-Correlation-ID";

    private TraceHeaders() {
        // utility class
    }

    /**
     * Builds the context of an inbound request.
     *
     * <p>A new trace id is generated when {@code X-Trace-ID} is absent or malformed. The caller's
     * span ({@code X-Parent-Span-ID}, else {@code X-Span-ID}) becomes both the parent and the
     * current span id, so the first span opened for the request links to it. A correlation id is
     * generated when none is supplied.</p>
     *
     * @param headerLookup returns the header value for a name, or null
     */
    public static CorrelationContext extract(Function<String, String> headerLookup) {
        Objects.requireNonNull(headerLookup, "headerLookup is required");

        String traceId = validIdOrNull(headerLookup.apply(TRACE_ID), TRACE_ID);
        if (traceId == null) {
            traceId = TraceIdentifiers.newTraceId();
        }

        String parentSpanId = validIdOrNull(headerLookup.apply(PARENT_SPAN_ID), PARENT_SPAN_ID);
        if (parentSpanId == null) {
            parentSpanId = validIdOrNull(headerLookup.apply(SPAN_ID), SPAN_ID);
        }

        String tenantId = validPrincipalOrNull(headerLookup.apply(TENANT_ID), TENANT_ID);
        String userId = validPrincipalOrNull(headerLookup.apply(USER_ID), USER_ID);

        String correlationId = headerLookup.apply(CORRELATION_ID);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        return new CorrelationContext(traceId, parentSpanId, parentSpanId, tenantId, userId, correlationId);
    }

    /**
     * Returns the headers to send on an outbound request or response. Null values are omitted.
     */
    public static Map<String, String> inject(CorrelationContext context) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (context == null) {
            return headers;
        }
        putIfPresent(headers, TRACE_ID, context.traceId());
        putIfPresent(headers, SPAN_ID, context.spanId());
        putIfPresent(headers, TENANT_ID, context.tenantId());
        putIfPresent(headers, USER_ID, context.userId());
        putIfPresent(headers, CORRELATION_ID, context.correlationId());
        return headers;
    }

    private static String validIdOrNull(String value, String header) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (!TraceIdentifiers.isValidId(trimmed)) {
            log.warn("trace.header.invalid header={} length={}", header, trimmed.length());
            return null;
        }
        return trimmed;
    }

    private static String validPrincipalOrNull(String value, String header) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return TraceIdentifiers.validatePrincipal(value.trim(), header);
        } catch (IllegalArgumentException e) {
            log.warn("trace.header.invalid header={} reason={}", header, e.getMessage());
            return null;
        }
    }

    private static void putIfPresent(Map<String, String> headers, String name, String value) {
        if (value != null) {
            headers.put(name, value);
        }
    }
}
