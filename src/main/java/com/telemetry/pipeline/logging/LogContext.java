package com.telemetry.pipeline.logging;

import com.telemetry.pipeline.context.CorrelationContext;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC scope that exposes correlation identifiers to every log line
 * written on the current thread. Null values are skipped; closing removes only the
 * keys this scope added.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCorrelation(CorrelationContextHolder.snapshot())) {
 *     log.info("order.placed orderId={}", orderId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String TENANT_ID = "tenantId";
    public static final String USER_ID = "userId";
    public static final String CORRELATION_ID = "correlationId";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forCorrelation(CorrelationContext context) {
        LogContext ctx = new LogContext();
        if (context != null) {
            ctx.put(TRACE_ID, context.traceId());
            ctx.put(SPAN_ID, context.spanId());
            ctx.put(TENANT_ID, context.tenantId());
            ctx.put(USER_ID, context.userId());
            ctx.put(CORRELATION_ID, context.correlationId());
        }
        return ctx;
    }

    /**
     * Scope for a background task such as an ingestion consumer.
     */
    public static LogContext forTask(String taskName) {
        LogContext ctx = new LogContext();
        ctx.put("task", taskName);
        return ctx;
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value != null) {
            keys.add(key);
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
