package com.telemetry.pipeline.context;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Holds the {@link CorrelationContext} of the request executing on the current thread.
 *
 * <p>The stored value is immutable: every setter replaces it with a modified copy, so a
 * {@link #snapshot()} handed to another component never changes underneath it.
 * Concurrent requests on different threads never observe each other's identifiers.</p>
 *
 * <h2>Standard usage (request threads):</h2>
 * <pre>
 * CorrelationContextHolder.set(TraceHeaders.extract(request::getHeader));
 * try {
 *     recorder.withSpan("checkout", () -&gt; orders.checkout(cart));
 * } finally {
 *     CorrelationContextHolder.clear();
 * }
 * </pre>
 *
 * <h2>Scoped helper (restores the previous context):</h2>
 * <pre>
 * try (var scope = CorrelationContextHolder.scoped(context)) {
 *     recorder.withSpan("checkout", () -&gt; orders.checkout(cart));
 * }
 * </pre>
 *
 * <h2>Executor usage:</h2>
 * <p>Pool threads do not inherit the submitting thread's context. Wrap tasks explicitly:</p>
 * <pre>
 * executor.submit(CorrelationContextHolder.propagate(() -&gt; recorder.withSpan("send-mail", mailer::send)));
 * </pre>
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> current = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Returns the current context, or {@link CorrelationContext#empty()} if none is set.
     */
    public static CorrelationContext snapshot() {
        CorrelationContext ctx = current.get();
        return ctx != null ? ctx : CorrelationContext.empty();
    }

    /**
     * Replaces the current context. A null value clears it.
     */
    public static void set(CorrelationContext context) {
        if (context == null || context.isEmpty()) {
            current.remove();
        } else {
            current.set(context);
        }
    }

    public static void clear() {
        current.remove();
    }

    public static String getTraceId() {
        return snapshot().traceId();
    }

    public static void setTraceId(String traceId) {
        if (traceId != null) {
            TraceIdentifiers.validateTraceId(traceId);
        }
        set(snapshot().withTraceId(traceId));
    }

    public static String getSpanId() {
        return snapshot().spanId();
    }

    public static void setSpanId(String spanId) {
        if (spanId != null) {
            TraceIdentifiers.validateSpanId(spanId);
        }
        set(snapshot().withSpanId(spanId));
    }

    public static String getTenantId() {
        return snapshot().tenantId();
    }

    /**
     * Sets the tenant for this thread.
     *
     * @throws IllegalArgumentException if the tenant id is blank or malformed
     */
    public static void setTenantId(String tenantId) {
        TraceIdentifiers.validatePrincipal(tenantId, "tenantId");
        set(snapshot().withTenantId(tenantId));
    }

    public static String getUserId() {
        return snapshot().userId();
    }

    public static void setUserId(String userId) {
        if (userId != null) {
            TraceIdentifiers.validatePrincipal(userId, "userId");
        }
        set(snapshot().withUserId(userId));
    }

    public static String getCorrelationId() {
        return snapshot().correlationId();
    }

    public static void setCorrelationId(String correlationId) {
        set(snapshot().withCorrelationId(correlationId));
    }

    /**
     * Installs a context for the duration of a try-with-resources block.
     * Closing the scope restores whatever was current before.
     */
    public static Scope scoped(CorrelationContext context) {
        Objects.requireNonNull(context, "context is required");
        CorrelationContext previous = current.get();
        set(context);
        return new Scope(previous);
    }

    /**
     * Captures the current context and returns a {@link Runnable} that installs it on the
     * executing thread and restores that thread's previous context afterwards.
     *
     * @param task the task to wrap
     * @return the wrapped task
     */
    public static Runnable propagate(Runnable task) {
        Objects.requireNonNull(task, "task is required");
        CorrelationContext captured = current.get();
        return () -> {
            CorrelationContext previous = current.get();
            set(captured);
            try {
                task.run();
            } finally {
                set(previous);
            }
        };
    }

    /**
     * Callable variant of {@link #propagate(Runnable)}.
     *
     * @param task the callable to wrap
     * @param <T>  the return type
     * @return the wrapped callable
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Objects.requireNonNull(task, "task is required");
        CorrelationContext captured = current.get();
        return () -> {
            CorrelationContext previous = current.get();
            set(captured);
            try {
                return task.call();
            } finally {
                set(previous);
            }
        };
    }

    /**
     * AutoCloseable that restores the context that was current when the scope was opened.
     */
    public static final class Scope implements AutoCloseable {
        private final CorrelationContext previous;

        private Scope(CorrelationContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            set(previous);
        }
    }
}
