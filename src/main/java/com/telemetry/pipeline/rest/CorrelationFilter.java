package com.telemetry.pipeline.rest;

import com.telemetry.pipeline.context.CorrelationContextHolder;
import com.telemetry.pipeline.context.TraceHeaders;
import com.telemetry.pipeline.core.model.SpanStatus;
import com.telemetry.pipeline.logging.LogContext;
import com.telemetry.pipeline.tracing.SpanHandle;
import com.telemetry.pipeline.tracing.SpanRecorder;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jakarta RS filter that establishes the correlation context of each request.
 *
 * <p>On the way in it reads the {@code X-*} correlation headers (generating a trace id when
 * absent), installs the context for the request thread, opens the root {@code http.request}
 * span and populates the MDC. On the way out it writes the correlation headers on the response,
 * finishes the span ({@code ERROR} for 5xx responses) and clears the context.</p>
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 100)
public class CorrelationFilter implements ContainerRequestFilter, ContainerResponseFilter {

    static final String ROOT_OPERATION = "http.request";
    static final String SPAN_PROPERTY = CorrelationFilter.class.getName() + ".span";
    static final String LOG_CONTEXT_PROPERTY = CorrelationFilter.class.getName() + ".logContext";

    private final SpanRecorder spanRecorder;

    public CorrelationFilter(SpanRecorder spanRecorder) {
        this.spanRecorder = spanRecorder;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        CorrelationContextHolder.set(TraceHeaders.extract(requestContext::getHeaderString));

        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("http.method", requestContext.getMethod());
        tags.put("http.route", "/" + requestContext.getUriInfo().getPath());
        SpanHandle span = spanRecorder.startSpan(ROOT_OPERATION, tags);

        requestContext.setProperty(SPAN_PROPERTY, span);
        requestContext.setProperty(LOG_CONTEXT_PROPERTY,
                LogContext.forCorrelation(CorrelationContextHolder.snapshot()));
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        try {
            TraceHeaders.inject(CorrelationContextHolder.snapshot())
                    .forEach((name, value) -> responseContext.getHeaders().putSingle(name, value));

            if (requestContext.getProperty(SPAN_PROPERTY) instanceof SpanHandle span && !span.isFinished()) {
                int statusCode = responseContext.getStatus();
                span.setTag("http.status_code", statusCode);
                if (statusCode >= 500) {
                    spanRecorder.finishSpan(span, SpanStatus.ERROR, "HTTP " + statusCode);
                } else {
                    spanRecorder.finishSpan(span, SpanStatus.OK, null);
                }
            }
        } finally {
            if (requestContext.getProperty(LOG_CONTEXT_PROPERTY) instanceof LogContext logContext) {
                logContext.close();
            }
            requestContext.removeProperty(SPAN_PROPERTY);
            requestContext.removeProperty(LOG_CONTEXT_PROPERTY);
            CorrelationContextHolder.clear();
        }
    }
}
