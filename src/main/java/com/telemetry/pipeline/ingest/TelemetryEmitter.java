package com.telemetry.pipeline.ingest;

import com.telemetry.pipeline.context.CorrelationContext;
import com.telemetry.pipeline.context.CorrelationContextHolder;
import com.telemetry.pipeline.core.model.LogEntry;
import com.telemetry.pipeline.core.model.LogLevel;
import com.telemetry.pipeline.core.model.Metric;
import com.telemetry.pipeline.core.model.MetricType;
import com.telemetry.pipeline.tracing.TracingConfig;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Producer-side API for application metrics and structured logs.
 * Items are stamped with the tenant and correlation identifiers of the current
 * {@link CorrelationContextHolder} context and submitted to the {@link IngestionQueueManager}.
 * Every method returns whether the item was accepted; a full queue never blocks the caller.
 */
public class TelemetryEmitter {

    private final IngestionQueueManager queueManager;
    private final TracingConfig config;

    public TelemetryEmitter(IngestionQueueManager queueManager, TracingConfig config) {
        this.queueManager = Objects.requireNonNull(queueManager, "queueManager is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public boolean counter(String name, double value, Map<String, String> labels) {
        return metric(name, MetricType.COUNTER, value, labels);
    }

    public boolean gauge(String name, double value, Map<String, String> labels) {
        return metric(name, MetricType.GAUGE, value, labels);
    }

    public boolean histogram(String name, double value, Map<String, String> labels) {
        return metric(name, MetricType.HISTOGRAM, value, labels);
    }

    /**
     * @throws IllegalArgumentException if the name is blank or the value is not finite
     */
    public boolean metric(String name, MetricType type, double value, Map<String, String> labels) {
        Metric metric = new Metric(name, type, value, Instant.now(), labels, currentTenant());
        return queueManager.submitMetric(metric);
    }

    public boolean info(String component, String message, Map<String, Object> fields) {
        return log(LogLevel.INFO, component, message, fields);
    }

    public boolean warning(String component, String message, Map<String, Object> fields) {
        return log(LogLevel.WARNING, component, message, fields);
    }

    public boolean error(String component, String message, Map<String, Object> fields) {
        return log(LogLevel.ERROR, component, message, fields);
    }

    public boolean log(LogLevel level, String component, String message, Map<String, Object> fields) {
        CorrelationContext context = CorrelationContextHolder.snapshot();
        LogEntry entry = LogEntry.builder()
                .level(level)
                .message(message)
                .service(config.serviceName())
                .component(component)
                .fields(fields)
                .correlation(context)
                .tenantId(context.tenantId() != null ? context.tenantId() : config.defaultTenantId())
                .build();
        return queueManager.submitLog(entry);
    }

    private String currentTenant() {
        String tenantId = CorrelationContextHolder.getTenantId();
        return tenantId != null ? tenantId : config.defaultTenantId();
    }
}
