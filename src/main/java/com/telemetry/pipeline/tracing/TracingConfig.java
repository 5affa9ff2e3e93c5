package com.telemetry.pipeline.tracing;

import com.telemetry.pipeline.context.TraceIdentifiers;

/**
 * Tracing settings of the local service.
 *
 * @param serviceName     service name stamped on every span and log entry
 * @param defaultTenantId tenant used when the correlation context carries none
 */
public record TracingConfig(String serviceName, String defaultTenantId) {

    public TracingConfig {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        TraceIdentifiers.validatePrincipal(defaultTenantId, "defaultTenantId");
    }

    /**
     * Default configuration: service {@code telemetry-pipeline}, tenant {@code default}.
     */
    public static TracingConfig defaults() {
        return new TracingConfig("telemetry-pipeline", "default");
    }

    public static TracingConfig forService(String serviceName) {
        return new TracingConfig(serviceName, "default");
    }
}
