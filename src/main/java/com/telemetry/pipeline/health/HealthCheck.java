package com.telemetry.pipeline.health;

/**
 * A check of one pipeline component.
 */
public interface HealthCheck {

    /**
     * Name under which the result is reported.
     */
    String getName();

    /**
     * Checks the component. Implementations report problems through the returned status;
     * an exception is treated by {@link HealthCheckRegistry} as {@code DOWN}.
     */
    HealthStatus check();
}
