package com.telemetry.pipeline.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and combines them into one status: the worst individual
 * status wins, and each check's result is reported as a detail under its name.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public HealthCheckRegistry register(HealthCheck check) {
        checks.add(Objects.requireNonNull(check, "check is required"));
        return this;
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        Map<String, Object> results = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        return new HealthStatus(worst.status(), message, results);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed name={}", check.getName(), e);
            return HealthStatus.down("Health check threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
