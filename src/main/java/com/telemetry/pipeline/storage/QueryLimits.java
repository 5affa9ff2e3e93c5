package com.telemetry.pipeline.storage;

import java.time.Instant;

/**
 * Result size limits shared by the storage query records.
 */
public final class QueryLimits {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 10_000;

    private QueryLimits() {
        // utility class
    }

    static int validate(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        return limit;
    }

    static String requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required for telemetry queries");
        }
        return tenantId;
    }

    static void validateRange(Instant startTime, Instant endTime) {
        if (startTime != null && endTime != null && endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime must not be before startTime");
        }
    }

    static boolean inRange(Instant t, Instant startTime, Instant endTime) {
        return (startTime == null || !t.isBefore(startTime)) && (endTime == null || !t.isAfter(endTime));
    }
}
