package com.telemetry.pipeline.storage;

/**
 * Configuration for the bundled storage adapters.
 *
 * @param traceTtlSeconds      time-to-live of span and trace entries, refreshed on every write
 * @param maxSpans             upper bound on cached spans, summed over every cached trace
 * @param maxEntriesPerTenant  per-tenant cap for the in-memory metric and log stores, 0 for unbounded
 */
public record StorageConfig(long traceTtlSeconds, long maxSpans, int maxEntriesPerTenant) {

    public StorageConfig {
        if (traceTtlSeconds <= 0) {
            throw new IllegalArgumentException("traceTtlSeconds must be > 0");
        }
        if (maxSpans <= 0) {
            throw new IllegalArgumentException("maxSpans must be > 0");
        }
        if (maxEntriesPerTenant < 0) {
            throw new IllegalArgumentException("maxEntriesPerTenant must be >= 0");
        }
    }

    /**
     * Default storage configuration: 24h trace TTL, 1,000,000 spans, 100,000 entries per tenant.
     */
    public static StorageConfig defaults() {
        return new StorageConfig(86_400, 1_000_000, 100_000);
    }
}
