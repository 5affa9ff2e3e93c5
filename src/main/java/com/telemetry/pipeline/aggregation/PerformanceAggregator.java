package com.telemetry.pipeline.aggregation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.telemetry.pipeline.core.model.PerformanceRecord;
import com.telemetry.pipeline.storage.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Running per-operation latency and success statistics.
 *
 * <p>Records live in a Caffeine cache under {@code perf_metrics:{operation}} and expire one TTL
 * after their last update. Each update is a single atomic read-modify-write on the cache's map
 * view, so concurrent updates for the same operation are never lost and the resulting counters
 * do not depend on interleaving.</p>
 */
public class PerformanceAggregator {
    private static final Logger log = LoggerFactory.getLogger(PerformanceAggregator.class);

    /** Default record TTL. */
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final Cache<String, PerformanceRecord> records;
    private final Clock clock;

    public PerformanceAggregator() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    public PerformanceAggregator(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public PerformanceAggregator(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.clock = clock;
        this.records = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .build();
        log.debug("aggregator.initialized ttl={}", ttl);
    }

    /**
     * Records one finished operation.
     *
     * @param operationName operation the observation belongs to
     * @param durationMs    duration in milliseconds, finite and non-negative
     * @param success       whether the operation finished with status OK
     */
    public void update(String operationName, double durationMs, boolean success) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName must not be null or blank");
        }
        if (!Double.isFinite(durationMs) || durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be a finite value >= 0, got " + durationMs);
        }
        records.asMap().compute(StorageKeys.performance(operationName), (key, current) -> current == null
                ? PerformanceRecord.first(operationName, durationMs, success, clock.instant())
                : current.record(durationMs, success, clock.instant()));
    }

    public Optional<PerformanceRecord> read(String operationName) {
        if (operationName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.getIfPresent(StorageKeys.performance(operationName)));
    }

    /**
     * Snapshot of every live record keyed by operation name, sorted by name.
     */
    public Map<String, PerformanceRecord> readAll() {
        Map<String, PerformanceRecord> result = new TreeMap<>();
        records.asMap().forEach((key, rec) -> result.put(StorageKeys.operationOf(key), rec));
        return result;
    }

    public void reset() {
        records.invalidateAll();
        log.info("aggregator.reset");
    }
}
