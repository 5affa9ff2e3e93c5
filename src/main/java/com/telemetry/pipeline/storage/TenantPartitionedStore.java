package com.telemetry.pipeline.storage;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Per-tenant insertion-ordered buckets guarded by a read/write lock.
 * When a tenant bucket exceeds its cap the oldest entries are evicted first.
 */
class TenantPartitionedStore<T> {

    private final Map<String, Deque<T>> buckets = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Function<T, String> tenantOf;
    private final Function<T, Instant> timestampOf;
    private final int maxEntriesPerTenant;

    TenantPartitionedStore(Function<T, String> tenantOf, Function<T, Instant> timestampOf, int maxEntriesPerTenant) {
        this.tenantOf = tenantOf;
        this.timestampOf = timestampOf;
        this.maxEntriesPerTenant = maxEntriesPerTenant;
    }

    /**
     * Adds the items and returns how many were evicted to respect the cap.
     */
    int addAll(List<T> items) {
        int evicted = 0;
        lock.writeLock().lock();
        try {
            for (T item : items) {
                Deque<T> bucket = buckets.computeIfAbsent(tenantOf.apply(item), k -> new ArrayDeque<>());
                bucket.addLast(item);
                if (maxEntriesPerTenant > 0) {
                    while (bucket.size() > maxEntriesPerTenant) {
                        bucket.removeFirst();
                        evicted++;
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return evicted;
    }

    /**
     * Returns the matching entries of one tenant ordered by timestamp, keeping the most recent {@code limit}.
     */
    List<T> query(String tenantId, Predicate<T> filter, int limit) {
        List<T> matches = new ArrayList<>();
        lock.readLock().lock();
        try {
            Deque<T> bucket = buckets.get(tenantId);
            if (bucket == null) {
                return List.of();
            }
            for (T item : bucket) {
                if (filter.test(item)) {
                    matches.add(item);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        matches.sort(Comparator.comparing(timestampOf));
        if (matches.size() > limit) {
            return List.copyOf(matches.subList(matches.size() - limit, matches.size()));
        }
        return List.copyOf(matches);
    }

    int size(String tenantId) {
        lock.readLock().lock();
        try {
            Deque<T> bucket = buckets.get(tenantId);
            return bucket == null ? 0 : bucket.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    void clear() {
        lock.writeLock().lock();
        try {
            buckets.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
