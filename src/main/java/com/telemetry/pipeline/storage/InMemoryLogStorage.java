package com.telemetry.pipeline.storage;

import com.telemetry.pipeline.core.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * In-memory implementation of {@link LogStorage} for development and tests.
 * Thread-safe; entries are partitioned by tenant.
 */
public class InMemoryLogStorage implements LogStorage {
    private static final Logger log = LoggerFactory.getLogger(InMemoryLogStorage.class);

    private final TenantPartitionedStore<LogEntry> store;

    public InMemoryLogStorage() {
        this(0);
    }

    public InMemoryLogStorage(int maxEntriesPerTenant) {
        if (maxEntriesPerTenant < 0) {
            throw new IllegalArgumentException("maxEntriesPerTenant must be >= 0");
        }
        this.store = new TenantPartitionedStore<>(LogEntry::tenantId, LogEntry::timestamp, maxEntriesPerTenant);
    }

    @Override
    public boolean storeLog(LogEntry entry) {
        Objects.requireNonNull(entry, "entry is required");
        return storeLogs(List.of(entry)) == 1;
    }

    @Override
    public int storeLogs(List<LogEntry> entries) {
        int evicted = store.addAll(entries);
        if (evicted > 0) {
            log.debug("storage.logs.evicted count={}", evicted);
        }
        return entries.size();
    }

    @Override
    public List<LogEntry> queryLogs(LogQuery query) {
        Objects.requireNonNull(query, "query is required");
        return store.query(query.tenantId(), query::matches, query.limit());
    }

    public int count(String tenantId) {
        return store.size(tenantId);
    }

    public void clear() {
        store.clear();
    }
}
