package com.telemetry.pipeline.storage;

import com.telemetry.pipeline.core.model.LogEntry;

import java.util.List;

/**
 * Storage adapter for structured log entries.
 * Implementations report expected failures by returning {@code false} rather than throwing.
 */
public interface LogStorage {

    boolean storeLog(LogEntry entry);

    /**
     * Stores a batch of entries. The default implementation stores them one by one.
     *
     * @return the number of entries stored
     */
    default int storeLogs(List<LogEntry> entries) {
        int stored = 0;
        for (LogEntry entry : entries) {
            if (storeLog(entry)) {
                stored++;
            }
        }
        return stored;
    }

    /**
     * Returns the tenant's log entries matching the query, oldest first.
     */
    List<LogEntry> queryLogs(LogQuery query);
}
