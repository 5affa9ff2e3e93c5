package com.telemetry.pipeline.storage;

/**
 * Key layout shared by cache-backed storage adapters.
 */
public final class StorageKeys {

    public static final String SPAN_PREFIX = "span:";
    public static final String TRACE_PREFIX = "trace:";
    public static final String PERFORMANCE_PREFIX = "perf_metrics:";

    private StorageKeys() {
        // utility class
    }

    /** {@code span:{traceId}:{spanId}} */
    public static String span(String traceId, String spanId) {
        return SPAN_PREFIX + traceId + ":" + spanId;
    }

    /** {@code trace:{traceId}} */
    public static String trace(String traceId) {
        return TRACE_PREFIX + traceId;
    }

    /** {@code perf_metrics:{operationName}} */
    public static String performance(String operationName) {
        return PERFORMANCE_PREFIX + operationName;
    }

    /**
     * Strips {@link #PERFORMANCE_PREFIX} from a performance key.
     */
    public static String operationOf(String performanceKey) {
        return performanceKey.startsWith(PERFORMANCE_PREFIX)
                ? performanceKey.substring(PERFORMANCE_PREFIX.length())
                : performanceKey;
    }
}
