package com.telemetry.pipeline.query;

import com.telemetry.pipeline.aggregation.MetricStatistics;
import com.telemetry.pipeline.aggregation.PerformanceAggregator;
import com.telemetry.pipeline.core.model.LogEntry;
import com.telemetry.pipeline.core.model.Metric;
import com.telemetry.pipeline.core.model.PerformanceRecord;
import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.core.model.SpanStatus;
import com.telemetry.pipeline.ingest.IngestionQueueManager;
import com.telemetry.pipeline.ingest.IngestionStats;
import com.telemetry.pipeline.storage.LogQuery;
import com.telemetry.pipeline.storage.LogStorage;
import com.telemetry.pipeline.storage.MetricQuery;
import com.telemetry.pipeline.storage.MetricStorage;
import com.telemetry.pipeline.storage.TraceQuery;
import com.telemetry.pipeline.storage.TraceStorage;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read-only view over trace storage, the performance aggregator and the metric and log stores.
 * Nothing here mutates state.
 */
public class TelemetryQueryFacade {

    private static final Comparator<Span> SLOWEST_FIRST =
            Comparator.comparing(Span::durationMs, Comparator.reverseOrder());
    private static final Comparator<Span> MOST_RECENT_FIRST =
            Comparator.comparing(Span::endTime, Comparator.reverseOrder());

    private final TraceStorage traceStorage;
    private final PerformanceAggregator aggregator;
    private final MetricStorage metricStorage;
    private final LogStorage logStorage;
    private final IngestionQueueManager queueManager;

    public TelemetryQueryFacade(TraceStorage traceStorage, PerformanceAggregator aggregator,
                                MetricStorage metricStorage, LogStorage logStorage,
                                IngestionQueueManager queueManager) {
        this.traceStorage = Objects.requireNonNull(traceStorage, "traceStorage is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.metricStorage = Objects.requireNonNull(metricStorage, "metricStorage is required");
        this.logStorage = Objects.requireNonNull(logStorage, "logStorage is required");
        this.queueManager = queueManager;
    }

    /**
     * All spans of a trace ordered by start time, empty if unknown.
     */
    public List<Span> getTrace(String traceId) {
        return traceStorage.getTrace(traceId);
    }

    public Optional<Span> getSpan(String traceId, String spanId) {
        return traceStorage.getSpan(traceId, spanId);
    }

    public Optional<PerformanceRecord> getPerformance(String operationName) {
        return aggregator.read(operationName);
    }

    /**
     * Every live performance record keyed by operation name.
     */
    public Map<String, PerformanceRecord> getPerformance() {
        return aggregator.readAll();
    }

    /**
     * Spans of any tenant lasting at least {@code thresholdMs}, slowest first.
     *
     * <p>Operator use only. Nothing tenant-facing may call this; the REST layer uses
     * {@link #getSlowTraces(String, double, int)}.</p>
     */
    public List<Span> getSlowTraces(double thresholdMs, int limit) {
        return slowSpans(span -> true, thresholdMs, limit);
    }

    public List<Span> getSlowTraces(String tenantId, double thresholdMs, int limit) {
        requireTenant(tenantId);
        return slowSpans(span -> tenantId.equals(span.tenantId()), thresholdMs, limit);
    }

    /**
     * Spans of any tenant finished with ERROR, most recent first.
     *
     * <p>Operator use only. Nothing tenant-facing may call this; the REST layer uses
     * {@link #getErrorTraces(String, int)}.</p>
     */
    public List<Span> getErrorTraces(int limit) {
        return errorSpans(span -> true, limit);
    }

    public List<Span> getErrorTraces(String tenantId, int limit) {
        requireTenant(tenantId);
        return errorSpans(span -> tenantId.equals(span.tenantId()), limit);
    }

    public List<Span> queryTraces(TraceQuery query) {
        return traceStorage.queryTraces(query);
    }

    public List<Metric> queryMetrics(MetricQuery query) {
        return metricStorage.queryMetrics(query);
    }

    public List<LogEntry> queryLogs(LogQuery query) {
        return logStorage.queryLogs(query);
    }

    /**
     * Count, min, max, average, sum and list-index percentiles of the values matched by the query.
     */
    public MetricStatistics getMetricStatistics(MetricQuery query) {
        return MetricStatistics.of(metricStorage.queryMetrics(query).stream()
                .map(Metric::value)
                .toList());
    }

    public Optional<IngestionStats> getIngestionStats() {
        return queueManager == null ? Optional.empty() : Optional.of(queueManager.getStats());
    }

    private List<Span> slowSpans(Predicate<Span> scope, double thresholdMs, int limit) {
        if (!Double.isFinite(thresholdMs) || thresholdMs < 0) {
            throw new IllegalArgumentException("thresholdMs must be a finite value >= 0");
        }
        validateLimit(limit);
        return traceStorage.findSpans(scope.and(span -> span.durationMs() != null && span.durationMs() >= thresholdMs))
                .stream()
                .sorted(SLOWEST_FIRST)
                .limit(limit)
                .toList();
    }

    private List<Span> errorSpans(Predicate<Span> scope, int limit) {
        validateLimit(limit);
        return traceStorage.findSpans(scope.and(span -> span.status() == SpanStatus.ERROR))
                .stream()
                .sorted(MOST_RECENT_FIRST)
                .limit(limit)
                .toList();
    }

    private static void validateLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }
}
