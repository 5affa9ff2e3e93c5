package com.telemetry.pipeline.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.telemetry.pipeline.core.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Caffeine-backed {@link TraceStorage} using the TTL cache key layout of {@link StorageKeys}.
 *
 * <p>The span list under {@code trace:{traceId}} is the unit of retention: it is weighed by its
 * span count against {@code maxSpans} and expires as a whole after the configured TTL, refreshed
 * by every write to the trace. {@code span:{traceId}:{spanId}} is an index into those lists and
 * is dropped together with its trace, so a span is never readable without its trace.</p>
 */
public class CaffeineTraceStorage implements TraceStorage {
    private static final Logger log = LoggerFactory.getLogger(CaffeineTraceStorage.class);

    private static final Comparator<Span> BY_START_TIME = Comparator.comparing(Span::startTime);

    private final Cache<String, Span> spans;
    private final Cache<String, List<Span>> traces;

    public CaffeineTraceStorage(StorageConfig config) {
        Duration ttl = Duration.ofSeconds(config.traceTtlSeconds());
        this.spans = Caffeine.newBuilder()
                .recordStats()
                .build();
        this.traces = Caffeine.newBuilder()
                .maximumWeight(config.maxSpans())
                .weigher((String key, List<Span> trace) -> trace.size())
                .expireAfterWrite(ttl)
                .evictionListener((String key, List<Span> trace, RemovalCause cause) -> dropIndex(trace, cause))
                .build();
        log.info("storage.traces.initialized maxSpans={} ttl={}s", config.maxSpans(), config.traceTtlSeconds());
    }

    @Override
    public boolean storeTraceSpan(Span span) {
        Objects.requireNonNull(span, "span is required");
        if (span.isActive()) {
            throw new IllegalArgumentException("Only finished spans can be stored, span " + span.spanId() + " is active");
        }
        String spanKey = StorageKeys.span(span.traceId(), span.spanId());
        traces.asMap().compute(StorageKeys.trace(span.traceId()), (key, existing) -> {
            List<Span> updated;
            if (existing == null) {
                updated = new ArrayList<>(1);
            } else if (spans.getIfPresent(spanKey) != null) {
                updated = new ArrayList<>(existing.size());
                for (Span s : existing) {
                    if (!s.spanId().equals(span.spanId())) {
                        updated.add(s);
                    }
                }
            } else {
                updated = new ArrayList<>(existing.size() + 1);
                updated.addAll(existing);
            }
            updated.add(insertionPoint(updated, span.startTime()), span);
            spans.put(spanKey, span);
            return Collections.unmodifiableList(updated);
        });
        return true;
    }

    @Override
    public List<Span> getTrace(String traceId) {
        Objects.requireNonNull(traceId, "traceId is required");
        List<Span> trace = traces.getIfPresent(StorageKeys.trace(traceId));
        return trace != null ? trace : List.of();
    }

    @Override
    public Optional<Span> getSpan(String traceId, String spanId) {
        Objects.requireNonNull(traceId, "traceId is required");
        Objects.requireNonNull(spanId, "spanId is required");
        if (traces.getIfPresent(StorageKeys.trace(traceId)) == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(spans.getIfPresent(StorageKeys.span(traceId, spanId)));
    }

    @Override
    public List<Span> queryTraces(TraceQuery query) {
        Objects.requireNonNull(query, "query is required");
        List<Span> matches = new ArrayList<>(findSpans(query::matches));
        matches.sort(BY_START_TIME);
        if (matches.size() > query.limit()) {
            return List.copyOf(matches.subList(matches.size() - query.limit(), matches.size()));
        }
        return List.copyOf(matches);
    }

    @Override
    public List<Span> findSpans(Predicate<Span> predicate) {
        List<Span> result = new ArrayList<>();
        for (List<Span> trace : traces.asMap().values()) {
            for (Span span : trace) {
                if (predicate.test(span)) {
                    result.add(span);
                }
            }
        }
        return result;
    }

    /**
     * Approximate number of cached spans.
     */
    public long spanCount() {
        return spans.estimatedSize();
    }

    public void invalidateAll() {
        traces.invalidateAll();
        spans.invalidateAll();
    }

    /**
     * Runs pending evictions now instead of on Caffeine's maintenance schedule.
     */
    void cleanUp() {
        traces.cleanUp();
    }

    private void dropIndex(List<Span> trace, RemovalCause cause) {
        if (trace == null) {
            return;
        }
        for (Span span : trace) {
            spans.invalidate(StorageKeys.span(span.traceId(), span.spanId()));
        }
        log.debug("storage.trace.evicted cause={} spans={}", cause, trace.size());
    }

    /**
     * Index after every span starting at or before {@code startTime}, so equal start times keep
     * arrival order.
     */
    static int insertionPoint(List<Span> trace, Instant startTime) {
        int low = 0;
        int high = trace.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (trace.get(mid).startTime().isAfter(startTime)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }
}
