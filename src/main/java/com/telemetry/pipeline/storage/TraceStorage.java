package com.telemetry.pipeline.storage;

import com.telemetry.pipeline.core.model.Span;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Storage adapter for finished spans.
 */
public interface TraceStorage {

    /**
     * Stores a finished span. Storing a span again with the same ids replaces it.
     *
     * @return true if the span was stored
     * @throws IllegalArgumentException if the span is still active
     */
    boolean storeTraceSpan(Span span);

    /**
     * Returns all spans of a trace ordered by start time, or an empty list.
     */
    List<Span> getTrace(String traceId);

    Optional<Span> getSpan(String traceId, String spanId);

    /**
     * Returns the tenant's spans matching the query, ordered by start time.
     */
    List<Span> queryTraces(TraceQuery query);

    /**
     * Returns every stored span accepted by the predicate, in no particular order.
     */
    List<Span> findSpans(Predicate<Span> predicate);
}
