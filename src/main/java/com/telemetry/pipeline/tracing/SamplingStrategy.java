package com.telemetry.pipeline.tracing;

import java.util.Map;

/**
 * Decides whether a new trace is recorded and exported.
 *
 * <p>{@link SpanRecorder} consults the strategy once per trace, when a span starts without a
 * local parent. Child spans inherit their parent's decision so a trace is never half recorded.
 * The default {@link AlwaysSampleStrategy} keeps everything.</p>
 */
public interface SamplingStrategy {

    /**
     * @param traceId       trace the new span belongs to
     * @param operationName name of the span being started
     * @param tags          tags supplied at start, never null
     */
    SamplingDecision shouldSample(String traceId, String operationName, Map<String, ?> tags);
}
