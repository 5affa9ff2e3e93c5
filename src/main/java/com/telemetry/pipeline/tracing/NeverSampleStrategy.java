package com.telemetry.pipeline.tracing;

import java.util.Map;

/**
 * Records no trace. Failed spans are still stored, see {@link SpanRecorder}.
 */
public class NeverSampleStrategy implements SamplingStrategy {

    @Override
    public SamplingDecision shouldSample(String traceId, String operationName, Map<String, ?> tags) {
        return SamplingDecision.NOT_RECORD;
    }
}
