package com.telemetry.pipeline.tracing;

import java.util.Map;

/**
 * Records and exports every trace.
 */
public class AlwaysSampleStrategy implements SamplingStrategy {

    @Override
    public SamplingDecision shouldSample(String traceId, String operationName, Map<String, ?> tags) {
        return SamplingDecision.RECORD_AND_SAMPLE;
    }
}
