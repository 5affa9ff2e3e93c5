package com.telemetry.pipeline.tracing;

import java.util.Map;

/**
 * Samples a fixed fraction of traces.
 *
 * <p>The decision is a function of the trace id, so every service sharing a trace id and a
 * rate reaches the same decision.</p>
 */
public class ProbabilitySampleStrategy implements SamplingStrategy {

    private static final int BUCKETS = 1_000_000;

    private final double sampleRate;
    private final int threshold;

    /**
     * @param sampleRate fraction of traces to sample, clamped to [0, 1]
     */
    public ProbabilitySampleStrategy(double sampleRate) {
        if (Double.isNaN(sampleRate)) {
            throw new IllegalArgumentException("sampleRate must be a number");
        }
        this.sampleRate = Math.max(0.0, Math.min(1.0, sampleRate));
        this.threshold = (int) (this.sampleRate * BUCKETS);
    }

    public double getSampleRate() {
        return sampleRate;
    }

    @Override
    public SamplingDecision shouldSample(String traceId, String operationName, Map<String, ?> tags) {
        return bucket(traceId) < threshold ? SamplingDecision.RECORD_AND_SAMPLE : SamplingDecision.NOT_RECORD;
    }

    static int bucket(String traceId) {
        return Math.floorMod(traceId.hashCode(), BUCKETS);
    }
}
