package com.telemetry.pipeline.tracing;

/**
 * What happens to a span once it finishes.
 * Performance statistics are updated for every span regardless of the decision.
 */
public enum SamplingDecision {
    /** Neither stored nor exported. */
    NOT_RECORD("not_record"),
    /** Stored in trace storage but not exported. */
    RECORD("record"),
    /** Stored and exported. */
    RECORD_AND_SAMPLE("record_and_sampled");

    private final String tagValue;

    SamplingDecision(String tagValue) {
        this.tagValue = tagValue;
    }

    /**
     * Value of the {@code sampling.decision} span tag.
     */
    public String tagValue() {
        return tagValue;
    }

    public boolean isRecorded() {
        return this != NOT_RECORD;
    }

    public boolean isSampled() {
        return this == RECORD_AND_SAMPLE;
    }
}
