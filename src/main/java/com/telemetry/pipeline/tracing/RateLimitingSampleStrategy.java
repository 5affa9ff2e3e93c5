package com.telemetry.pipeline.tracing;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Samples at most {@code maxTracesPerSecond} traces per second using a token bucket.
 * The bucket starts full, so a burst of up to one second's budget is sampled immediately.
 */
public class RateLimitingSampleStrategy implements SamplingStrategy {

    private final int maxTracesPerSecond;
    private final Clock clock;
    private double tokens;
    private long lastRefillNanos;

    public RateLimitingSampleStrategy(int maxTracesPerSecond) {
        this(maxTracesPerSecond, Clock.systemUTC());
    }

    public RateLimitingSampleStrategy(int maxTracesPerSecond, Clock clock) {
        if (maxTracesPerSecond < 0) {
            throw new IllegalArgumentException("maxTracesPerSecond must be >= 0, got: " + maxTracesPerSecond);
        }
        this.maxTracesPerSecond = maxTracesPerSecond;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.tokens = maxTracesPerSecond;
        this.lastRefillNanos = nanos();
    }

    public int getMaxTracesPerSecond() {
        return maxTracesPerSecond;
    }

    @Override
    public synchronized SamplingDecision shouldSample(String traceId, String operationName, Map<String, ?> tags) {
        long now = nanos();
        long elapsed = Math.max(0, now - lastRefillNanos);
        tokens = Math.min(maxTracesPerSecond, tokens + elapsed * maxTracesPerSecond / 1_000_000_000.0);
        lastRefillNanos = now;

        if (tokens >= 1.0) {
            tokens -= 1.0;
            return SamplingDecision.RECORD_AND_SAMPLE;
        }
        return SamplingDecision.NOT_RECORD;
    }

    private long nanos() {
        var instant = clock.instant();
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }
}
