package com.telemetry.pipeline.tracing;

import com.telemetry.pipeline.context.TraceIdentifiers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SamplingStrategyTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("Always and never strategies should return fixed decisions")
    void testFixedStrategies() {
        assertEquals(SamplingDecision.RECORD_AND_SAMPLE,
                new AlwaysSampleStrategy().shouldSample("t", "op", Map.of()));
        assertEquals(SamplingDecision.NOT_RECORD,
                new NeverSampleStrategy().shouldSample("t", "op", Map.of()));
    }

    @Test
    @DisplayName("Decisions should expose their tag value and effects")
    void testDecisionSemantics() {
        assertFalse(SamplingDecision.NOT_RECORD.isRecorded());
        assertTrue(SamplingDecision.RECORD.isRecorded());
        assertFalse(SamplingDecision.RECORD.isSampled());
        assertTrue(SamplingDecision.RECORD_AND_SAMPLE.isSampled());
        assertEquals("record_and_sampled", SamplingDecision.RECORD_AND_SAMPLE.tagValue());
    }

    @Nested
    @DisplayName("Probability")
    class Probability {

        @Test
        @DisplayName("Rates of 0 and 1 should sample nothing and everything")
        void testBounds() {
            ProbabilitySampleStrategy none = new ProbabilitySampleStrategy(0.0);
            ProbabilitySampleStrategy all = new ProbabilitySampleStrategy(1.0);

            for (int i = 0; i < 100; i++) {
                String traceId = TraceIdentifiers.newTraceId();
                assertEquals(SamplingDecision.NOT_RECORD, none.shouldSample(traceId, "op", Map.of()));
                assertEquals(SamplingDecision.RECORD_AND_SAMPLE, all.shouldSample(traceId, "op", Map.of()));
            }
        }

        @Test
        @DisplayName("Same trace id should always get the same decision")
        void testDeterministic() {
            ProbabilitySampleStrategy half = new ProbabilitySampleStrategy(0.5);
            String traceId = TraceIdentifiers.newTraceId();

            SamplingDecision first = half.shouldSample(traceId, "checkout", Map.of());
            for (int i = 0; i < 10; i++) {
                assertEquals(first, half.shouldSample(traceId, "charge-card", Map.of()));
            }
        }

        @Test
        @DisplayName("Roughly the configured fraction of traces should be sampled")
        void testFraction() {
            ProbabilitySampleStrategy tenth = new ProbabilitySampleStrategy(0.1);
            int sampled = 0;
            for (int i = 0; i < 10_000; i++) {
                if (tenth.shouldSample(TraceIdentifiers.newTraceId(), "op", Map.of()).isSampled()) {
                    sampled++;
                }
            }

            assertTrue(sampled > 700 && sampled < 1300, "sampled " + sampled + " of 10000");
        }

        @Test
        @DisplayName("Out of range rates should be clamped")
        void testClamp() {
            assertEquals(1.0, new ProbabilitySampleStrategy(3.0).getSampleRate());
            assertEquals(0.0, new ProbabilitySampleStrategy(-1.0).getSampleRate());
            assertThrows(IllegalArgumentException.class, () -> new ProbabilitySampleStrategy(Double.NaN));
        }
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimiting {

        @Test
        @DisplayName("Should sample up to the budget and refill over time")
        void testTokenBucket() {
            MutableClock clock = new MutableClock(T0);
            RateLimitingSampleStrategy limiter = new RateLimitingSampleStrategy(2, clock);

            assertTrue(limiter.shouldSample("t1", "op", Map.of()).isSampled());
            assertTrue(limiter.shouldSample("t2", "op", Map.of()).isSampled());
            assertEquals(SamplingDecision.NOT_RECORD, limiter.shouldSample("t3", "op", Map.of()));

            clock.advance(Duration.ofMillis(500));
            assertTrue(limiter.shouldSample("t4", "op", Map.of()).isSampled());
            assertEquals(SamplingDecision.NOT_RECORD, limiter.shouldSample("t5", "op", Map.of()));

            clock.advance(Duration.ofSeconds(10));
            assertTrue(limiter.shouldSample("t6", "op", Map.of()).isSampled());
            assertTrue(limiter.shouldSample("t7", "op", Map.of()).isSampled());
            assertEquals(SamplingDecision.NOT_RECORD, limiter.shouldSample("t8", "op", Map.of()));
        }

        @Test
        @DisplayName("Zero budget should sample nothing and negative budgets are rejected")
        void testZeroAndNegative() {
            RateLimitingSampleStrategy closed = new RateLimitingSampleStrategy(0, new MutableClock(T0));

            assertEquals(SamplingDecision.NOT_RECORD, closed.shouldSample("t", "op", Map.of()));
            assertThrows(IllegalArgumentException.class, () -> new RateLimitingSampleStrategy(-1));
        }
    }
}
