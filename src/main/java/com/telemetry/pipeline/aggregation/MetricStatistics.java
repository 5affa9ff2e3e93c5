package com.telemetry.pipeline.aggregation;

import java.util.Arrays;
import java.util.Collection;

/**
 * Summary statistics over a set of metric values.
 * Percentiles follow {@link Percentiles} list-index semantics.
 */
public record MetricStatistics(
        long count,
        double min,
        double max,
        double avg,
        double sum,
        double p50,
        double p95,
        double p99
) {
    private static final MetricStatistics EMPTY = new MetricStatistics(0, 0, 0, 0, 0, 0, 0, 0);

    public static MetricStatistics empty() {
        return EMPTY;
    }

    public static MetricStatistics of(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        double sum = 0.0;
        for (double v : sorted) {
            sum += v;
        }
        return new MetricStatistics(
                sorted.length,
                sorted[0],
                sorted[sorted.length - 1],
                sum / sorted.length,
                sum,
                Percentiles.ofSorted(sorted, 0.50),
                Percentiles.ofSorted(sorted, 0.95),
                Percentiles.ofSorted(sorted, 0.99));
    }
}
