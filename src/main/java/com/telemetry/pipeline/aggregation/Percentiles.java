package com.telemetry.pipeline.aggregation;

import java.util.Arrays;
import java.util.Collection;

/**
 * List-index percentiles: the value at {@code sorted[min(floor(n * p), n - 1)]}.
 * No interpolation is performed, so results are always observed values.
 */
public final class Percentiles {

    private Percentiles() {
        // utility class
    }

    /**
     * @param values observed values, need not be sorted
     * @param p      percentile as a fraction in [0, 1]
     * @return the percentile value, or 0.0 for an empty collection
     */
    public static double of(Collection<Double> values, double p) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        return ofSorted(sorted, p);
    }

    /**
     * Same as {@link #of(Collection, double)} for an already sorted array.
     */
    public static double ofSorted(double[] sorted, double p) {
        if (p < 0.0 || p > 1.0 || Double.isNaN(p)) {
            throw new IllegalArgumentException("percentile must be between 0 and 1, got " + p);
        }
        if (sorted.length == 0) {
            return 0.0;
        }
        int index = (int) Math.floor(sorted.length * p);
        return sorted[Math.min(index, sorted.length - 1)];
    }
}
