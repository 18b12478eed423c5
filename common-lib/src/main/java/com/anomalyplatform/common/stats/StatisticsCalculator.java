package com.anomalyplatform.common.stats;

import java.util.Arrays;
import java.util.List;

/**
 * Pure descriptive statistics used by the detectors.
 * No state, no logging; safe to call from any thread.
 */
public final class StatisticsCalculator {

    /** Fewer historical samples than this and a detector has nothing to compare against. */
    public static final int MIN_SAMPLES = 10;

    static final double SIGNIFICANCE_BASE  = 50.0;
    static final double SIGNIFICANCE_SLOPE = 15.0;
    static final double SIGNIFICANCE_CAP   = 99.0;

    private StatisticsCalculator() {}

    public static boolean hasSufficientSamples(List<Double> values) {
        return values != null && values.size() >= MIN_SAMPLES;
    }

    /**
     * Mean, population standard deviation and median.
     *
     * @throws IllegalArgumentException for a null or empty sample
     */
    public static SummaryStatistics stats(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute statistics of an empty sample");
        }
        int n = values.size();
        double[] sorted = new double[n];
        double sum = 0;
        for (int i = 0; i < n; i++) {
            double v = values.get(i);
            sorted[i] = v;
            sum += v;
        }
        double mean = sum / n;

        double variance = 0;
        for (double v : sorted) {
            double diff = v - mean;
            variance += diff * diff;
        }
        double stddev = Math.sqrt(variance / n);

        Arrays.sort(sorted);
        double median = (n % 2 == 0)
            ? (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0
            : sorted[n / 2];

        return new SummaryStatistics(n, mean, stddev, median);
    }

    /**
     * Signed number of standard deviations between {@code current} and {@code mean}.
     * A zero (or non-finite) spread means the history never moved, which is treated as
     * "no deviation" and returns 0.
     */
    public static double zScore(double current, double mean, double stddev) {
        if (stddev == 0.0 || !Double.isFinite(stddev)) return 0.0;
        return (current - mean) / stddev;
    }

    /** Maps |z| to a 0–99 confidence-like percentage: {@code min(99, 50 + |z|·15)}. */
    public static double significance(double z) {
        if (!Double.isFinite(z)) return SIGNIFICANCE_CAP;
        return Math.min(SIGNIFICANCE_CAP, SIGNIFICANCE_BASE + Math.abs(z) * SIGNIFICANCE_SLOPE);
    }

    /** Relative deviation in percent; 0 when the reference is 0. */
    public static double deviationPercentage(double current, double expected) {
        if (expected == 0.0) return 0.0;
        return (current - expected) / Math.abs(expected) * 100.0;
    }
}
