package com.anomalyplatform.common.stats;

import java.util.List;

/**
 * Ordinary least squares over (index, value) pairs.
 *
 * <pre>
 *   slope     = (n·Σxy − Σx·Σy) / (n·Σx² − (Σx)²)
 *   intercept = (Σy − slope·Σx) / n
 *   R²        = 1 − SSres / SStot        clamped to [0,1]
 * </pre>
 *
 * A trend only counts as anomalous when it differs from the expected slope by more than
 * {@code 0.3 × metricWeight} and the fit is reliable (R² &gt; 0.5).
 */
public final class TrendEstimator {

    /** Two weeks of daily samples. */
    public static final int MIN_SAMPLES = 14;

    public static final double DIRECTION_DEADBAND   = 0.1;
    public static final double SLOPE_DIFF_THRESHOLD = 0.3;
    public static final double MIN_R_SQUARED        = 0.5;

    private TrendEstimator() {}

    public static boolean hasSufficientSamples(List<Double> values) {
        return values != null && values.size() >= MIN_SAMPLES;
    }

    /**
     * @param values samples in time order, oldest first
     * @throws IllegalArgumentException for fewer than two samples
     */
    public static Trend estimate(List<Double> values) {
        if (values == null || values.size() < 2) {
            throw new IllegalArgumentException("A trend needs at least two samples");
        }
        int n = values.size();
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            double y = values.get(i);
            sumX  += i;
            sumY  += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }
        double denominator = n * sumXX - sumX * sumX;
        double slope = denominator == 0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double yMean = sumY / n;
        double ssRes = 0, ssTot = 0;
        for (int i = 0; i < n; i++) {
            double y = values.get(i);
            double predicted = intercept + slope * i;
            ssRes += (y - predicted) * (y - predicted);
            ssTot += (y - yMean) * (y - yMean);
        }
        // a perfectly flat series has nothing to explain
        double rSquared = ssTot == 0 ? 0.0 : clampUnit(1.0 - ssRes / ssTot);

        double sxx = sumXX - sumX * sumX / n;
        double slopeStandardError = (n > 2 && sxx > 0) ? Math.sqrt(ssRes / (n - 2)) / Math.sqrt(sxx) : 0.0;

        return new Trend(slope, intercept, rSquared, slopeStandardError, n, TrendDirection.ofSlope(slope));
    }

    public static double slopeDifference(Trend observed, ExpectedTrend expected) {
        return Math.abs(observed.slope() - expected.slope());
    }

    /** Slope difference above {@code 0.3·weight} on a reliable fit. */
    public static boolean isAnomalous(Trend observed, ExpectedTrend expected, double metricWeight) {
        double threshold = SLOPE_DIFF_THRESHOLD * metricWeight;
        return slopeDifference(observed, expected) > threshold && observed.rSquared() > MIN_R_SQUARED;
    }

    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
