package com.anomalyplatform.common.stats;

/**
 * Least-squares line over sample index. {@code slope} is per sample (per day for daily data).
 */
public record Trend(
    double slope,
    double intercept,
    double rSquared,
    double slopeStandardError,
    int sampleCount,
    TrendDirection direction
) {
    public double fitted(int index) {
        return intercept + slope * index;
    }
}
