package com.anomalyplatform.detection.scoring;

/**
 * Current 7-sample pattern score against the distribution of historical window scores.
 *
 * @param zScore signed distance of the current score in historical standard deviations
 */
public record PatternComparison(
    double currentScore,
    double historicalMean,
    double historicalStddev,
    int windowCount,
    double zScore,
    boolean anomalous
) {}
