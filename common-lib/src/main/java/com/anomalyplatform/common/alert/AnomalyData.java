package com.anomalyplatform.common.alert;

import com.anomalyplatform.common.model.TimeWindow;

import java.util.List;

/**
 * Numeric evidence behind an alert.
 *
 * <p>{@code deviation} is the signed strength of the finding in standard-deviation
 * units (z-score for statistical outliers, t-like ratios for the other detectors);
 * {@code anomalyScore} is the same finding on a 0–100 scale.
 */
public record AnomalyData(
    String detectedMetric,
    double currentValue,
    double expectedValue,
    double deviation,
    double deviationPercentage,
    double threshold,
    TimeWindow timeWindow,
    List<DataPoint> dataPoints,
    double statisticalSignificance,
    double anomalyScore
) {
    public AnomalyData {
        dataPoints = dataPoints == null ? List.of() : List.copyOf(dataPoints);
    }
}
