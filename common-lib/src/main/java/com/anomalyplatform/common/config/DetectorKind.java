package com.anomalyplatform.common.config;

import com.anomalyplatform.common.alert.AlertType;

/**
 * The five detectors, in registration order. Findings are merged in this order.
 */
public enum DetectorKind {

    STATISTICAL("statistical_outlier", AlertType.STATISTICAL_OUTLIER, 1.0),
    PATTERN("pattern_detection", AlertType.PATTERN_DEVIATION, 0.9),
    TREND("trend_break", AlertType.TREND_BREAK, 1.0),
    MULTIVARIATE("multi_variate", AlertType.MULTI_VARIATE_ANOMALY, 1.0),
    CLUSTER("cluster_distance", AlertType.CLUSTER_ANOMALY, 0.9);

    private final String detectorName;
    private final AlertType alertType;
    private final double defaultWeight;

    DetectorKind(String detectorName, AlertType alertType, double defaultWeight) {
        this.detectorName = detectorName;
        this.alertType = alertType;
        this.defaultWeight = defaultWeight;
    }

    public String detectorName() {
        return detectorName;
    }

    public AlertType alertType() {
        return alertType;
    }

    public double defaultWeight() {
        return defaultWeight;
    }
}
