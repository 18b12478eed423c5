package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The five detector-produced types come first; the remaining domain types are
 * reserved for rule-based producers outside the statistical pipeline.
 */
public enum AlertType {

    STATISTICAL_OUTLIER,
    PATTERN_DEVIATION,
    TREND_BREAK,
    MULTI_VARIATE_ANOMALY,
    CLUSTER_ANOMALY,

    PERFORMANCE_DROP,
    UNUSUAL_LOAD,
    RECOVERY_ANOMALY,
    INJURY_RISK,
    TEMPORAL_ANOMALY;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
