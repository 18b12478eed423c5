package com.anomalyplatform.common.stats;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {

    INCREASING,
    DECREASING,
    STABLE;

    /** Slopes within ±{@value TrendEstimator#DIRECTION_DEADBAND} per sample count as stable. */
    public static TrendDirection ofSlope(double slope) {
        if (slope > TrendEstimator.DIRECTION_DEADBAND) return INCREASING;
        if (slope < -TrendEstimator.DIRECTION_DEADBAND) return DECREASING;
        return STABLE;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
