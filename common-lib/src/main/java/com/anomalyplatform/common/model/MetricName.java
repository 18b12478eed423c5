package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of metrics the engine understands. Serialized as the lower-case key
 * used by the metrics service ({@code "performance"}, {@code "load"}, ...).
 */
public enum MetricName {

    PERFORMANCE,
    FATIGUE,
    WELLNESS,
    LOAD,
    RECOVERY,
    READINESS,
    STRENGTH,
    SPEED,
    ENDURANCE,
    FITNESS;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MetricName fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Metric key must not be null");
        }
        return MetricName.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
