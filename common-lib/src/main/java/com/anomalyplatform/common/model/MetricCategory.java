package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Domain category of a monitored metric. The urgency factor weights how quickly
 * staff should react to an anomaly in this category.
 */
public enum MetricCategory {

    PERFORMANCE(1.1),
    LOAD(1.0),
    RECOVERY(1.0),
    WELLNESS(0.9),
    INJURY(1.3);

    private final double urgencyFactor;

    MetricCategory(double urgencyFactor) {
        this.urgencyFactor = urgencyFactor;
    }

    public double urgencyFactor() {
        return urgencyFactor;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
