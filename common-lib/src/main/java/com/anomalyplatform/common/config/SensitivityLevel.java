package com.anomalyplatform.common.config;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Global sensitivity. The factor multiplies every statistical threshold, so a lower
 * factor means more alerts.
 */
public enum SensitivityLevel {

    LOW(1.25),
    MEDIUM(1.0),
    HIGH(0.8);

    private final double thresholdFactor;

    SensitivityLevel(double thresholdFactor) {
        this.thresholdFactor = thresholdFactor;
    }

    public double thresholdFactor() {
        return thresholdFactor;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SensitivityLevel fromKey(String key) {
        return SensitivityLevel.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
