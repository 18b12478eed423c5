package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImpactSeverity {
    MINIMAL, LOW, MODERATE, HIGH, SEVERE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
