package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImpactLevel {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
