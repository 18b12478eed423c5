package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Whether a context factor helps, hurts or does not matter. */
public enum ImpactDirection {
    POSITIVE, NEGATIVE, NEUTRAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
