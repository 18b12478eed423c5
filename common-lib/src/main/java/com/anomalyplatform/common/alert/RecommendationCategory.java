package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecommendationCategory {
    IMMEDIATE, SHORT_TERM, LONG_TERM, MONITORING;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
