package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Granularity {
    HOURLY, DAILY, WEEKLY, MONTHLY;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
