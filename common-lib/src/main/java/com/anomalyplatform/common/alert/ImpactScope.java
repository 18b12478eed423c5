package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImpactScope {
    INDIVIDUAL, POSITION, LINE, TEAM, ORGANIZATION;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
