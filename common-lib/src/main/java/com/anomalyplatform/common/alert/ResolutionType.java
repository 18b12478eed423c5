package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ResolutionType {
    CORRECTED, FALSE_POSITIVE, ACCEPTABLE_VARIANCE, EXTERNAL_FACTOR;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
