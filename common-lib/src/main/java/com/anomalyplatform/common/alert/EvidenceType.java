package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EvidenceType {
    DATA, OBSERVATION, CORRELATION, HISTORICAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
