package com.anomalyplatform.detection.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DiagnosticStatus {
    COMPLETED, SKIPPED, FAILED, DISABLED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
