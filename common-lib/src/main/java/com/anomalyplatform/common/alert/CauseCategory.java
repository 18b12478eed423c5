package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CauseCategory {
    TRAINING, RECOVERY, ENVIRONMENTAL, PSYCHOLOGICAL, PHYSIOLOGICAL, EXTERNAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
