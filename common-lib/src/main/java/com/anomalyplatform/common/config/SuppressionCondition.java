package com.anomalyplatform.common.config;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SuppressionCondition {

    /** An alert on the same entity and metric was recorded within the rule's lookback. */
    RECENT_SIMILAR_ALERT,

    /** Alerts on the rule's metric are muted until a fixed instant. */
    MUTED_UNTIL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
