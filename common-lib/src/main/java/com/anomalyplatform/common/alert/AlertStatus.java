package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Alert lifecycle.
 *
 * <pre>
 *   NEW ──► INVESTIGATING ──► RESOLVED
 *                        └──► FALSE_POSITIVE
 *   RESOLVED / FALSE_POSITIVE ──► NEW   (reopen)
 * </pre>
 * No other transition is legal.
 */
public enum AlertStatus {

    NEW,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    public Set<AlertStatus> allowedTransitions() {
        return switch (this) {
            case NEW           -> EnumSet.of(INVESTIGATING);
            case INVESTIGATING -> EnumSet.of(RESOLVED, FALSE_POSITIVE);
            case RESOLVED, FALSE_POSITIVE -> EnumSet.of(NEW);
        };
    }

    public boolean canTransitionTo(AlertStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isClosed() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
