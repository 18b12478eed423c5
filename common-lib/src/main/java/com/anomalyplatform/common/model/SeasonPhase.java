package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SeasonPhase {

    PRESEASON,
    REGULAR,
    PLAYOFFS,
    OFFSEASON;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or blank phases resolve to {@link #REGULAR}. */
    @JsonCreator
    public static SeasonPhase fromKey(String key) {
        if (key == null || key.isBlank()) return REGULAR;
        try {
            return SeasonPhase.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return REGULAR;
        }
    }
}
