package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityType {

    PLAYER,
    TEAM,
    WORKOUT;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EntityType fromKey(String key) {
        return EntityType.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
