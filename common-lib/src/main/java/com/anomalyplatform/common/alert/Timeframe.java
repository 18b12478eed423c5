package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

/** Rollup period for anomaly trend reports. */
public enum Timeframe {

    DAY(Duration.ofDays(1)),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30)),
    QUARTER(Duration.ofDays(91)),
    YEAR(Duration.ofDays(365));

    private final Duration length;

    Timeframe(Duration length) {
        this.length = length;
    }

    public Duration length() {
        return length;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Timeframe fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Timeframe must not be blank");
        }
        return Timeframe.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
