package com.anomalyplatform.common.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record TimeWindow(Instant start, Instant end, Granularity granularity) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("TimeWindow end " + end + " is before start " + start);
        }
        if (granularity == null) granularity = Granularity.DAILY;
    }

    /** Daily window of {@code days} days ending at {@code end}. */
    public static TimeWindow lastDays(int days, Instant end) {
        return new TimeWindow(end.minus(Duration.ofDays(days)), end, Granularity.DAILY);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public String durationLabel() {
        long days = duration().toDays();
        if (days >= 1) return days + (days == 1 ? " day" : " days");
        return duration().toHours() + " hours";
    }
}
