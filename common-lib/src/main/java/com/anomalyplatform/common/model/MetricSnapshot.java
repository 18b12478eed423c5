package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Metric values observed for one entity at one point in time.
 * Non-finite values are dropped on construction so downstream math never sees NaN.
 */
public record MetricSnapshot(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("values") Map<MetricName, Double> values
) {
    public MetricSnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
        if (values != null) {
            values.forEach((metric, value) -> {
                if (metric != null && value != null && Double.isFinite(value)) {
                    copy.put(metric, value);
                }
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static MetricSnapshot of(Instant timestamp, Map<MetricName, Double> values) {
        return new MetricSnapshot(timestamp, values);
    }

    public boolean has(MetricName metric) {
        return values.containsKey(metric);
    }

    public OptionalDouble value(MetricName metric) {
        Double v = values.get(metric);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }
}
