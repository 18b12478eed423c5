package com.anomalyplatform.common.config;

import java.time.Duration;
import java.time.Instant;

/**
 * Condition that keeps an otherwise valid alert from surfacing.
 *
 * <p>{@code metricKey} restricts the rule to one metric (or metric group) and may be
 * {@code null} to match every metric. {@code lookback} applies to
 * {@link SuppressionCondition#RECENT_SIMILAR_ALERT}; {@code mutedUntil} to
 * {@link SuppressionCondition#MUTED_UNTIL}.
 */
public record SuppressionRule(
    SuppressionCondition condition,
    String metricKey,
    Duration lookback,
    Instant mutedUntil,
    String reasoning
) {
    public static final Duration DEFAULT_LOOKBACK = Duration.ofHours(24);

    public SuppressionRule {
        if (lookback == null) lookback = DEFAULT_LOOKBACK;
    }

    public static SuppressionRule recentSimilarAlert(Duration lookback, String reasoning) {
        return new SuppressionRule(SuppressionCondition.RECENT_SIMILAR_ALERT, null, lookback, null, reasoning);
    }

    public static SuppressionRule mutedUntil(String metricKey, Instant until, String reasoning) {
        return new SuppressionRule(SuppressionCondition.MUTED_UNTIL, metricKey, null, until, reasoning);
    }

    public boolean appliesTo(String alertMetricKey) {
        return metricKey == null || metricKey.equals(alertMetricKey);
    }
}
