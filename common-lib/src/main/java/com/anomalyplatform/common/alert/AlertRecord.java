package com.anomalyplatform.common.alert;

import com.anomalyplatform.common.model.EntityRef;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Flat projection of an {@link Alert} as kept by an alert store. Carries just enough to
 * answer history, suppression and rollup queries.
 */
public record AlertRecord(
    String alertId,
    EntityRef entity,
    String metricKey,
    AlertType type,
    Severity severity,
    double deviation,
    Instant observedAt,
    Instant detectedAt,
    AlertStatus status,
    Instant resolvedAt,
    ResolutionType resolutionType,
    String resolutionSummary,
    double effectiveness
) {

    public static AlertRecord of(Alert alert) {
        Resolution r = alert.resolution();
        return new AlertRecord(
            alert.id(), alert.entity(), alert.metricKey(), alert.type(), alert.severity(),
            alert.anomalyData().deviation(), alert.observedAt(), alert.detectedAt(),
            alert.status(),
            r != null ? r.resolvedAt() : null,
            r != null ? r.resolutionType() : null,
            r != null ? r.outcome() : null,
            r != null ? r.effectiveness() : 0.0);
    }

    /** Time from the observation to the alert being raised. */
    public Optional<Duration> detectionLatency() {
        if (observedAt == null || detectedAt == null || detectedAt.isBefore(observedAt)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(observedAt, detectedAt));
    }

    public Optional<Duration> resolutionTime() {
        if (resolvedAt == null || detectedAt == null || resolvedAt.isBefore(detectedAt)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(detectedAt, resolvedAt));
    }
}
