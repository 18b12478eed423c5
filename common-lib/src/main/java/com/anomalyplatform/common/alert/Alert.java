package com.anomalyplatform.common.alert;

import com.anomalyplatform.common.exception.IllegalAlertTransitionException;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityRef;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One anomaly finding, fully contextualized.
 *
 * <p>Alerts are immutable. The {@code with*} methods are used by the alert pipeline for
 * enrichment; {@link #transitionTo}, {@link #resolve} and {@link #addInvestigationNote}
 * are the hooks for the resolution workflow. Each returns a new instance.
 */
public record Alert(
    @JsonProperty("id") String id,
    @JsonProperty("type") AlertType type,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("entity") EntityRef entity,
    @JsonProperty("observedAt") Instant observedAt,
    @JsonProperty("detectedAt") Instant detectedAt,
    @JsonProperty("affectedEntities") List<AffectedEntity> affectedEntities,
    @JsonProperty("anomalyData") AnomalyData anomalyData,
    @JsonProperty("context") DetectionContext context,
    @JsonProperty("possibleCauses") List<PossibleCause> possibleCauses,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("falsePositiveProbability") double falsePositiveProbability,
    @JsonProperty("urgency") double urgency,
    @JsonProperty("impactAssessment") ImpactAssessment impactAssessment,
    @JsonProperty("historicalComparison") HistoricalComparison historicalComparison,
    @JsonProperty("relatedAlerts") List<String> relatedAlerts,
    @JsonProperty("status") AlertStatus status,
    @JsonProperty("investigationNotes") List<String> investigationNotes,
    @JsonProperty("resolution") Resolution resolution
) {
    public Alert {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(anomalyData, "anomalyData");
        affectedEntities = affectedEntities == null ? List.of() : List.copyOf(affectedEntities);
        possibleCauses = possibleCauses == null ? List.of() : List.copyOf(possibleCauses);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        relatedAlerts = relatedAlerts == null ? List.of() : List.copyOf(relatedAlerts);
        investigationNotes = investigationNotes == null ? List.of() : List.copyOf(investigationNotes);
        historicalComparison = historicalComparison == null ? HistoricalComparison.empty() : historicalComparison;
        status = status == null ? AlertStatus.NEW : status;
    }

    /** Metric name, or group name for multi-metric findings. */
    @JsonIgnore
    public String metricKey() {
        return anomalyData.detectedMetric();
    }

    /**
     * Two alerts with the same key describe the same problem on the same entities and
     * collapse to one per run.
     */
    @JsonIgnore
    public String dedupKey() {
        String ids = affectedEntities.stream()
            .map(AffectedEntity::id)
            .sorted()
            .collect(Collectors.joining(","));
        if (ids.isEmpty()) ids = entity.id();
        return metricKey() + "|" + ids;
    }

    // ── enrichment ──────────────────────────────────────────────────────────

    public Alert withUrgency(double newUrgency) {
        return new Alert(id, type, severity, title, description, entity, observedAt, detectedAt,
            affectedEntities, anomalyData, context, possibleCauses, recommendations, confidence,
            falsePositiveProbability, newUrgency, impactAssessment, historicalComparison,
            relatedAlerts, status, investigationNotes, resolution);
    }

    public Alert withRecommendations(List<Recommendation> newRecommendations) {
        return new Alert(id, type, severity, title, description, entity, observedAt, detectedAt,
            affectedEntities, anomalyData, context, possibleCauses, newRecommendations, confidence,
            falsePositiveProbability, urgency, impactAssessment, historicalComparison,
            relatedAlerts, status, investigationNotes, resolution);
    }

    public Alert withRelatedAlerts(List<String> newRelatedAlerts) {
        return new Alert(id, type, severity, title, description, entity, observedAt, detectedAt,
            affectedEntities, anomalyData, context, possibleCauses, recommendations, confidence,
            falsePositiveProbability, urgency, impactAssessment, historicalComparison,
            newRelatedAlerts, status, investigationNotes, resolution);
    }

    public Alert withHistoricalComparison(HistoricalComparison comparison) {
        return new Alert(id, type, severity, title, description, entity, observedAt, detectedAt,
            affectedEntities, anomalyData, context, possibleCauses, recommendations, confidence,
            falsePositiveProbability, urgency, impactAssessment, comparison,
            relatedAlerts, status, investigationNotes, resolution);
    }

    // ── lifecycle ───────────────────────────────────────────────────────────

    /**
     * Moves the alert to {@code target}. Reopening ({@code → NEW}) clears the resolution.
     *
     * @throws IllegalAlertTransitionException when the state machine forbids the move
     */
    public Alert transitionTo(AlertStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalAlertTransitionException(id, status, target);
        }
        Resolution kept = target == AlertStatus.NEW ? null : resolution;
        return new Alert(id, type, severity, title, description, entity, observedAt, detectedAt,
            affectedEntities, anomalyData, context, possibleCauses, recommendations, confidence,
            falsePositiveProbability, urgency, impactAssessment, historicalComparison,
            relatedAlerts, target, investigationNotes, kept);
    }

    /** Closes an alert under investigation as resolved or false positive. */
    public Alert resolve(Resolution newResolution) {
        Objects.requireNonNull(newResolution, "resolution");
        AlertStatus target = newResolution.terminalStatus();
        if (!status.canTransitionTo(target)) {
            throw new IllegalAlertTransitionException(id, status, target);
        }
        return new Alert(id, type, severity, title, description, entity, observedAt, detectedAt,
            affectedEntities, anomalyData, context, possibleCauses, recommendations, confidence,
            falsePositiveProbability, urgency, impactAssessment, historicalComparison,
            relatedAlerts, target, investigationNotes, newResolution);
    }

    public Alert addInvestigationNote(String note) {
        List<String> notes = new ArrayList<>(investigationNotes);
        notes.add(note);
        return new Alert(id, type, severity, title, description, entity, observedAt, detectedAt,
            affectedEntities, anomalyData, context, possibleCauses, recommendations, confidence,
            falsePositiveProbability, urgency, impactAssessment, historicalComparison,
            relatedAlerts, status, notes, resolution);
    }
}
