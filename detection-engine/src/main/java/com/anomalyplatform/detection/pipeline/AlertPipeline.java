package com.anomalyplatform.detection.pipeline;

import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.Recommendation;
import com.anomalyplatform.common.config.AlertThreshold;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.SuppressionCondition;
import com.anomalyplatform.common.config.SuppressionRule;
import com.anomalyplatform.common.scoring.AlertScoring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles the alerts of one run into the ordered output.
 *
 * <ol>
 *   <li>Filter: confidence below the minimum, false-positive probability above the
 *       maximum, per-type thresholds, active suppression rules</li>
 *   <li>Deduplicate on {@link Alert#dedupKey()}: highest urgency wins, earliest on ties</li>
 *   <li>Enrich: related alerts and high-stakes season adjustments</li>
 *   <li>Prioritize: urgency desc, confidence desc, input order otherwise</li>
 *   <li>Bound: top {@code maxAlerts}</li>
 * </ol>
 *
 * Pure: the same alerts and context always give the same output, and feeding the output
 * back in changes nothing but the urgency scaling of high-stakes phases.
 */
@Component
public class AlertPipeline {

    private static final Logger log = LoggerFactory.getLogger(AlertPipeline.class);

    static final Comparator<Alert> PRIORITY = Comparator
        .comparingDouble(Alert::urgency).reversed()
        .thenComparing(Comparator.comparingDouble(Alert::confidence).reversed());

    private final DetectionConfig config;

    public AlertPipeline(DetectionConfig config) {
        this.config = config;
    }

    public List<Alert> process(List<Alert> alerts, PipelineContext ctx) {
        List<Alert> kept = filter(alerts, ctx);
        List<Alert> unique = deduplicate(kept);
        unique.sort(PRIORITY);
        List<Alert> enriched = enrich(unique, ctx);
        enriched.sort(PRIORITY);
        List<Alert> bounded = enriched.size() > config.maxAlerts()
            ? new ArrayList<>(enriched.subList(0, config.maxAlerts()))
            : enriched;

        log.info("[AlertPipeline] in={} filtered={} deduplicated={} out={}",
            alerts.size(), kept.size(), unique.size(), bounded.size());
        return List.copyOf(bounded);
    }

    // ── filter ───────────────────────────────────────────────────────────────

    List<Alert> filter(List<Alert> alerts, PipelineContext ctx) {
        List<Alert> kept = new ArrayList<>();
        for (Alert alert : alerts) {
            Optional<String> reason = rejection(alert, ctx);
            if (reason.isPresent()) {
                log.debug("[AlertPipeline] dropped alert={} metric={} reason={}", alert.id(), alert.metricKey(), reason.get());
            } else {
                kept.add(alert);
            }
        }
        return kept;
    }

    private Optional<String> rejection(Alert alert, PipelineContext ctx) {
        if (alert.confidence() < config.minConfidence()) {
            return Optional.of("confidence " + alert.confidence() + " below " + config.minConfidence());
        }
        if (alert.falsePositiveProbability() > config.maxFalsePositiveProbability()) {
            return Optional.of("false-positive probability " + alert.falsePositiveProbability()
                + " above " + config.maxFalsePositiveProbability());
        }
        Optional<AlertThreshold> threshold = config.alertThreshold(alert.type());
        if (threshold.isEmpty()) {
            return Optional.empty();
        }
        AlertThreshold t = threshold.get();
        if (alert.confidence() < t.minimumConfidence()) {
            return Optional.of("confidence below " + alert.type().key() + " minimum " + t.minimumConfidence());
        }
        if (!alert.severity().isAtLeast(t.minimumSeverity())) {
            return Optional.of("severity below " + t.minimumSeverity().key());
        }
        for (SuppressionRule rule : t.suppressionRules()) {
            if (rule.appliesTo(alert.metricKey()) && isActive(rule, alert, ctx)) {
                return Optional.of("suppressed by " + rule.condition().key()
                    + (rule.reasoning() != null ? " (" + rule.reasoning() + ")" : ""));
            }
        }
        return Optional.empty();
    }

    static boolean isActive(SuppressionRule rule, Alert alert, PipelineContext ctx) {
        if (rule.condition() == SuppressionCondition.MUTED_UNTIL) {
            return rule.mutedUntil() != null && alert.detectedAt().isBefore(rule.mutedUntil());
        }
        return hasRecentSimilarAlert(alert, rule.lookback(), ctx.recentAlerts());
    }

    /** Same entity and metric, detected within {@code lookback} before this alert. */
    static boolean hasRecentSimilarAlert(Alert alert, Duration lookback, List<AlertRecord> recent) {
        Instant from = alert.detectedAt().minus(lookback);
        for (AlertRecord r : recent) {
            if (r.alertId().equals(alert.id())) continue;
            if (!alert.entity().sameAs(r.entity()) || !r.metricKey().equals(alert.metricKey())) continue;
            Instant at = r.detectedAt();
            if (at != null && !at.isBefore(from) && !at.isAfter(alert.detectedAt())) {
                return true;
            }
        }
        return false;
    }

    // ── deduplicate ──────────────────────────────────────────────────────────

    static List<Alert> deduplicate(List<Alert> alerts) {
        Map<String, Alert> best = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            best.merge(alert.dedupKey(), alert, (kept, candidate) ->
                candidate.urgency() > kept.urgency() ? candidate : kept);
        }
        return new ArrayList<>(best.values());
    }

    // ── enrich ───────────────────────────────────────────────────────────────

    private List<Alert> enrich(List<Alert> alerts, PipelineContext ctx) {
        boolean highStakes = config.isHighStakes(ctx.seasonPhase());
        List<Alert> enriched = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            Alert a = alert.withRelatedAlerts(relatedAlerts(alert, alerts, ctx.recentAlerts()));
            if (highStakes) {
                a = adjustForHighStakes(a, ctx);
            }
            enriched.add(a);
        }
        return enriched;
    }

    List<String> relatedAlerts(Alert alert, List<Alert> run, List<AlertRecord> recent) {
        Duration window = config.relatedAlertWindow();
        List<String> related = new ArrayList<>();
        for (Alert other : run) {
            if (other.id().equals(alert.id())) continue;
            if (isRelated(alert, alert.entity().sameAs(other.entity()), other.metricKey(), other.observedAt(), window)) {
                related.add(other.id());
            }
        }
        for (AlertRecord r : recent) {
            if (related.contains(r.alertId()) || r.alertId().equals(alert.id())) continue;
            if (isRelated(alert, alert.entity().sameAs(r.entity()), r.metricKey(), r.observedAt(), window)) {
                related.add(r.alertId());
            }
        }
        return related;
    }

    private static boolean isRelated(Alert alert, boolean sameEntity, String metricKey, Instant observedAt, Duration window) {
        if (!sameEntity || alert.metricKey().equals(metricKey)) return false;
        if (observedAt == null || alert.observedAt() == null) return false;
        return Duration.between(observedAt, alert.observedAt()).abs().compareTo(window) <= 0;
    }

    private Alert adjustForHighStakes(Alert alert, PipelineContext ctx) {
        String note = " (Adjusted for " + ctx.seasonPhase().key() + " context)";
        List<Recommendation> recs = new ArrayList<>(alert.recommendations().size());
        for (Recommendation r : alert.recommendations()) {
            recs.add(r.description() != null && r.description().endsWith(note) ? r : r.withDescription(r.description() + note));
        }
        return alert
            .withUrgency(AlertScoring.adjustUrgency(alert.urgency(), config.highStakesUrgencyFactor()))
            .withRecommendations(recs);
    }
}
