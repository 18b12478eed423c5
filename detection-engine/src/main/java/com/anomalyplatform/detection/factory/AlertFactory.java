package com.anomalyplatform.detection.factory;

import com.anomalyplatform.common.alert.AffectedEntity;
import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.alert.AlertStatus;
import com.anomalyplatform.common.alert.AnomalyData;
import com.anomalyplatform.common.alert.HistoricalComparison;
import com.anomalyplatform.common.alert.ImpactLevel;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.model.CurrentData;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.scoring.AlertScoring;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.provider.HistoricalAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Expands a {@link RawFinding} into a fully populated {@link Alert}.
 *
 * <p>Everything except the historical comparison is a deterministic function of the
 * finding, the run input and the clock. The id is a name-based UUID of
 * (type, entity, metric, observation time), so the same finding always yields the same id.
 *
 * <p>Scores come from {@link AlertScoring}; the reliability fed into confidence and
 * false-positive probability is the detector weight times the finding's own reliability
 * (R² for trends).
 */
@Component
public class AlertFactory {

    private static final Logger log = LoggerFactory.getLogger(AlertFactory.class);

    private final DetectionConfig config;
    private final HistoricalAlertStore alertStore;
    private final Clock clock;

    public AlertFactory(DetectionConfig config, HistoricalAlertStore alertStore, Clock clock) {
        this.config = config;
        this.alertStore = alertStore;
        this.clock = clock;
    }

    public Mono<Alert> create(RawFinding finding, DetectionInput input) {
        return historicalComparison(finding)
            .map(comparison -> build(finding, input, comparison));
    }

    /** Similar past alerts, or {@link HistoricalComparison#empty()} when the store is slow or down. */
    Mono<HistoricalComparison> historicalComparison(RawFinding finding) {
        return Mono.defer(() -> alertStore.similarAlerts(finding.metricKey(), finding.strength()))
            .timeout(config.fetchTimeout())
            .defaultIfEmpty(HistoricalComparison.empty())
            .onErrorResume(e -> {
                log.warn("[AlertFactory] historical comparison unavailable for metric={}: {}",
                    finding.metricKey(), e.getMessage());
                return Mono.just(HistoricalComparison.empty());
            });
    }

    public Alert build(RawFinding f, DetectionInput input, HistoricalComparison comparison) {
        double z = f.strength();
        double reliability = config.detectorWeight(f.detector()) * f.reliability();
        Severity severity = f.severity() != null ? f.severity() : AlertScoring.severity(z, f.weight());

        AnomalyData data = new AnomalyData(
            f.metricKey(), f.currentValue(), f.expectedValue(), z, f.deviationPercentage(),
            f.threshold(), f.window(), f.dataPoints(), f.statisticalSignificance(), f.anomalyScore());

        return new Alert(
            alertId(f, input.entity()),
            f.type(),
            severity,
            title(f),
            description(f),
            input.entity(),
            f.observedAt(),
            clock.instant(),
            affectedEntities(input),
            data,
            input.context(),
            CauseCatalog.causes(f, input.context()),
            RecommendationCatalog.recommendations(f, severity),
            AlertScoring.confidence(z, reliability, input.contextDegraded()),
            AlertScoring.falsePositiveProbability(z, reliability),
            AlertScoring.urgency(z, f.category()),
            ImpactAssessor.assess(f, input.context(), input.entity()),
            comparison,
            List.of(),
            AlertStatus.NEW,
            List.of(),
            null);
    }

    static String alertId(RawFinding f, EntityRef entity) {
        String name = f.type().key() + "|" + entity + "|" + f.metricKey() + "|" + f.observedAt();
        return f.type().key() + "-" + UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    static List<AffectedEntity> affectedEntities(DetectionInput input) {
        EntityRef entity = input.entity();
        List<AffectedEntity> affected = new ArrayList<>();
        affected.add(new AffectedEntity(entity.type(), entity.id(), entity.displayName(), null, ImpactLevel.HIGH));

        CurrentData current = input.current();
        if (current != null && current.teamId() != null && entity.type() != EntityType.TEAM) {
            String teamName = current.teamName() != null ? current.teamName() : "Team " + current.teamId();
            affected.add(new AffectedEntity(EntityType.TEAM, current.teamId(), teamName, null, ImpactLevel.MEDIUM));
        }
        return affected;
    }

    static String title(RawFinding f) {
        return switch (f.type()) {
            case PATTERN_DEVIATION     -> "Unusual Training Pattern Detected";
            case TREND_BREAK           -> "Unexpected Trend in " + f.metricKey();
            case MULTI_VARIATE_ANOMALY -> "Multi-metric Anomaly in " + f.detailString("group", f.metricKey());
            case CLUSTER_ANOMALY       -> "Data Point Outside Normal Clusters";
            default                    -> "Statistical Anomaly in " + f.metricKey();
        };
    }

    static String description(RawFinding f) {
        return switch (f.type()) {
            case PATTERN_DEVIATION -> String.format(Locale.ROOT,
                "Current training pattern score (%.2f) is %.2f standard deviations from the established pattern (%.2f)",
                f.currentValue(), f.strength(), f.expectedValue());
            case TREND_BREAK -> String.format(Locale.ROOT,
                "%s shows %s trend (%.3f per day) when %s trend was expected",
                f.metricKey(), f.detailString("direction", "changing"), f.currentValue(),
                f.detailString("expectedDirection", "stable"));
            case MULTI_VARIATE_ANOMALY -> String.format(Locale.ROOT,
                "Unusual combination of values detected across %s metrics (score %.1f)",
                f.detailString("group", f.metricKey()), f.currentValue());
            case CLUSTER_ANOMALY -> String.format(Locale.ROOT,
                "Current performance profile does not match any known patterns (distance: %.2f)",
                f.currentValue());
            default -> String.format(Locale.ROOT,
                "%s value (%.2f) is %.2f standard deviations from the expected value (%.2f)",
                f.metricKey(), f.currentValue(), f.strength(), f.expectedValue());
        };
    }
}
