package com.anomalyplatform.detection.factory;

import com.anomalyplatform.common.alert.CauseCategory;
import com.anomalyplatform.common.alert.Evidence;
import com.anomalyplatform.common.alert.EvidenceType;
import com.anomalyplatform.common.alert.PossibleCause;
import com.anomalyplatform.common.model.ContextEvent;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EnvironmentalFactor;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.detection.model.RawFinding;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Rule table mapping a finding and its context to candidate causes, most probable first.
 *
 * <ul>
 *   <li>load / fatigue metrics           → training</li>
 *   <li>recovery / wellness metrics      → recovery</li>
 *   <li>environmental factors present    → environmental</li>
 *   <li>high stress or life stressors    → psychological</li>
 *   <li>relevant recent events           → external</li>
 * </ul>
 * Pattern, trend, multi-metric and cluster findings add their own detector-specific causes.
 */
final class CauseCatalog {

    static final double HIGH_STRESS_LEVEL = 70.0;
    static final double RELEVANT_EVENT    = 0.5;

    private CauseCatalog() {}

    static List<PossibleCause> causes(RawFinding f, DetectionContext ctx) {
        Instant at = f.observedAt();
        List<PossibleCause> causes = new ArrayList<>();

        switch (f.type()) {
            case PATTERN_DEVIATION -> {
                causes.add(new PossibleCause("Training plan modification", CauseCategory.TRAINING, 70,
                    List.of(new Evidence(EvidenceType.OBSERVATION, "Recent changes in training schedule", 80, 90, at)),
                    List.of("Review recent training plan changes", "Check with coaching staff")));
                causes.add(new PossibleCause("Player availability issues", CauseCategory.EXTERNAL, 40,
                    List.of(new Evidence(EvidenceType.DATA, "Attendance patterns", 60, 95, at)),
                    List.of("Check attendance records", "Review injury reports")));
            }
            case TREND_BREAK -> {
                String direction = f.detailString("direction", "changing");
                String expected = f.detailString("expectedDirection", "stable");
                if (!direction.equals(expected)) {
                    causes.add(new PossibleCause("Unexpected " + direction + " trend in " + f.metricKey(),
                        CauseCategory.TRAINING, 70,
                        List.of(new Evidence(EvidenceType.DATA, "Trend analysis shows " + direction + " pattern",
                            Math.round(f.reliability() * 100), 90, at)),
                        List.of("Review training program changes", "Check for external factors",
                            "Analyze individual contributions to trend")));
                }
            }
            case MULTI_VARIATE_ANOMALY -> causes.add(new PossibleCause(
                "Systemic change affecting " + f.detailString("group", f.metricKey()),
                CauseCategory.PHYSIOLOGICAL, 75,
                List.of(new Evidence(EvidenceType.DATA, "Multi-metric deviation detected", 80, 85, at)),
                List.of("Analyze metric correlations", "Check for systematic changes", "Review recent interventions")));
            case CLUSTER_ANOMALY -> causes.add(new PossibleCause("Novel performance state",
                CauseCategory.PHYSIOLOGICAL, 60,
                List.of(new Evidence(EvidenceType.DATA, "Data point outside known clusters", 85, 90, at)),
                List.of("Analyze contributing factors", "Check for measurement errors")));
            default -> metricCauses(f, at, causes);
        }

        environmentalCause(ctx, at).ifPresent(causes::add);
        psychologicalCause(ctx, at, causes);
        eventCauses(ctx, at, causes);

        causes.sort(Comparator.comparingDouble(PossibleCause::probability).reversed());
        return causes;
    }

    private static void metricCauses(RawFinding f, Instant at, List<PossibleCause> causes) {
        String key = f.metricKey();
        boolean increase = f.currentValue() > f.expectedValue();
        double magnitude = magnitude(f);

        if (key.contains(MetricName.LOAD.key()) || key.contains(MetricName.FATIGUE.key())) {
            causes.add(new PossibleCause(
                increase ? "Training intensity increase" : "Reduced training load",
                CauseCategory.TRAINING, magnitude > 0.3 ? 80 : 60,
                List.of(new Evidence(EvidenceType.CORRELATION, "Correlation with recent training changes", 75, 85, at)),
                List.of("Review recent training logs", "Check with coaching staff", "Analyze load progression")));
        }
        if (key.contains(MetricName.RECOVERY.key()) || key.contains(MetricName.WELLNESS.key())) {
            causes.add(new PossibleCause(
                increase ? "Improved recovery protocols" : "Insufficient recovery",
                CauseCategory.RECOVERY, magnitude > 0.2 ? 70 : 50,
                List.of(new Evidence(EvidenceType.DATA, "Sleep and recovery data correlation", 80, 90, at)),
                List.of("Check sleep data", "Review recovery protocols", "Assess stress levels")));
        }
    }

    private static Optional<PossibleCause> environmentalCause(DetectionContext ctx, Instant at) {
        List<EnvironmentalFactor> factors = ctx.environmentalFactors();
        if (factors == null || factors.isEmpty()) return Optional.empty();
        List<Evidence> evidence = new ArrayList<>();
        for (EnvironmentalFactor factor : factors) {
            evidence.add(new Evidence(EvidenceType.OBSERVATION, factor.factor() + ": " + factor.value(), 60, 70, at));
        }
        return Optional.of(new PossibleCause("Environmental factors", CauseCategory.ENVIRONMENTAL, 40,
            evidence, List.of("Review environmental conditions", "Check facility changes", "Assess travel impact")));
    }

    private static void psychologicalCause(DetectionContext ctx, Instant at, List<PossibleCause> causes) {
        boolean stressedTeam = ctx.teamState() != null && ctx.teamState().stressLevel() > HIGH_STRESS_LEVEL;
        List<String> stressors = ctx.playerState() == null ? List.of() : ctx.playerState().lifeStressors();
        if (!stressedTeam && stressors.isEmpty()) return;

        List<Evidence> evidence = new ArrayList<>();
        if (stressedTeam) {
            evidence.add(new Evidence(EvidenceType.OBSERVATION,
                "Team stress level " + Math.round(ctx.teamState().stressLevel()), 65, 70, at));
        }
        for (String stressor : stressors) {
            evidence.add(new Evidence(EvidenceType.OBSERVATION, "Life stressor: " + stressor, 55, 60, at));
        }
        causes.add(new PossibleCause("Psychological stress", CauseCategory.PSYCHOLOGICAL, 45, evidence,
            List.of("Talk to the athlete", "Review recent workload and schedule", "Consult sport psychology staff")));
    }

    private static void eventCauses(DetectionContext ctx, Instant at, List<PossibleCause> causes) {
        if (ctx.recentEvents() == null) return;
        for (ContextEvent event : ctx.recentEvents()) {
            if (event.relevance() < RELEVANT_EVENT) continue;
            Instant when = event.date() != null ? event.date() : at;
            causes.add(new PossibleCause("Recent " + event.type() + ": " + event.description(),
                CauseCategory.EXTERNAL, Math.round(event.relevance() * 50),
                List.of(new Evidence(EvidenceType.HISTORICAL, event.description(), 60, 75, when)),
                List.of("Confirm timing against the anomaly", "Check whether similar events caused past alerts")));
        }
    }

    static double magnitude(RawFinding f) {
        if (f.expectedValue() == 0.0) return 0.0;
        return Math.abs(f.currentValue() - f.expectedValue()) / Math.abs(f.expectedValue());
    }
}
