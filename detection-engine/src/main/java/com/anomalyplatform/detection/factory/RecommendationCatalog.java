package com.anomalyplatform.detection.factory;

import com.anomalyplatform.common.alert.ActionRisk;
import com.anomalyplatform.common.alert.ImpactLevel;
import com.anomalyplatform.common.alert.Priority;
import com.anomalyplatform.common.alert.Recommendation;
import com.anomalyplatform.common.alert.RecommendationCategory;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.detection.model.RawFinding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Actions suggested for a finding, highest priority first. Equal priorities keep the
 * order they were generated in.
 */
final class RecommendationCatalog {

    static final double PERFORMANCE_DROP = 0.2;
    static final double LOAD_RISE        = 0.3;

    private RecommendationCatalog() {}

    static List<Recommendation> recommendations(RawFinding f, Severity severity) {
        List<Recommendation> recs = new ArrayList<>();
        if (severity == Severity.CRITICAL) {
            recs.add(escalation(f));
        }

        switch (f.type()) {
            case PATTERN_DEVIATION -> recs.add(new Recommendation(
                "Review training consistency", RecommendationCategory.IMMEDIATE, Priority.MEDIUM,
                "Analyze recent changes in training patterns and their impact",
                "Pattern deviations may indicate underlying issues",
                "Identification of pattern deviation cause", "1-2 days",
                List.of("Coach time", "Data analysis"),
                new ActionRisk(ImpactLevel.LOW, List.of("Time investment"),
                    List.of("Prioritize high-impact areas"), List.of("Delayed identification of issues")),
                List.of("Pattern understanding", "Issue identification"),
                List.of("Data availability", "Staff cooperation")));
            case TREND_BREAK -> recs.add(new Recommendation(
                "Trend analysis and intervention", RecommendationCategory.SHORT_TERM, Priority.MEDIUM,
                "Address " + f.detailString("direction", "changing") + " trend in " + f.metricKey(),
                "Current trend deviates from expected " + f.detailString("expectedDirection", "stable") + " pattern",
                "Trend correction or validation of new normal", "1-2 weeks",
                List.of("Data analysis", "Intervention protocols"),
                new ActionRisk(ImpactLevel.MEDIUM, List.of("Intervention timing", "Trend persistence"),
                    List.of("Gradual adjustments", "Continuous monitoring"),
                    List.of("Trend continuation", "Performance impact")),
                List.of("Trend modification", "Metric stabilization"),
                List.of("Trend persistence confirmation", "Resource availability")));
            case MULTI_VARIATE_ANOMALY -> {
                String group = f.detailString("group", f.metricKey());
                recs.add(new Recommendation(
                    "Comprehensive assessment", RecommendationCategory.IMMEDIATE,
                    severity.isAtLeast(Severity.HIGH) ? Priority.HIGH : Priority.MEDIUM,
                    "Conduct holistic evaluation of " + group + " metrics",
                    "Multi-metric anomaly suggests systemic issue",
                    "Identification of root cause", "2-3 days",
                    List.of("Assessment protocols", "Specialist consultation"),
                    new ActionRisk(ImpactLevel.MEDIUM, List.of("Time investment", "Resource allocation"),
                        List.of("Prioritized assessment", "Phased approach"),
                        List.of("Continued multi-metric deviation")),
                    List.of("Root cause identification", "Metric stabilization"),
                    List.of("Assessment availability", "Subject cooperation")));
            }
            case CLUSTER_ANOMALY -> recs.add(new Recommendation(
                "Investigate data point validity", RecommendationCategory.IMMEDIATE, Priority.MEDIUM,
                "Verify the accuracy of measurements and identify contributing factors",
                "Outlier data may indicate measurement error or significant change",
                "Validated data or error identification", "1 day",
                List.of("Data verification", "Subject interview"),
                new ActionRisk(ImpactLevel.LOW, List.of("Time investment"),
                    List.of("Quick verification process"), List.of("Missed opportunity for early intervention")),
                List.of("Data validation", "Cause identification"),
                List.of("Data access", "Subject availability")));
            default -> metricRecommendations(f, recs);
        }

        recs.sort(Comparator.comparingInt((Recommendation r) -> r.priority().weight()).reversed());
        return recs;
    }

    private static void metricRecommendations(RawFinding f, List<Recommendation> recs) {
        String key = f.metricKey();
        boolean increase = f.currentValue() > f.expectedValue();
        double magnitude = CauseCatalog.magnitude(f);

        recs.add(new Recommendation(
            "Increase monitoring frequency", RecommendationCategory.MONITORING, Priority.HIGH,
            "Monitor " + key + " more closely for the next 3-5 days",
            "Early detection of pattern continuation or normalization",
            "Better understanding of anomaly persistence", "3-5 days",
            List.of("Monitoring equipment", "Staff time"),
            new ActionRisk(ImpactLevel.LOW, List.of("Resource allocation"),
                List.of("Automated monitoring"), List.of("Increased workload")),
            List.of("Data collection consistency", "Pattern identification"),
            List.of("Monitoring equipment availability")));

        if (key.contains(MetricName.PERFORMANCE.key()) && !increase && magnitude > PERFORMANCE_DROP) {
            recs.add(new Recommendation(
                "Performance evaluation", RecommendationCategory.IMMEDIATE, Priority.HIGH,
                "Conduct comprehensive performance assessment",
                "Significant performance drop requires immediate attention",
                "Identification of performance limiting factors", "1-2 days",
                List.of("Assessment protocols", "Specialist time"),
                new ActionRisk(ImpactLevel.MEDIUM, List.of("Time investment", "Player stress"),
                    List.of("Streamlined assessment", "Clear communication"),
                    List.of("Continued performance decline")),
                List.of("Problem identification", "Action plan development"),
                List.of("Player availability", "Assessment tools")));
        }

        if (key.contains(MetricName.LOAD.key()) && increase && magnitude > LOAD_RISE) {
            recs.add(new Recommendation(
                "Load reduction", RecommendationCategory.IMMEDIATE, Priority.MEDIUM,
                "Temporarily reduce training load by 15-20%",
                "High load anomaly may increase injury risk",
                "Load normalization and injury risk reduction", "1 week",
                List.of("Training plan adjustment"),
                new ActionRisk(ImpactLevel.LOW, List.of("Fitness maintenance"),
                    List.of("Quality over quantity focus"), List.of("Temporary fitness impact")),
                List.of("Load normalization", "Maintained performance"),
                List.of("Coach approval", "Schedule flexibility")));
        }
    }

    private static Recommendation escalation(RawFinding f) {
        return new Recommendation(
            "Escalate to medical and performance staff", RecommendationCategory.IMMEDIATE, Priority.URGENT,
            "Review " + f.metricKey() + " with medical and performance staff today",
            "Critical deviations carry the highest injury and availability risk",
            "Same-day decision on training participation", "same day",
            List.of("Medical staff", "Performance staff"),
            new ActionRisk(ImpactLevel.LOW, List.of("Unplanned staff time"),
                List.of("Short structured review"), List.of("Missed training session")),
            List.of("Decision recorded", "Follow-up scheduled"),
            List.of("Staff availability"));
    }
}
