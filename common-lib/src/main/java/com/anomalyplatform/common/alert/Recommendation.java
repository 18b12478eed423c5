package com.anomalyplatform.common.alert;

import java.util.List;

public record Recommendation(
    String action,
    RecommendationCategory category,
    Priority priority,
    String description,
    String rationale,
    String expectedOutcome,
    String timeframe,
    List<String> resources,
    ActionRisk riskAssessment,
    List<String> successMetrics,
    List<String> dependencies
) {
    public Recommendation {
        resources = resources == null ? List.of() : List.copyOf(resources);
        successMetrics = successMetrics == null ? List.of() : List.copyOf(successMetrics);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public Recommendation withDescription(String newDescription) {
        return new Recommendation(action, category, priority, newDescription, rationale,
            expectedOutcome, timeframe, resources, riskAssessment, successMetrics, dependencies);
    }
}
