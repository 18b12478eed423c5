package com.anomalyplatform.common.alert;

import java.util.List;

/**
 * How an alert compares with previously recorded alerts on the same metric.
 */
public record HistoricalComparison(
    List<SimilarAnomaly> similarAnomalies,
    FrequencyAnalysis frequencyAnalysis,
    List<OutcomePattern> outcomePatterns,
    List<String> learnings
) {
    public HistoricalComparison {
        similarAnomalies = similarAnomalies == null ? List.of() : List.copyOf(similarAnomalies);
        frequencyAnalysis = frequencyAnalysis == null ? FrequencyAnalysis.none() : frequencyAnalysis;
        outcomePatterns = outcomePatterns == null ? List.of() : List.copyOf(outcomePatterns);
        learnings = learnings == null ? List.of() : List.copyOf(learnings);
    }

    /** Used when the alert store has nothing or could not be reached. */
    public static HistoricalComparison empty() {
        return new HistoricalComparison(List.of(), FrequencyAnalysis.none(), List.of(), List.of());
    }
}
