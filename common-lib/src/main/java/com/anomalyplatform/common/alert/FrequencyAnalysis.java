package com.anomalyplatform.common.alert;

/** trend is one of increasing, decreasing, stable. */
public record FrequencyAnalysis(
    int thisWeek,
    int thisMonth,
    int thisYear,
    String trend,
    SeasonalityPattern seasonality
) {
    public static FrequencyAnalysis none() {
        return new FrequencyAnalysis(0, 0, 0, "stable", SeasonalityPattern.none());
    }
}
