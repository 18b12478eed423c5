package com.anomalyplatform.common.alert;

import java.util.List;

public record SeasonalityPattern(
    boolean hasPattern,
    String pattern,
    double confidence,
    List<String> peakPeriods
) {
    public SeasonalityPattern {
        peakPeriods = peakPeriods == null ? List.of() : List.copyOf(peakPeriods);
    }

    public static SeasonalityPattern none() {
        return new SeasonalityPattern(false, "", 0, List.of());
    }
}
