package com.anomalyplatform.common.alert;

import java.time.Duration;
import java.util.List;

public record OutcomePattern(
    String pattern,
    int frequency,
    double successRate,
    Duration averageResolutionTime,
    List<String> commonActions
) {
    public OutcomePattern {
        commonActions = commonActions == null ? List.of() : List.copyOf(commonActions);
    }
}
