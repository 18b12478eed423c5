package com.anomalyplatform.common.config;

import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.alert.Severity;

import java.util.List;

/**
 * Per-type gate applied on top of the global confidence and false-positive limits.
 */
public record AlertThreshold(
    AlertType alertType,
    double minimumConfidence,
    Severity minimumSeverity,
    List<SuppressionRule> suppressionRules
) {
    public AlertThreshold {
        if (minimumSeverity == null) minimumSeverity = Severity.LOW;
        suppressionRules = suppressionRules == null ? List.of() : List.copyOf(suppressionRules);
    }
}
