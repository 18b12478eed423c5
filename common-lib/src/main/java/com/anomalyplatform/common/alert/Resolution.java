package com.anomalyplatform.common.alert;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Resolution(
    Instant resolvedAt,
    String resolvedBy,
    ResolutionType resolutionType,
    List<ResolutionAction> actions,
    String outcome,
    double effectiveness,
    List<String> lessonsLearned,
    List<String> preventionMeasures
) {
    public Resolution {
        Objects.requireNonNull(resolvedAt, "resolvedAt");
        Objects.requireNonNull(resolutionType, "resolutionType");
        actions = actions == null ? List.of() : List.copyOf(actions);
        lessonsLearned = lessonsLearned == null ? List.of() : List.copyOf(lessonsLearned);
        preventionMeasures = preventionMeasures == null ? List.of() : List.copyOf(preventionMeasures);
    }

    /** The lifecycle status an alert ends in once this resolution is applied. */
    public AlertStatus terminalStatus() {
        return resolutionType == ResolutionType.FALSE_POSITIVE
            ? AlertStatus.FALSE_POSITIVE
            : AlertStatus.RESOLVED;
    }
}
