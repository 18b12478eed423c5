package com.anomalyplatform.common.alert;

import java.util.List;

public record PossibleCause(
    String cause,
    CauseCategory category,
    double probability,
    List<Evidence> evidence,
    List<String> investigationSteps
) {
    public PossibleCause {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        investigationSteps = investigationSteps == null ? List.of() : List.copyOf(investigationSteps);
    }
}
