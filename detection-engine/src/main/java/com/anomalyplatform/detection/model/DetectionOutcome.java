package com.anomalyplatform.detection.model;

import java.util.List;

/**
 * Raw result of running every detector for one entity: findings in detector
 * registration order, one diagnostic per detector, and any data-source degradations.
 */
public record DetectionOutcome(
    DetectionInput input,
    List<RawFinding> findings,
    List<DetectorDiagnostic> diagnostics,
    List<String> degradations
) {
    public DetectionOutcome {
        findings = List.copyOf(findings);
        diagnostics = List.copyOf(diagnostics);
        degradations = degradations == null ? List.of() : List.copyOf(degradations);
    }
}
