package com.anomalyplatform.detection.model;

import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.model.EntityRef;

import java.util.List;

/**
 * Final alerts for one entity together with what went wrong on the way.
 */
public record DetectionReport(
    EntityRef entity,
    List<Alert> alerts,
    List<DetectorDiagnostic> diagnostics,
    List<String> degradations
) {
    public DetectionReport {
        alerts = List.copyOf(alerts);
        diagnostics = List.copyOf(diagnostics);
        degradations = degradations == null ? List.of() : List.copyOf(degradations);
    }

    public boolean isDegraded() {
        return !degradations.isEmpty()
            || diagnostics.stream().anyMatch(d -> d.status() == DiagnosticStatus.FAILED);
    }
}
