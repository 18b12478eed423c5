package com.anomalyplatform.detection.model;

/**
 * Non-fatal outcome of one detector in one run.
 */
public record DetectorDiagnostic(String detector, DiagnosticStatus status, int findings, String message) {

    public static DetectorDiagnostic completed(String detector, int findings) {
        return new DetectorDiagnostic(detector, DiagnosticStatus.COMPLETED, findings, null);
    }

    public static DetectorDiagnostic skipped(String detector, String reason) {
        return new DetectorDiagnostic(detector, DiagnosticStatus.SKIPPED, 0, reason);
    }

    public static DetectorDiagnostic failed(String detector, String reason) {
        return new DetectorDiagnostic(detector, DiagnosticStatus.FAILED, 0, reason);
    }

    public static DetectorDiagnostic disabled(String detector) {
        return new DetectorDiagnostic(detector, DiagnosticStatus.DISABLED, 0, null);
    }
}
