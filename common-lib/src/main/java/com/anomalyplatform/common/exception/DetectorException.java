package com.anomalyplatform.common.exception;

/**
 * Raised by a detector that could not finish. The orchestrator converts it into a
 * per-detector diagnostic; it never aborts the other detectors.
 */
public class DetectorException extends RuntimeException {
    private final String detectorName;

    public DetectorException(String detectorName, String message) {
        super("[" + detectorName + "] " + message);
        this.detectorName = detectorName;
    }

    public DetectorException(String detectorName, String message, Throwable cause) {
        super("[" + detectorName + "] " + message, cause);
        this.detectorName = detectorName;
    }

    public String getDetectorName() {
        return detectorName;
    }
}
