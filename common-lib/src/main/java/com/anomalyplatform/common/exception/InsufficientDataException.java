package com.anomalyplatform.common.exception;

/**
 * Not enough samples for a detector to say anything. Recoverable: the detector is
 * reported as skipped, not failed.
 */
public class InsufficientDataException extends DetectorException {
    private final int available;
    private final int required;

    public InsufficientDataException(String detectorName, int available, int required) {
        super(detectorName, "insufficient data: " + available + " samples, " + required + " required");
        this.available = available;
        this.required = required;
    }

    public InsufficientDataException(String detectorName, String message) {
        super(detectorName, message);
        this.available = -1;
        this.required = -1;
    }

    /** Sample count seen, or -1 when the shortfall is not a count. */
    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
