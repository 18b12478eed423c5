package com.anomalyplatform.common.config;

/**
 * Which side of the expected value counts as anomalous.
 */
public enum ThresholdCondition {

    ABOVE,
    BELOW,
    OUTSIDE_RANGE;

    public boolean matches(double signedDeviation) {
        return switch (this) {
            case ABOVE         -> signedDeviation > 0;
            case BELOW         -> signedDeviation < 0;
            case OUTSIDE_RANGE -> signedDeviation != 0;
        };
    }
}
