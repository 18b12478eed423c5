package com.anomalyplatform.common.config;

/**
 * Per-detector switch and reliability weight in [0,1]. The weight scales the confidence of
 * every alert the detector produces.
 */
public record DetectorSettings(boolean enabled, double weight) {

    public static DetectorSettings enabled(double weight) {
        return new DetectorSettings(true, weight);
    }

    public static DetectorSettings disabled() {
        return new DetectorSettings(false, 0.0);
    }
}
