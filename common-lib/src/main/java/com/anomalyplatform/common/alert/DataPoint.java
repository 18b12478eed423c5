package com.anomalyplatform.common.alert;

import java.time.Instant;
import java.util.List;

public record DataPoint(
    Instant timestamp,
    double value,
    double expectedValue,
    boolean anomalous,
    List<String> contributingFactors
) {
    public DataPoint {
        contributingFactors = contributingFactors == null ? List.of() : List.copyOf(contributingFactors);
    }
}
