package com.anomalyplatform.common.alert;

import java.time.Duration;
import java.time.Instant;

public record SimilarAnomaly(
    String id,
    Instant date,
    double similarity,
    String outcome,
    String resolution,
    Duration timeToResolution,
    double effectiveness
) {}
