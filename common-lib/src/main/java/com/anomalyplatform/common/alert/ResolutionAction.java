package com.anomalyplatform.common.alert;

import java.time.Duration;
import java.time.Instant;

public record ResolutionAction(
    String action,
    Instant implementedAt,
    String implementedBy,
    String result,
    double cost,
    Duration timeRequired
) {}
