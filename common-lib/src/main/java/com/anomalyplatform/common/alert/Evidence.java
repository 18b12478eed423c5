package com.anomalyplatform.common.alert;

import java.time.Instant;

/** Strength and reliability are 0–100. */
public record Evidence(
    EvidenceType type,
    String description,
    double strength,
    double reliability,
    Instant timestamp
) {}
