package com.anomalyplatform.common.model;

import java.time.Instant;

/**
 * Something that happened recently and may explain an anomaly
 * (type is one of game, injury, travel, training_change, external).
 */
public record ContextEvent(
    String type,
    String description,
    Instant date,
    ImpactDirection impact,
    double relevance
) {}
