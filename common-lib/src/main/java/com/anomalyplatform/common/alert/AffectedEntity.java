package com.anomalyplatform.common.alert;

import com.anomalyplatform.common.model.EntityType;

public record AffectedEntity(
    EntityType type,
    String id,
    String name,
    String role,
    ImpactLevel impactLevel
) {}
