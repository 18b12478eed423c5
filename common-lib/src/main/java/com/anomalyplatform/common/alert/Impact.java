package com.anomalyplatform.common.alert;

public record Impact(
    ImpactSeverity severity,
    ImpactScope scope,
    String description,
    QuantifiedImpact quantifiedImpact
) {}
