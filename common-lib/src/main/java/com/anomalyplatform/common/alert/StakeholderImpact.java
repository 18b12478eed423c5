package com.anomalyplatform.common.alert;

/** stakeholder: player, coach, medical, management; impactType: performance, health, operational, ... */
public record StakeholderImpact(
    String stakeholder,
    String impactType,
    double severity,
    String description
) {}
