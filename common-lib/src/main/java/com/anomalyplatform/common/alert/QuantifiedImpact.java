package com.anomalyplatform.common.alert;

/**
 * Percentage deltas for performance, injury risk and availability; cost in the club's
 * reporting currency; {@code timeImpact} is a human readable horizon.
 */
public record QuantifiedImpact(
    double performanceChange,
    double injuryRiskChange,
    double availabilityChange,
    double costImpact,
    String timeImpact
) {}
