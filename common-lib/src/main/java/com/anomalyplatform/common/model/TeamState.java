package com.anomalyplatform.common.model;

/** Team-level state on a 0–100 scale, except {@code injuryCount}. */
public record TeamState(
    double morale,
    double chemistry,
    double fatigue,
    int injuryCount,
    double recentPerformance,
    double stressLevel
) {
    public static TeamState neutral() {
        return new TeamState(70, 75, 50, 0, 70, 50);
    }
}
