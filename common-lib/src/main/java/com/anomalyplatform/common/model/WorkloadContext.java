package com.anomalyplatform.common.model;

import java.util.List;

public record WorkloadContext(
    List<LoadChange> recentLoadChanges,
    double cumulativeStress,
    double recoveryDebt,
    String trainingPhase,
    String loadDistribution
) {
    public WorkloadContext {
        recentLoadChanges = recentLoadChanges == null ? List.of() : List.copyOf(recentLoadChanges);
    }

    public static WorkloadContext neutral() {
        return new WorkloadContext(List.of(), 50, 0, "competitive", "balanced");
    }
}
