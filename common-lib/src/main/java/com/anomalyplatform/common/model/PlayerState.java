package com.anomalyplatform.common.model;

import java.util.List;

public record PlayerState(
    String playerId,
    double wellness,
    double motivation,
    double fatigue,
    String injuryStatus,
    List<String> lifeStressors,
    List<String> recentChanges
) {
    public PlayerState {
        lifeStressors = lifeStressors == null ? List.of() : List.copyOf(lifeStressors);
        recentChanges = recentChanges == null ? List.of() : List.copyOf(recentChanges);
    }

    public static PlayerState neutral(String playerId) {
        return new PlayerState(playerId, 70, 70, 50, "healthy", List.of(), List.of());
    }
}
