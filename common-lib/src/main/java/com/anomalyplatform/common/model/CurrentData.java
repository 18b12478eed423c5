package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Latest snapshot for an entity, with the team it belongs to when known.
 */
public record CurrentData(
    @JsonProperty("entity") EntityRef entity,
    @JsonProperty("teamId") String teamId,
    @JsonProperty("teamName") String teamName,
    @JsonProperty("snapshot") MetricSnapshot snapshot
) {
    public CurrentData {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(snapshot, "snapshot");
    }

    public static CurrentData of(EntityRef entity, MetricSnapshot snapshot) {
        return new CurrentData(entity, null, null, snapshot);
    }
}
