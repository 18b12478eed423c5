package com.anomalyplatform.detection.dto;

import com.anomalyplatform.common.model.EntityRef;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Body of {@code POST /api/v1/anomalies/batch}. {@code from}/{@code to} are optional and
 * default to the configured trailing window.
 */
public record BatchDetectionRequest(
    @JsonProperty("entities") List<EntityRef> entities,
    @JsonProperty("concurrency") Integer concurrency,
    @JsonProperty("from") Instant from,
    @JsonProperty("to") Instant to
) {
    public BatchDetectionRequest {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}
