package com.anomalyplatform.detection.provider;

import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityType;
import reactor.core.publisher.Mono;

/**
 * Builds the situational context of a run. Fields left {@code null} fall back to the
 * defaults documented on {@link DetectionContext}.
 */
public interface ContextProvider {
    Mono<DetectionContext> build(EntityType entityType, String entityId);
}
