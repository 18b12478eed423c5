package com.anomalyplatform.detection.provider;

import com.anomalyplatform.common.model.CurrentData;
import com.anomalyplatform.common.model.EntityType;
import reactor.core.publisher.Mono;

public interface CurrentDataProvider {
    Mono<CurrentData> get(EntityType entityType, String entityId);
}
