package com.anomalyplatform.detection.provider;

import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.TimeWindow;
import reactor.core.publisher.Mono;

/**
 * Source of per-date metric snapshots for an entity. An empty {@code Mono} means no history.
 */
public interface HistoricalDataProvider {
    Mono<HistoricalData> get(EntityType entityType, String entityId, TimeWindow window);
}
