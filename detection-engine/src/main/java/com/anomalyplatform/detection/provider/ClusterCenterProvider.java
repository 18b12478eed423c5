package com.anomalyplatform.detection.provider;

import com.anomalyplatform.detection.model.ClusterCenters;
import reactor.core.publisher.Mono;

/**
 * Supplies the current, versioned set of cluster centers. Centers are computed and
 * refreshed outside the engine; an empty {@code Mono} disables cluster detection.
 */
public interface ClusterCenterProvider {
    Mono<ClusterCenters> current();
}
