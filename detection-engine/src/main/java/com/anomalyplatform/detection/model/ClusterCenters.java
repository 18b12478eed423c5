package com.anomalyplatform.detection.model;

import com.anomalyplatform.common.model.MetricName;

import java.util.List;

/**
 * Versioned cluster-center artifact produced outside the engine.
 */
public record ClusterCenters(String version, List<MetricName> dimensions, List<ClusterCenter> centers) {

    public ClusterCenters {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        centers = centers == null ? List.of() : List.copyOf(centers);
        for (ClusterCenter c : centers) {
            if (c.coordinates().size() != dimensions.size()) {
                throw new IllegalArgumentException("Cluster " + c.id() + " has " + c.coordinates().size()
                    + " coordinates but " + dimensions.size() + " dimensions are declared");
            }
        }
    }

    public boolean isEmpty() {
        return centers.isEmpty() || dimensions.isEmpty();
    }
}
