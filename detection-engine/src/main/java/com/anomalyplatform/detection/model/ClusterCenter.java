package com.anomalyplatform.detection.model;

import java.util.List;

/** Coordinates follow the dimension order of the owning {@link ClusterCenters}. */
public record ClusterCenter(String id, List<Double> coordinates, double radius) {

    public ClusterCenter {
        coordinates = coordinates == null ? List.of() : List.copyOf(coordinates);
    }
}
