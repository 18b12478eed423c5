package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.detection.model.ClusterAssignment;
import com.anomalyplatform.detection.model.ClusterCenters;

/**
 * Strategy that places a point relative to a set of externally supplied cluster centers.
 *
 * <p>Current implementation: {@link EuclideanClusterModel}.
 */
public interface ClusterModel {

    /**
     * @param point coordinates in the dimension order of {@code centers}
     * @param centers non-empty center set
     */
    ClusterAssignment assign(double[] point, ClusterCenters centers);
}
