package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.detection.model.ClusterAssignment;
import com.anomalyplatform.detection.model.ClusterCenters;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Projects a snapshot onto the dimensions of the cluster centers and delegates the
 * assignment to a {@link ClusterModel}.
 *
 * <p>Distance beyond the threshold flags the snapshot as medium severity; beyond twice
 * the threshold escalates to high.
 */
public class ClusterAssigner {

    static final double ESCALATION_FACTOR = 2.0;

    private final ClusterModel model;

    public ClusterAssigner(ClusterModel model) {
        this.model = model;
    }

    /**
     * @return empty when the snapshot lacks one of the center dimensions or there are no centers
     */
    public Optional<ClusterAssignment> assign(MetricSnapshot snapshot, ClusterCenters centers) {
        if (centers == null || centers.isEmpty()) {
            return Optional.empty();
        }
        List<MetricName> dims = centers.dimensions();
        double[] point = new double[dims.size()];
        for (int i = 0; i < dims.size(); i++) {
            OptionalDouble v = snapshot.value(dims.get(i));
            if (v.isEmpty()) return Optional.empty();
            point[i] = v.getAsDouble();
        }
        return Optional.of(model.assign(point, centers));
    }

    public static boolean isOutlier(ClusterAssignment assignment, double threshold) {
        return assignment.distance() > threshold;
    }

    public static Severity severity(ClusterAssignment assignment, double threshold) {
        return assignment.distance() > threshold * ESCALATION_FACTOR ? Severity.HIGH : Severity.MEDIUM;
    }
}
