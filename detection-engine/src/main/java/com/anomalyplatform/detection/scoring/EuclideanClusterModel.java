package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.detection.model.ClusterAssignment;
import com.anomalyplatform.detection.model.ClusterCenter;
import com.anomalyplatform.detection.model.ClusterCenters;

import java.util.List;

/** Nearest center by Euclidean distance; the first center wins a tie. */
public class EuclideanClusterModel implements ClusterModel {

    @Override
    public ClusterAssignment assign(double[] point, ClusterCenters centers) {
        if (centers.isEmpty()) {
            throw new IllegalArgumentException("No cluster centers to assign to");
        }
        List<ClusterCenter> all = centers.centers();
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < all.size(); i++) {
            double d = distance(point, all.get(i).coordinates());
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return new ClusterAssignment(all.get(best).id(), best, bestDistance);
    }

    static double distance(double[] point, List<Double> center) {
        double sumSq = 0.0;
        for (int i = 0; i < point.length; i++) {
            double diff = point[i] - center.get(i);
            sumSq += diff * diff;
        }
        return Math.sqrt(sumSq);
    }
}
