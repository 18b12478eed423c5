package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.scoring.AlertScoring;
import com.anomalyplatform.common.stats.StatisticsCalculator;
import com.anomalyplatform.detection.model.ClusterAssignment;
import com.anomalyplatform.detection.model.ClusterCenters;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.scoring.ClusterAssigner;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Distance of the current snapshot from its nearest externally supplied cluster center.
 * Without centers the detector is skipped.
 */
@Component
public class ClusterAnomalyDetector implements AnomalyDetector {

    public static final String METRIC_KEY = "cluster_distance";
    static final double CLUSTER_WEIGHT = 1.0;

    private final DetectionConfig config;
    private final ClusterAssigner assigner;

    public ClusterAnomalyDetector(DetectionConfig config, ClusterAssigner assigner) {
        this.config = config;
        this.assigner = assigner;
    }

    @Override
    public DetectorKind kind() { return DetectorKind.CLUSTER; }

    @Override
    public List<RawFinding> detect(DetectionInput input) {
        MetricSnapshot current = input.requireCurrent(detectorName());
        ClusterCenters centers = input.clusters()
            .filter(c -> !c.isEmpty())
            .orElseThrow(() -> new InsufficientDataException(detectorName(), "no cluster centers available"));

        Optional<ClusterAssignment> assigned = assigner.assign(current, centers);
        if (assigned.isEmpty()) {
            throw new InsufficientDataException(detectorName(),
                "current snapshot lacks cluster dimensions " + centers.dimensions());
        }
        ClusterAssignment a = assigned.get();
        double threshold = config.clusterDistanceThreshold();
        if (!ClusterAssigner.isOutlier(a, threshold)) {
            return List.of();
        }

        double z = 2.0 * a.distance() / threshold;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("clusterId", a.clusterId());
        details.put("distance", a.distance());
        details.put("centersVersion", centers.version());

        return List.of(new RawFinding(
            kind(), kind().alertType(), METRIC_KEY, MetricCategory.PERFORMANCE, CLUSTER_WEIGHT,
            z, 1.0, ClusterAssigner.severity(a, threshold),
            a.distance(), threshold,
            (a.distance() - threshold) / threshold * 100.0,
            threshold,
            StatisticsCalculator.significance(z),
            AlertScoring.anomalyScore(z),
            input.observedAt(), input.window(),
            List.of(), details));
    }
}
