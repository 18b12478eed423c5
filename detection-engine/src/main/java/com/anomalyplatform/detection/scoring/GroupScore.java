package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.config.MetricGroup;
import com.anomalyplatform.common.model.MetricName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Multi-metric distance score of one group.
 *
 * @param means   historical mean per dimension that took part in the distance
 * @param current current value per dimension that took part in the distance
 */
public record GroupScore(
    MetricGroup group,
    double distance,
    double score,
    Map<MetricName, Double> means,
    Map<MetricName, Double> current
) {
    public GroupScore {
        means = Collections.unmodifiableMap(new LinkedHashMap<>(means));
        current = Collections.unmodifiableMap(new LinkedHashMap<>(current));
    }

    public boolean isFlagged() {
        return score > MultivariateScorer.FLAG_THRESHOLD;
    }

    public boolean isEscalated() {
        return score > MultivariateScorer.ESCALATION_THRESHOLD;
    }
}
