package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.config.MonitoredMetric;
import com.anomalyplatform.common.model.MetricSnapshot;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Importance-weighted mean of the monitored metrics over the window.
 *
 * <pre>
 *   score = Σ weight(m) · mean(m over window) / Σ weight(m)     for metrics present
 * </pre>
 */
public class WeightedMeanPatternScorer implements PatternScorer {

    private final List<MonitoredMetric> metrics;

    public WeightedMeanPatternScorer(List<MonitoredMetric> metrics) {
        this.metrics = List.copyOf(metrics);
    }

    @Override
    public OptionalDouble score(List<MetricSnapshot> window) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (MonitoredMetric m : metrics) {
            if (m.weight() <= 0) continue;
            double sum = 0.0;
            int count = 0;
            for (MetricSnapshot s : window) {
                OptionalDouble v = s.value(m.metric());
                if (v.isPresent()) {
                    sum += v.getAsDouble();
                    count++;
                }
            }
            if (count == 0) continue;
            weighted += m.weight() * (sum / count);
            totalWeight += m.weight();
        }
        return totalWeight == 0.0 ? OptionalDouble.empty() : OptionalDouble.of(weighted / totalWeight);
    }
}
