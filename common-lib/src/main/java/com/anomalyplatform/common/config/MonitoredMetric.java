package com.anomalyplatform.common.config;

import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.SeasonPhase;

import java.util.List;
import java.util.Optional;

/**
 * A metric the statistical and trend detectors watch, with its importance weight in [0,1].
 */
public record MonitoredMetric(
    MetricName metric,
    MetricCategory category,
    double weight,
    List<MetricThreshold> thresholds,
    List<ContextAdjustment> contextAdjustments
) {
    public MonitoredMetric {
        thresholds = thresholds == null ? List.of() : List.copyOf(thresholds);
        contextAdjustments = contextAdjustments == null ? List.of() : List.copyOf(contextAdjustments);
    }

    public Optional<MetricThreshold> threshold(ThresholdLevel level) {
        return thresholds.stream().filter(t -> t.level() == level).findFirst();
    }

    /** Product of the adjustment factors that apply in {@code phase}; 1.0 when none do. */
    public double adjustmentFactor(SeasonPhase phase) {
        double factor = 1.0;
        for (ContextAdjustment adj : contextAdjustments) {
            if (adj.seasonPhase() == phase) factor *= adj.adjustmentFactor();
        }
        return factor;
    }
}
