package com.anomalyplatform.common.config;

import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricName;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Metrics the multivariate scorer evaluates jointly.
 */
public record MetricGroup(String name, List<MetricName> metrics, MetricCategory category, double weight) {

    public MetricGroup {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    public static MetricGroup of(MetricCategory category, MetricName... metrics) {
        List<MetricName> list = List.of(metrics);
        return new MetricGroup(list.stream().map(MetricName::key).collect(Collectors.joining("_")),
            list, category, 1.0);
    }

    public String label() {
        return metrics.stream().map(MetricName::key).collect(Collectors.joining(", "));
    }
}
