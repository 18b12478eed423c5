package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.config.MetricGroup;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.stats.StatisticsCalculator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Euclidean distance of the current vector of a metric group from the historical
 * per-metric means, normalised to 0–100.
 *
 * <pre>
 *   distance = sqrt( Σ (current(m) − mean(m))² )      over usable dimensions
 *   score    = min(100, distance · 5)
 * </pre>
 *
 * A dimension is usable when the current snapshot carries it and history holds at
 * least {@link StatisticsCalculator#MIN_SAMPLES} values for it. A group needs two
 * usable dimensions to be scored.
 */
public final class MultivariateScorer {

    public static final double SCALE = 5.0;
    public static final double FLAG_THRESHOLD = 70.0;
    public static final double ESCALATION_THRESHOLD = 85.0;
    public static final int MIN_DIMENSIONS = 2;

    private MultivariateScorer() {}

    public static Optional<GroupScore> score(MetricGroup group, HistoricalData history, MetricSnapshot current) {
        Map<MetricName, Double> means = new LinkedHashMap<>();
        Map<MetricName, Double> values = new LinkedHashMap<>();
        double sumSq = 0.0;
        for (MetricName metric : group.metrics()) {
            OptionalDouble now = current.value(metric);
            if (now.isEmpty()) continue;
            List<Double> series = history.series(metric);
            if (!StatisticsCalculator.hasSufficientSamples(series)) continue;

            double mean = StatisticsCalculator.stats(series).mean();
            double diff = now.getAsDouble() - mean;
            sumSq += diff * diff;
            means.put(metric, mean);
            values.put(metric, now.getAsDouble());
        }
        if (means.size() < MIN_DIMENSIONS) {
            return Optional.empty();
        }
        double distance = Math.sqrt(sumSq);
        double score = Math.min(100.0, distance * SCALE);
        return Optional.of(new GroupScore(group, distance, score, means, values));
    }
}
