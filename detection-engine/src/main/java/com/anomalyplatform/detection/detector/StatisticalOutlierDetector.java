package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.alert.DataPoint;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.config.MetricThreshold;
import com.anomalyplatform.common.config.MonitoredMetric;
import com.anomalyplatform.common.config.ThresholdCondition;
import com.anomalyplatform.common.config.ThresholdLevel;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.scoring.AlertScoring;
import com.anomalyplatform.common.stats.StatisticsCalculator;
import com.anomalyplatform.common.stats.SummaryStatistics;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Z-score of the current value of each monitored metric against its history.
 *
 * <p>Threshold per metric:
 * <pre>
 *   base     warning threshold of the metric, else 1.5 (weight &gt; 0.8) / 2.5 (weight &lt; 0.3) / 2.0
 *   × sensitivity factor
 *   × 0.8 in a high-stakes season phase
 *   × 0.9 when team fatigue is above 70
 *   × context adjustments of the current season phase
 * </pre>
 * The threshold condition (above / below / outside range) restricts which side counts.
 * Crossing the critical threshold lifts severity to at least high.
 */
@Component
public class StatisticalOutlierDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalOutlierDetector.class);

    static final double HIGH_WEIGHT_THRESHOLD    = 1.5;
    static final double DEFAULT_THRESHOLD        = 2.0;
    static final double LOW_WEIGHT_THRESHOLD     = 2.5;
    static final double FATIGUED_TEAM_LEVEL      = 70.0;
    static final double FATIGUED_TEAM_FACTOR     = 0.9;
    static final int    DATA_POINTS              = 30;

    private final DetectionConfig config;

    public StatisticalOutlierDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorKind kind() { return DetectorKind.STATISTICAL; }

    @Override
    public List<RawFinding> detect(DetectionInput input) {
        MetricSnapshot current = input.requireCurrent(detectorName());
        DetectionContext context = input.context();

        List<RawFinding> findings = new ArrayList<>();
        int evaluated = 0;
        int mostSamples = 0;
        for (MonitoredMetric metric : config.monitoredMetrics()) {
            List<Double> series = input.history().series(metric.metric());
            mostSamples = Math.max(mostSamples, series.size());
            OptionalDouble now = current.value(metric.metric());
            if (!StatisticsCalculator.hasSufficientSamples(series) || now.isEmpty()) {
                continue;
            }
            evaluated++;

            SummaryStatistics stats = StatisticsCalculator.stats(series);
            double value = now.getAsDouble();
            double z = StatisticsCalculator.zScore(value, stats.mean(), stats.stddev());
            double threshold = threshold(metric, context);
            ThresholdCondition condition = metric.threshold(ThresholdLevel.WARNING)
                .map(MetricThreshold::condition)
                .orElse(ThresholdCondition.OUTSIDE_RANGE);

            if (Math.abs(z) <= threshold || !condition.matches(z)) {
                continue;
            }
            log.debug("[{}] metric={} z={} threshold={} entity={}",
                detectorName(), metric.metric().key(), z, threshold, input.entity());
            findings.add(finding(input, metric, value, stats, z, threshold));
        }

        if (evaluated == 0) {
            throw new InsufficientDataException(detectorName(), mostSamples, StatisticsCalculator.MIN_SAMPLES);
        }
        return findings;
    }

    double threshold(MonitoredMetric metric, DetectionContext context) {
        double base = metric.threshold(ThresholdLevel.WARNING)
            .map(MetricThreshold::value)
            .orElseGet(() -> weightThreshold(metric.weight()));

        double threshold = base * config.sensitivity().thresholdFactor();
        if (config.isHighStakes(context.seasonPhase())) {
            threshold *= config.highStakesThresholdFactor();
        }
        if (context.teamState() != null && context.teamState().fatigue() > FATIGUED_TEAM_LEVEL) {
            threshold *= FATIGUED_TEAM_FACTOR;
        }
        return threshold * metric.adjustmentFactor(context.seasonPhase());
    }

    static double weightThreshold(double weight) {
        if (weight > 0.8) return HIGH_WEIGHT_THRESHOLD;
        if (weight < 0.3) return LOW_WEIGHT_THRESHOLD;
        return DEFAULT_THRESHOLD;
    }

    private RawFinding finding(DetectionInput input, MonitoredMetric metric, double value,
                               SummaryStatistics stats, double z, double threshold) {
        Severity severity = AlertScoring.severity(z, metric.weight());
        boolean critical = metric.threshold(ThresholdLevel.CRITICAL)
            .map(t -> Math.abs(z) >= t.value() && t.condition().matches(z))
            .orElse(false);
        if (critical) {
            severity = Severity.max(severity, Severity.HIGH);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("zScore", z);
        details.put("stddev", stats.stddev());
        details.put("median", stats.median());
        details.put("samples", stats.count());

        return new RawFinding(
            kind(), kind().alertType(), metric.metric().key(), metric.category(), metric.weight(),
            z, 1.0, severity,
            value, stats.mean(),
            StatisticsCalculator.deviationPercentage(value, stats.mean()),
            threshold,
            StatisticsCalculator.significance(z),
            AlertScoring.anomalyScore(z),
            input.observedAt(), input.window(),
            dataPoints(input, metric, stats, threshold),
            details);
    }

    private List<DataPoint> dataPoints(DetectionInput input, MonitoredMetric metric,
                                       SummaryStatistics stats, double threshold) {
        List<DataPoint> points = new ArrayList<>();
        for (MetricSnapshot s : input.history().tail(DATA_POINTS)) {
            OptionalDouble v = s.value(metric.metric());
            if (v.isEmpty()) continue;
            double z = StatisticsCalculator.zScore(v.getAsDouble(), stats.mean(), stats.stddev());
            points.add(new DataPoint(s.timestamp(), v.getAsDouble(), stats.mean(), Math.abs(z) > threshold, List.of()));
        }
        return points;
    }
}
