package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.alert.DataPoint;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.config.MonitoredMetric;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.stats.ExpectedTrend;
import com.anomalyplatform.common.stats.Trend;
import com.anomalyplatform.common.stats.TrendEstimator;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.scoring.ExpectedTrendModel;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Least-squares trend of each monitored metric over the window, compared with the slope
 * the {@link ExpectedTrendModel} expects. Runs on history alone, so a missing current
 * snapshot does not stop it.
 *
 * <p>Strength is the slope difference in units of {@value #SLOPE_UNIT}; reliability is R².
 */
@Component
public class TrendBreakDetector implements AnomalyDetector {

    static final double SLOPE_UNIT = 0.15;
    static final int DATA_POINTS = 14;

    private final DetectionConfig config;
    private final ExpectedTrendModel expectedTrendModel;

    public TrendBreakDetector(DetectionConfig config, ExpectedTrendModel expectedTrendModel) {
        this.config = config;
        this.expectedTrendModel = expectedTrendModel;
    }

    @Override
    public DetectorKind kind() { return DetectorKind.TREND; }

    @Override
    public List<RawFinding> detect(DetectionInput input) {
        List<RawFinding> findings = new ArrayList<>();
        int evaluated = 0;
        int mostSamples = 0;

        for (MonitoredMetric metric : config.monitoredMetrics()) {
            List<Instant> times = new ArrayList<>();
            List<Double> values = new ArrayList<>();
            for (MetricSnapshot s : input.history().snapshots()) {
                OptionalDouble v = s.value(metric.metric());
                if (v.isPresent()) {
                    times.add(s.timestamp());
                    values.add(v.getAsDouble());
                }
            }
            mostSamples = Math.max(mostSamples, values.size());
            if (!TrendEstimator.hasSufficientSamples(values)) continue;
            evaluated++;

            Trend trend = TrendEstimator.estimate(values);
            ExpectedTrend expected = expectedTrendModel.expected(metric.metric(), input.context());
            if (!TrendEstimator.isAnomalous(trend, expected, metric.weight())) continue;

            findings.add(finding(input, metric, trend, expected, times, values));
        }

        if (evaluated == 0) {
            throw new InsufficientDataException(detectorName(), mostSamples, TrendEstimator.MIN_SAMPLES);
        }
        return findings;
    }

    private RawFinding finding(DetectionInput input, MonitoredMetric metric, Trend trend, ExpectedTrend expected,
                               List<Instant> times, List<Double> values) {
        double signedDiff = trend.slope() - expected.slope();
        double reference = expected.slope() == 0.0 ? 1.0 : Math.abs(expected.slope());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("slope", trend.slope());
        details.put("expectedSlope", expected.slope());
        details.put("direction", trend.direction().key());
        details.put("expectedDirection", expected.direction().key());
        details.put("rSquared", trend.rSquared());

        List<DataPoint> points = new ArrayList<>();
        int from = Math.max(0, values.size() - DATA_POINTS);
        for (int i = from; i < values.size(); i++) {
            double fitted = trend.fitted(i);
            points.add(new DataPoint(times.get(i), values.get(i), fitted, false, List.of()));
        }

        return new RawFinding(
            kind(), kind().alertType(), metric.metric().key(), metric.category(), metric.weight(),
            signedDiff / SLOPE_UNIT, trend.rSquared(), null,
            trend.slope(), expected.slope(),
            signedDiff / reference * 100.0,
            TrendEstimator.SLOPE_DIFF_THRESHOLD * metric.weight(),
            trend.rSquared() * 100.0,
            Math.min(100.0, Math.abs(signedDiff) * 50.0),
            input.observedAt(), input.window(),
            points, details);
    }
}
