package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.scoring.AlertScoring;
import com.anomalyplatform.common.stats.StatisticsCalculator;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.scoring.PatternComparator;
import com.anomalyplatform.detection.scoring.PatternComparison;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags a 7-sample training pattern that sits more than two standard deviations away
 * from the historical pattern distribution.
 */
@Component
public class PatternDeviationDetector implements AnomalyDetector {

    public static final String METRIC_KEY = "training_pattern";
    static final double PATTERN_WEIGHT = 1.0;

    private final PatternComparator comparator;

    public PatternDeviationDetector(PatternComparator comparator) {
        this.comparator = comparator;
    }

    @Override
    public DetectorKind kind() { return DetectorKind.PATTERN; }

    @Override
    public List<RawFinding> detect(DetectionInput input) {
        MetricSnapshot current = input.requireCurrent(detectorName());
        int windows = PatternComparator.windowCount(input.history());
        if (windows < PatternComparator.MIN_WINDOWS) {
            throw new InsufficientDataException(detectorName(), windows, PatternComparator.MIN_WINDOWS);
        }

        Optional<PatternComparison> comparison = comparator.compare(input.history(), current);
        if (comparison.isEmpty()) {
            throw new InsufficientDataException(detectorName(), "no scorable pattern windows for " + input.entity());
        }
        PatternComparison c = comparison.get();
        if (!c.anomalous()) {
            return List.of();
        }

        return List.of(new RawFinding(
            kind(), kind().alertType(), METRIC_KEY, MetricCategory.LOAD, PATTERN_WEIGHT,
            c.zScore(), 1.0, null,
            c.currentScore(), c.historicalMean(),
            StatisticsCalculator.deviationPercentage(c.currentScore(), c.historicalMean()),
            2.0,
            StatisticsCalculator.significance(c.zScore()),
            AlertScoring.anomalyScore(c.zScore()),
            input.observedAt(), input.window(),
            List.of(),
            Map.of("windows", c.windowCount(), "stddev", c.historicalStddev())));
    }
}
