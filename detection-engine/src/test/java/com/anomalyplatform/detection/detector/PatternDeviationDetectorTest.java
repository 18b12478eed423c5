package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.scoring.PatternComparator;
import com.anomalyplatform.detection.scoring.WeightedMeanPatternScorer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.anomalyplatform.detection.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PatternDeviationDetectorTest {

    private final PatternDeviationDetector detector = new PatternDeviationDetector(
        new PatternComparator(new WeightedMeanPatternScorer(config().monitoredMetrics())));

    @Test
    void flagsTheTrainingPattern() {
        List<RawFinding> findings = detector.detect(input(
            alternating(20, MetricName.PERFORMANCE, 75, 85), current(values(MetricName.PERFORMANCE, 96))));

        assertEquals(1, findings.size());
        RawFinding f = findings.get(0);
        assertEquals(AlertType.PATTERN_DEVIATION, f.type());
        assertEquals(PatternDeviationDetector.METRIC_KEY, f.metricKey());
        assertEquals(MetricCategory.LOAD, f.category());
        assertEquals(3.2, f.strength(), 1e-9);
        assertNull(f.severity());
    }

    @Test
    void flatHistoryIsQuiet() {
        assertTrue(detector.detect(input(
            constant(20, values(MetricName.PERFORMANCE, 80)), current(values(MetricName.PERFORMANCE, 96)))).isEmpty());
    }

    @Test
    void needsTenWindowsAndACurrentSnapshot() {
        assertThrows(InsufficientDataException.class, () -> detector.detect(input(
            alternating(15, MetricName.PERFORMANCE, 75, 85), current(values(MetricName.PERFORMANCE, 96)))));
        assertThrows(InsufficientDataException.class, () -> detector.detect(input(
            alternating(20, MetricName.PERFORMANCE, 75, 85), null)));
    }
}
