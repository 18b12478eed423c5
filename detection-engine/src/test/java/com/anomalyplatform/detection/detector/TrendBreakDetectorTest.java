package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.SeasonPhase;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.scoring.SeasonPhaseExpectedTrendModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.anomalyplatform.detection.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TrendBreakDetectorTest {

    private final TrendBreakDetector detector = new TrendBreakDetector(config(), new SeasonPhaseExpectedTrendModel());

    @Test
    @DisplayName("a clean +1/day climb in the regular season breaks the flat expectation")
    void risingTrend() {
        List<RawFinding> findings = detector.detect(
            input(history(20, i -> values(MetricName.PERFORMANCE, 60 + i)), null));

        assertEquals(1, findings.size());
        RawFinding f = findings.get(0);
        assertEquals(AlertType.TREND_BREAK, f.type());
        assertEquals(1.0 / 0.15, f.strength(), 1e-9);
        assertEquals(1.0, f.reliability(), 1e-9);
        assertEquals(1.0, f.currentValue(), 1e-9);
        assertEquals(0.0, f.expectedValue(), 1e-9);
        assertEquals("increasing", f.detailString("direction", null));
        assertEquals("stable", f.detailString("expectedDirection", null));
        assertEquals(14, f.dataPoints().size());
    }

    @Test
    @DisplayName("the expected slope depends on the season phase")
    void phaseAwareExpectation() {
        DetectionContext playoffs = DetectionContext.forPhase(SeasonPhase.PLAYOFFS);

        assertTrue(detector.detect(input(history(20, i -> values(MetricName.PERFORMANCE, 80 - 0.2 * i)), null, playoffs))
            .isEmpty());
        RawFinding f = detector.detect(input(history(20, i -> values(MetricName.PERFORMANCE, 80 - i)), null, playoffs))
            .get(0);
        assertEquals(-0.8 / 0.15, f.strength(), 1e-9);
    }

    @Test
    @DisplayName("a noisy series with a poor fit is not a trend")
    void unreliableFit() {
        assertTrue(detector.detect(input(alternating(20, MetricName.PERFORMANCE, 75, 85), null)).isEmpty());
    }

    @Test
    @DisplayName("fewer than 14 samples → insufficient data")
    void tooShort() {
        assertThrows(InsufficientDataException.class,
            () -> detector.detect(input(history(13, i -> values(MetricName.PERFORMANCE, 60 + i)), null)));
    }
}
