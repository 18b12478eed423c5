package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.SensitivityLevel;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.SeasonPhase;
import com.anomalyplatform.common.model.TeamState;
import com.anomalyplatform.detection.model.RawFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.anomalyplatform.detection.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class StatisticalOutlierDetectorTest {

    /** mean 80, stddev 5 */
    private static final HistoricalData HISTORY = alternating(20, MetricName.PERFORMANCE, 75, 85);

    private static List<RawFinding> detect(DetectionConfig config, double performance, DetectionContext ctx) {
        return new StatisticalOutlierDetector(config)
            .detect(input(HISTORY, current(values(MetricName.PERFORMANCE, performance)), ctx));
    }

    @Test
    @DisplayName("z = 3.2 → one high-severity finding with the history as evidence")
    void outlier() {
        List<RawFinding> findings = detect(config(), 96, DetectionContext.defaults());

        assertEquals(1, findings.size());
        RawFinding f = findings.get(0);
        assertEquals(AlertType.STATISTICAL_OUTLIER, f.type());
        assertEquals("performance", f.metricKey());
        assertEquals(3.2, f.strength(), 1e-9);
        assertEquals(Severity.HIGH, f.severity());
        assertEquals(80.0, f.expectedValue(), 1e-9);
        assertEquals(20.0, f.deviationPercentage(), 1e-9);
        assertEquals(1.5, f.threshold(), 1e-9);
        assertEquals(20, f.dataPoints().size());
        assertEquals(NOW, f.observedAt());
    }

    @Test
    @DisplayName("crossing the critical threshold lifts a weighted medium to high")
    void criticalEscalation() {
        // weight 0.9: 3.2 · 0.9 = 2.88 alone would be medium
        RawFinding f = detect(DetectionConfig.defaults(), 96, DetectionContext.defaults()).get(0);
        assertEquals(Severity.HIGH, f.severity());
    }

    @Test
    @DisplayName("landing exactly on the critical threshold counts as crossing it")
    void criticalThresholdInclusive() {
        // z = 3.0 · 0.9 = 2.7 is medium before the lift
        RawFinding f = detect(DetectionConfig.defaults(), 95, DetectionContext.defaults()).get(0);
        assertEquals(3.0, f.strength(), 1e-9);
        assertEquals(Severity.HIGH, f.severity());
    }

    @Nested
    @DisplayName("threshold adjustments")
    class Thresholds {

        @Test
        void belowTheWarningThresholdIsQuiet() {
            assertTrue(detect(config(), 87, DetectionContext.defaults()).isEmpty());
        }

        @Test
        void playoffsLowerTheThreshold() {
            List<RawFinding> findings = detect(config(), 87, DetectionContext.forPhase(SeasonPhase.PLAYOFFS));
            assertEquals(1, findings.size());
            assertEquals(1.2, findings.get(0).threshold(), 1e-9);
        }

        @Test
        void aFatiguedTeamLowersTheThreshold() {
            DetectionContext base = DetectionContext.defaults();
            DetectionContext tired = new DetectionContext(base.seasonPhase(), base.recentEvents(),
                base.environmentalFactors(), new TeamState(70, 75, 80, 0, 70, 50),
                base.playerState(), base.workloadContext());

            List<RawFinding> findings = detect(config(), 87, tired);
            assertEquals(1, findings.size());
            assertEquals(1.35, findings.get(0).threshold(), 1e-9);
        }

        @Test
        void highSensitivityLowersTheThreshold() {
            DetectionConfig sensitive = configBuilder().sensitivity(SensitivityLevel.HIGH).build();
            assertEquals(1, detect(sensitive, 87, DetectionContext.defaults()).size());
        }

        @Test
        void unmonitoredWeightsFallBackToDefaults() {
            assertEquals(1.5, StatisticalOutlierDetector.weightThreshold(0.9));
            assertEquals(2.0, StatisticalOutlierDetector.weightThreshold(0.5));
            assertEquals(2.5, StatisticalOutlierDetector.weightThreshold(0.2));
        }
    }

    @Test
    @DisplayName("an ABOVE threshold ignores drops")
    void directionalCondition() {
        HistoricalData load = alternating(20, MetricName.LOAD, 55, 65);
        StatisticalOutlierDetector detector = new StatisticalOutlierDetector(DetectionConfig.defaults());

        assertTrue(detector.detect(input(load, current(values(MetricName.LOAD, 45)))).isEmpty());
        RawFinding spike = detector.detect(input(load, current(values(MetricName.LOAD, 75)))).get(0);
        assertEquals("load", spike.metricKey());
        assertEquals(Severity.MEDIUM, spike.severity());
    }

    @Test
    @DisplayName("no current snapshot or too little history → insufficient data")
    void insufficientData() {
        StatisticalOutlierDetector detector = new StatisticalOutlierDetector(config());
        assertThrows(InsufficientDataException.class, () -> detector.detect(input(HISTORY, null)));
        assertThrows(InsufficientDataException.class, () -> detector.detect(
            input(alternating(9, MetricName.PERFORMANCE, 75, 85), current(values(MetricName.PERFORMANCE, 96)))));
    }
}
