package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.SeasonPhase;
import com.anomalyplatform.common.stats.TrendDirection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeasonPhaseExpectedTrendModelTest {

    private final SeasonPhaseExpectedTrendModel model = new SeasonPhaseExpectedTrendModel();

    @Test
    void preseasonBuildsFitnessOnly() {
        DetectionContext ctx = DetectionContext.forPhase(SeasonPhase.PRESEASON);
        assertEquals(0.5, model.expected(MetricName.FITNESS, ctx).slope(), 1e-9);
        assertEquals(TrendDirection.INCREASING, model.expected(MetricName.FITNESS, ctx).direction());
        assertEquals(0.0, model.expected(MetricName.PERFORMANCE, ctx).slope(), 1e-9);
    }

    @Test
    void regularSeasonIsFlat() {
        assertEquals(TrendDirection.STABLE,
            model.expected(MetricName.PERFORMANCE, DetectionContext.defaults()).direction());
    }

    @Test
    void lateSeasonDeclines() {
        assertEquals(-0.2, model.expected(MetricName.LOAD, DetectionContext.forPhase(SeasonPhase.PLAYOFFS)).slope(), 1e-9);
        assertEquals(-0.2, model.expected(MetricName.LOAD, DetectionContext.forPhase(SeasonPhase.OFFSEASON)).slope(), 1e-9);
    }
}
