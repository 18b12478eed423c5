package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.SeasonPhase;
import com.anomalyplatform.common.stats.ExpectedTrend;

/**
 * Expected slopes by season phase.
 *
 * <ul>
 *   <li>preseason: fitness builds at +0.5 per day, everything else flat</li>
 *   <li>regular season: flat</li>
 *   <li>playoffs and offseason: gentle decline of −0.2 per day</li>
 * </ul>
 */
public class SeasonPhaseExpectedTrendModel implements ExpectedTrendModel {

    static final double PRESEASON_FITNESS_SLOPE = 0.5;
    static final double LATE_SEASON_SLOPE = -0.2;

    @Override
    public ExpectedTrend expected(MetricName metric, DetectionContext context) {
        SeasonPhase phase = context.seasonPhase() == null ? SeasonPhase.REGULAR : context.seasonPhase();
        return switch (phase) {
            case PRESEASON -> metric == MetricName.FITNESS ? ExpectedTrend.of(PRESEASON_FITNESS_SLOPE) : ExpectedTrend.flat();
            case REGULAR   -> ExpectedTrend.flat();
            case PLAYOFFS, OFFSEASON -> ExpectedTrend.of(LATE_SEASON_SLOPE);
        };
    }
}
