package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.model.MetricSnapshot;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Strategy that reduces a short run of snapshots to a single pattern score.
 *
 * <p>Implementations must be stateless and side-effect free; the same window always
 * yields the same score. Return {@link OptionalDouble#empty()} when the window carries
 * none of the metrics the scorer looks at.
 *
 * <p>Current implementation: {@link WeightedMeanPatternScorer}. Register a different
 * {@code @Bean} in {@code EngineConfig} to swap it.
 */
public interface PatternScorer {

    /**
     * @param window consecutive snapshots, oldest first
     */
    OptionalDouble score(List<MetricSnapshot> window);
}
