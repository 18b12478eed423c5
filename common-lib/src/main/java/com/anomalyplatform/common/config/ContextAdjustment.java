package com.anomalyplatform.common.config;

import com.anomalyplatform.common.model.SeasonPhase;

/**
 * Multiplies a metric's statistical threshold while the season is in {@code seasonPhase}.
 */
public record ContextAdjustment(SeasonPhase seasonPhase, double adjustmentFactor, String reasoning) {}
