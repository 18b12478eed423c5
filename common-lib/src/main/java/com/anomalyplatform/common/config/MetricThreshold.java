package com.anomalyplatform.common.config;

import java.time.Duration;

/** {@code value} is expressed in standard deviations. */
public record MetricThreshold(
    ThresholdLevel level,
    double value,
    ThresholdCondition condition,
    Duration timeWindow
) {}
