package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.stats.ExpectedTrend;

/**
 * Strategy supplying the slope a metric is expected to follow in the given context.
 */
public interface ExpectedTrendModel {
    ExpectedTrend expected(MetricName metric, DetectionContext context);
}
