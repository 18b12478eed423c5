package com.anomalyplatform.detection.model;

import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.alert.DataPoint;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.TimeWindow;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a detector found, before it is turned into an {@code Alert}.
 *
 * @param metricKey   metric name, or metric-group / pseudo-metric name
 * @param weight      importance weight used for severity
 * @param strength    signed strength in standard-deviation units
 * @param reliability how much the detector trusts this finding, in [0,1] (R² for trends)
 * @param severity    severity fixed by the detector's own escalation rule, or {@code null}
 *                    to derive it from strength and weight
 * @param details     detector specific values used for wording (slopes, cluster ids, ...)
 */
public record RawFinding(
    DetectorKind detector,
    AlertType type,
    String metricKey,
    MetricCategory category,
    double weight,
    double strength,
    double reliability,
    Severity severity,
    double currentValue,
    double expectedValue,
    double deviationPercentage,
    double threshold,
    double statisticalSignificance,
    double anomalyScore,
    Instant observedAt,
    TimeWindow window,
    List<DataPoint> dataPoints,
    Map<String, Object> details
) {
    public RawFinding {
        dataPoints = dataPoints == null ? List.of() : List.copyOf(dataPoints);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Object detail(String key) {
        return details.get(key);
    }

    public double detailDouble(String key, double fallback) {
        Object v = details.get(key);
        return v instanceof Number n ? n.doubleValue() : fallback;
    }

    public String detailString(String key, String fallback) {
        Object v = details.get(key);
        return v == null ? fallback : v.toString();
    }
}
