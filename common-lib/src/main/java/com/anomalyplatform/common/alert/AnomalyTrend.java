package com.anomalyplatform.common.alert;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only rollup of recorded alerts over a {@link Timeframe}.
 * Rates are percentages; durations are zero when nothing could be measured.
 */
public record AnomalyTrend(
    @JsonProperty("period") Timeframe period,
    @JsonProperty("anomalyCount") int anomalyCount,
    @JsonProperty("severityDistribution") Map<Severity, Integer> severityDistribution,
    @JsonProperty("typeDistribution") Map<AlertType, Integer> typeDistribution,
    @JsonProperty("resolutionRate") double resolutionRate,
    @JsonProperty("averageDetectionTime") Duration averageDetectionTime,
    @JsonProperty("averageResolutionTime") Duration averageResolutionTime,
    @JsonProperty("falsePositiveRate") double falsePositiveRate,
    @JsonProperty("improvementSuggestions") List<String> improvementSuggestions
) {
    public AnomalyTrend {
        severityDistribution = severityDistribution == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(severityDistribution));
        typeDistribution = typeDistribution == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(typeDistribution));
        improvementSuggestions = improvementSuggestions == null ? List.of() : List.copyOf(improvementSuggestions);
    }
}
