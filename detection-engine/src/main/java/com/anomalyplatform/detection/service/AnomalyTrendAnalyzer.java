package com.anomalyplatform.detection.service;

import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.AlertStatus;
import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.alert.AnomalyTrend;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.alert.Timeframe;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only rollup of stored alerts over a timeframe.
 *
 * <ul>
 *   <li>resolution rate: closed (resolved or false positive) / all, in percent</li>
 *   <li>false-positive rate: false positives / all, in percent</li>
 *   <li>average detection time: detectedAt − observedAt</li>
 *   <li>average resolution time: resolvedAt − detectedAt, closed alerts only</li>
 * </ul>
 * Improvement suggestions are rule-based on those figures.
 */
@Component
public class AnomalyTrendAnalyzer {

    static final double HIGH_FALSE_POSITIVE_RATE = 20.0;
    static final double LOW_RESOLUTION_RATE      = 50.0;
    static final double DOMINANT_TYPE_SHARE      = 40.0;
    static final double HIGH_CRITICAL_SHARE      = 20.0;
    static final int    MIN_ALERTS_FOR_ADVICE    = 5;
    static final Duration SLOW_DETECTION         = Duration.ofHours(24);
    static final Duration SLOW_RESOLUTION        = Duration.ofDays(7);

    public AnomalyTrend analyze(Timeframe period, List<AlertRecord> records) {
        int count = records.size();

        Map<Severity, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity s : Severity.values()) bySeverity.put(s, 0);
        Map<AlertType, Integer> byType = new EnumMap<>(AlertType.class);
        Map<AlertType, Integer> falsePositivesByType = new EnumMap<>(AlertType.class);

        int closed = 0;
        int falsePositives = 0;
        List<Duration> detection = new ArrayList<>();
        List<Duration> resolution = new ArrayList<>();
        for (AlertRecord r : records) {
            bySeverity.merge(r.severity(), 1, Integer::sum);
            byType.merge(r.type(), 1, Integer::sum);
            if (r.status() != null && r.status().isClosed()) closed++;
            if (r.status() == AlertStatus.FALSE_POSITIVE) {
                falsePositives++;
                falsePositivesByType.merge(r.type(), 1, Integer::sum);
            }
            r.detectionLatency().ifPresent(detection::add);
            r.resolutionTime().ifPresent(resolution::add);
        }

        double resolutionRate = percent(closed, count);
        double falsePositiveRate = percent(falsePositives, count);
        Duration avgDetection = average(detection);
        Duration avgResolution = average(resolution);

        List<String> suggestions = suggestions(count, bySeverity, byType, falsePositivesByType,
            resolutionRate, falsePositiveRate, avgDetection, avgResolution);

        return new AnomalyTrend(period, count, bySeverity, byType, resolutionRate,
            avgDetection, avgResolution, falsePositiveRate, suggestions);
    }

    private static List<String> suggestions(int count,
                                            Map<Severity, Integer> bySeverity,
                                            Map<AlertType, Integer> byType,
                                            Map<AlertType, Integer> falsePositivesByType,
                                            double resolutionRate,
                                            double falsePositiveRate,
                                            Duration avgDetection,
                                            Duration avgResolution) {
        List<String> out = new ArrayList<>();
        if (count < MIN_ALERTS_FOR_ADVICE) {
            return out;
        }
        if (falsePositiveRate > HIGH_FALSE_POSITIVE_RATE) {
            String worst = mostFrequent(falsePositivesByType).map(AlertType::key).orElse("all");
            out.add(String.format(Locale.ROOT,
                "Raise thresholds for %s alerts: %.0f%% of alerts were false positives", worst, falsePositiveRate));
        }
        if (resolutionRate < LOW_RESOLUTION_RATE) {
            out.add(String.format(Locale.ROOT,
                "Review open alerts: only %.0f%% were closed", resolutionRate));
        }
        mostFrequent(byType).ifPresent(type -> {
            double share = percent(byType.get(type), count);
            if (share > DOMINANT_TYPE_SHARE) {
                out.add(String.format(Locale.ROOT,
                    "Adjust thresholds for %s alerts: they make up %.0f%% of all anomalies", type.key(), share));
            }
        });
        double criticalShare = percent(bySeverity.getOrDefault(Severity.CRITICAL, 0), count);
        if (criticalShare > HIGH_CRITICAL_SHARE) {
            out.add(String.format(Locale.ROOT,
                "Enhance context awareness during high-stress periods: %.0f%% of alerts were critical", criticalShare));
        }
        if (avgDetection.compareTo(SLOW_DETECTION) > 0) {
            out.add("Run detection more often: average detection latency is " + avgDetection.toHours() + " hours");
        }
        if (avgResolution.compareTo(SLOW_RESOLUTION) > 0) {
            out.add("Shorten follow-up: average resolution takes " + avgResolution.toDays() + " days");
        }
        return out;
    }

    private static Optional<AlertType> mostFrequent(Map<AlertType, Integer> counts) {
        AlertType best = null;
        int bestCount = 0;
        for (Map.Entry<AlertType, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private static double percent(int part, int whole) {
        return whole == 0 ? 0.0 : part * 100.0 / whole;
    }

    private static Duration average(List<Duration> durations) {
        if (durations.isEmpty()) return Duration.ZERO;
        long totalMillis = 0;
        for (Duration d : durations) totalMillis += d.toMillis();
        return Duration.ofMillis(totalMillis / durations.size());
    }
}
