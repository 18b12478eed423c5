package com.anomalyplatform.detection.store;

import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.AlertStatus;
import com.anomalyplatform.common.alert.FrequencyAnalysis;
import com.anomalyplatform.common.alert.HistoricalComparison;
import com.anomalyplatform.common.alert.OutcomePattern;
import com.anomalyplatform.common.alert.ResolutionType;
import com.anomalyplatform.common.alert.SeasonalityPattern;
import com.anomalyplatform.common.alert.SimilarAnomaly;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.detection.provider.WritableAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local alert store keyed by alert id.
 *
 * <p>Answers history queries from whatever the lifecycle workflow has recorded. Contents
 * are lost on restart; deployments needing durability plug in their own
 * {@link com.anomalyplatform.detection.provider.HistoricalAlertStore}.
 */
public class InMemoryHistoricalAlertStore implements WritableAlertStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryHistoricalAlertStore.class);

    /** Minimum similarity (0–100) for a past alert to count as similar. */
    public static final double MIN_SIMILARITY = 50.0;
    public static final int MAX_SIMILAR = 5;

    private final Map<String, AlertRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryHistoricalAlertStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Void> record(AlertRecord record) {
        Objects.requireNonNull(record, "record");
        return Mono.fromRunnable(() -> {
            records.put(record.alertId(), record);
            log.debug("[AlertStore] recorded alert={} status={} size={}",
                record.alertId(), record.status().key(), records.size());
        });
    }

    @Override
    public Mono<List<AlertRecord>> recentAlerts(EntityRef entity, Instant since) {
        return Mono.fromCallable(() -> records.values().stream()
            .filter(r -> entity.sameAs(r.entity()))
            .filter(r -> r.detectedAt() != null && !r.detectedAt().isBefore(since))
            .sorted(Comparator.comparing(AlertRecord::detectedAt))
            .toList());
    }

    @Override
    public Mono<List<AlertRecord>> alertsBetween(Instant from, Instant to) {
        return Mono.fromCallable(() -> records.values().stream()
            .filter(r -> r.detectedAt() != null
                && !r.detectedAt().isBefore(from) && r.detectedAt().isBefore(to))
            .sorted(Comparator.comparing(AlertRecord::detectedAt))
            .toList());
    }

    @Override
    public Mono<HistoricalComparison> similarAlerts(String metricKey, double deviation) {
        return Mono.fromCallable(() -> {
            List<AlertRecord> sameMetric = records.values().stream()
                .filter(r -> Objects.equals(r.metricKey(), metricKey))
                .toList();
            if (sameMetric.isEmpty()) {
                return HistoricalComparison.empty();
            }
            List<OutcomePattern> outcomes = outcomePatterns(sameMetric);
            return new HistoricalComparison(
                similar(sameMetric, deviation),
                frequency(sameMetric, clock.instant()),
                outcomes,
                learnings(sameMetric, outcomes));
        });
    }

    public int size() {
        return records.size();
    }

    // ── comparison helpers ──────────────────────────────────────────────────

    /** 100 for an identical deviation, falling linearly with the relative difference. */
    static double similarity(double deviation, double other) {
        double scale = Math.max(1.0, Math.max(Math.abs(deviation), Math.abs(other)));
        double sim = 100.0 * (1.0 - Math.abs(deviation - other) / scale);
        return Math.max(0.0, Math.min(100.0, sim));
    }

    private static List<SimilarAnomaly> similar(List<AlertRecord> sameMetric, double deviation) {
        return sameMetric.stream()
            .map(r -> new SimilarAnomaly(
                r.alertId(),
                r.detectedAt(),
                similarity(deviation, r.deviation()),
                r.status().key(),
                r.resolutionSummary(),
                r.resolutionTime().orElse(null),
                r.effectiveness()))
            .filter(s -> s.similarity() >= MIN_SIMILARITY)
            .sorted(Comparator.comparingDouble(SimilarAnomaly::similarity).reversed()
                .thenComparing(SimilarAnomaly::date, Comparator.nullsLast(Comparator.reverseOrder())))
            .limit(MAX_SIMILAR)
            .toList();
    }

    /**
     * Counts over the last week, month and year. The trend compares the last 30 days with
     * the 30 days before.
     */
    static FrequencyAnalysis frequency(List<AlertRecord> sameMetric, Instant now) {
        int week = countSince(sameMetric, now.minus(Duration.ofDays(7)), now);
        int month = countSince(sameMetric, now.minus(Duration.ofDays(30)), now);
        int year = countSince(sameMetric, now.minus(Duration.ofDays(365)), now);
        int previousMonth = countSince(sameMetric, now.minus(Duration.ofDays(60)), now.minus(Duration.ofDays(30)));
        String trend;
        if (month > previousMonth) trend = "increasing";
        else if (month < previousMonth) trend = "decreasing";
        else trend = "stable";
        return new FrequencyAnalysis(week, month, year, trend, SeasonalityPattern.none());
    }

    private static int countSince(List<AlertRecord> list, Instant from, Instant to) {
        int n = 0;
        for (AlertRecord r : list) {
            Instant at = r.detectedAt();
            if (at != null && !at.isBefore(from) && !at.isAfter(to)) n++;
        }
        return n;
    }

    /** One pattern per resolution type among closed alerts, most frequent first. */
    private static List<OutcomePattern> outcomePatterns(List<AlertRecord> sameMetric) {
        Map<ResolutionType, List<AlertRecord>> byType = new EnumMap<>(ResolutionType.class);
        for (AlertRecord r : sameMetric) {
            if (r.status().isClosed() && r.resolutionType() != null) {
                byType.computeIfAbsent(r.resolutionType(), k -> new ArrayList<>()).add(r);
            }
        }
        List<OutcomePattern> patterns = new ArrayList<>();
        byType.forEach((type, list) -> {
            double success = list.stream().mapToDouble(AlertRecord::effectiveness).average().orElse(0);
            Duration avg = averageResolution(list);
            List<String> actions = list.stream()
                .map(AlertRecord::resolutionSummary)
                .filter(s -> s != null && !s.isBlank())
                .distinct()
                .limit(3)
                .toList();
            patterns.add(new OutcomePattern(type.key(), list.size(), success, avg, actions));
        });
        patterns.sort(Comparator.comparingInt(OutcomePattern::frequency).reversed());
        return patterns;
    }

    private static Duration averageResolution(List<AlertRecord> list) {
        long totalMillis = 0;
        int n = 0;
        for (AlertRecord r : list) {
            Optional<Duration> t = r.resolutionTime();
            if (t.isPresent()) {
                totalMillis += t.get().toMillis();
                n++;
            }
        }
        return n == 0 ? Duration.ZERO : Duration.ofMillis(totalMillis / n);
    }

    private static List<String> learnings(List<AlertRecord> sameMetric, List<OutcomePattern> outcomes) {
        List<String> out = new ArrayList<>();
        long falsePositives = sameMetric.stream().filter(r -> r.status() == AlertStatus.FALSE_POSITIVE).count();
        if (falsePositives * 10 >= sameMetric.size() * 3L) {
            out.add("Frequent false positives on this metric; consider raising its threshold");
        }
        outcomes.stream()
            .filter(p -> !ResolutionType.FALSE_POSITIVE.key().equals(p.pattern()))
            .max(Comparator.comparingDouble(OutcomePattern::successRate))
            .filter(p -> p.successRate() > 0)
            .ifPresent(p -> out.add(String.format(Locale.ROOT,
                "Resolutions of type %s were the most effective (%.0f%%)", p.pattern(), p.successRate())));
        long open = sameMetric.stream().filter(r -> !r.status().isClosed()).count();
        if (open > 0) {
            out.add(open + " similar alert(s) still open");
        }
        return out;
    }
}
