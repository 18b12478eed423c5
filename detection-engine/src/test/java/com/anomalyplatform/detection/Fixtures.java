package com.anomalyplatform.detection;

import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.AlertStatus;
import com.anomalyplatform.common.alert.HistoricalComparison;
import com.anomalyplatform.common.alert.ResolutionType;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.config.MetricThreshold;
import com.anomalyplatform.common.config.MonitoredMetric;
import com.anomalyplatform.common.config.ThresholdCondition;
import com.anomalyplatform.common.config.ThresholdLevel;
import com.anomalyplatform.common.model.CurrentData;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.model.TimeWindow;
import com.anomalyplatform.detection.detector.AnomalyDetector;
import com.anomalyplatform.detection.detector.ClusterAnomalyDetector;
import com.anomalyplatform.detection.detector.MultivariateAnomalyDetector;
import com.anomalyplatform.detection.detector.PatternDeviationDetector;
import com.anomalyplatform.detection.detector.StatisticalOutlierDetector;
import com.anomalyplatform.detection.detector.TrendBreakDetector;
import com.anomalyplatform.detection.factory.AlertFactory;
import com.anomalyplatform.detection.model.ClusterCenters;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.pipeline.AlertPipeline;
import com.anomalyplatform.detection.provider.ClusterCenterProvider;
import com.anomalyplatform.detection.provider.ContextProvider;
import com.anomalyplatform.detection.provider.CurrentDataProvider;
import com.anomalyplatform.detection.provider.HistoricalAlertStore;
import com.anomalyplatform.detection.provider.HistoricalDataProvider;
import com.anomalyplatform.detection.scoring.ClusterAssigner;
import com.anomalyplatform.detection.scoring.EuclideanClusterModel;
import com.anomalyplatform.detection.scoring.PatternComparator;
import com.anomalyplatform.detection.scoring.SeasonPhaseExpectedTrendModel;
import com.anomalyplatform.detection.scoring.WeightedMeanPatternScorer;
import com.anomalyplatform.detection.service.AnomalyDetectionEngine;
import com.anomalyplatform.detection.service.AnomalyTrendAnalyzer;
import com.anomalyplatform.detection.service.ContextNormalizer;
import com.anomalyplatform.detection.service.DetectionFlowLogger;
import com.anomalyplatform.detection.service.DetectionOrchestrator;
import com.anomalyplatform.detection.store.InMemoryHistoricalAlertStore;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Shared builders for detection-engine tests. Histories are daily, ending the day
 * before {@link #NOW}.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-03-01T08:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final EntityRef PLAYER = EntityRef.of(EntityType.PLAYER, "p1");
    public static final TimeWindow WINDOW = TimeWindow.lastDays(30, NOW);

    private Fixtures() {}

    // ── data ─────────────────────────────────────────────────────────────────

    public static Map<MetricName, Double> values(Object... pairs) {
        Map<MetricName, Double> m = new EnumMap<>(MetricName.class);
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((MetricName) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        return m;
    }

    /** {@code days} daily snapshots; {@code valuesForDay} receives 0 for the oldest. */
    public static HistoricalData history(int days, IntFunction<Map<MetricName, Double>> valuesForDay) {
        List<MetricSnapshot> snapshots = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            Instant at = NOW.minus(Duration.ofDays(days - i));
            snapshots.add(MetricSnapshot.of(at, valuesForDay.apply(i)));
        }
        return new HistoricalData(snapshots);
    }

    /** Alternates low/high, giving mean (low+high)/2 and stddev (high-low)/2. */
    public static HistoricalData alternating(int days, MetricName metric, double low, double high) {
        return history(days, i -> values(metric, i % 2 == 0 ? low : high));
    }

    public static HistoricalData constant(int days, Map<MetricName, Double> values) {
        return history(days, i -> values);
    }

    public static CurrentData current(Map<MetricName, Double> values) {
        return new CurrentData(PLAYER, "t1", "Wolves", MetricSnapshot.of(NOW, values));
    }

    public static DetectionInput input(HistoricalData history, CurrentData current) {
        return input(history, current, DetectionContext.defaults());
    }

    public static DetectionInput input(HistoricalData history, CurrentData current, DetectionContext context) {
        return new DetectionInput(PLAYER, WINDOW, history, current, context, false, null);
    }

    // ── findings and alerts ──────────────────────────────────────────────────

    /** A finding of {@code kind} on {@code metricKey}: current 96 against 80, observed at {@link #NOW}. */
    public static RawFinding finding(DetectorKind kind, String metricKey, double strength) {
        return new RawFinding(kind, kind.alertType(), metricKey, MetricCategory.PERFORMANCE, 1.0,
            strength, 1.0, null, 96.0, 80.0, 20.0, 1.5, 90.0, 64.0,
            NOW, WINDOW, List.of(), Map.of());
    }

    public static Alert alert(DetectorKind kind, String metricKey, double strength) {
        return alert(finding(kind, metricKey, strength), DetectionContext.defaults());
    }

    public static Alert alert(RawFinding finding, DetectionContext context) {
        return new AlertFactory(config(), new InMemoryHistoricalAlertStore(CLOCK), CLOCK)
            .build(finding, input(HistoricalData.empty(), current(values()), context), HistoricalComparison.empty());
    }

    /** Stored alert for {@link #PLAYER}, open unless {@code resolution} is given. */
    public static AlertRecord record(String id, String metricKey, double deviation, Instant detectedAt,
                                     ResolutionType resolution) {
        AlertStatus status = resolution == null ? AlertStatus.NEW
            : resolution == ResolutionType.FALSE_POSITIVE ? AlertStatus.FALSE_POSITIVE : AlertStatus.RESOLVED;
        return new AlertRecord(id, PLAYER, metricKey, DetectorKind.STATISTICAL.alertType(), Severity.HIGH,
            deviation, detectedAt.minus(Duration.ofHours(2)), detectedAt, status,
            resolution == null ? null : detectedAt.plus(Duration.ofDays(1)),
            resolution, resolution == null ? null : "rest day", resolution == null ? 0.0 : 80.0);
    }

    // ── config ───────────────────────────────────────────────────────────────

    /** Defaults with performance at full weight, warning 1.5σ and critical 3σ either side. */
    public static DetectionConfig.Builder configBuilder() {
        return DetectionConfig.defaultBuilder()
            .monitoredMetric(new MonitoredMetric(MetricName.PERFORMANCE, MetricCategory.PERFORMANCE, 1.0,
                List.of(
                    new MetricThreshold(ThresholdLevel.WARNING, 1.5, ThresholdCondition.OUTSIDE_RANGE, Duration.ofDays(7)),
                    new MetricThreshold(ThresholdLevel.CRITICAL, 3.0, ThresholdCondition.OUTSIDE_RANGE, Duration.ofDays(3))),
                List.of()));
    }

    public static DetectionConfig config() {
        return configBuilder().build();
    }

    // ── wiring ───────────────────────────────────────────────────────────────

    public static List<AnomalyDetector> detectors(DetectionConfig config) {
        return List.of(
            new StatisticalOutlierDetector(config),
            new PatternDeviationDetector(new PatternComparator(new WeightedMeanPatternScorer(config.monitoredMetrics()))),
            new TrendBreakDetector(config, new SeasonPhaseExpectedTrendModel()),
            new MultivariateAnomalyDetector(config),
            new ClusterAnomalyDetector(config, new ClusterAssigner(new EuclideanClusterModel())));
    }

    /** Collaborators of one engine; unset providers return nothing. */
    public static final class Sources {
        public HistoricalDataProvider history = (type, id, window) -> Mono.empty();
        public CurrentDataProvider current = (type, id) -> Mono.empty();
        public ContextProvider context = (type, id) -> Mono.just(DetectionContext.defaults());
        public ClusterCenters clusters;
        public HistoricalAlertStore store = new InMemoryHistoricalAlertStore(CLOCK);

        public Sources history(HistoricalData data) {
            this.history = (type, id, window) -> Mono.just(data);
            return this;
        }

        public Sources current(CurrentData data) {
            this.current = (type, id) -> Mono.just(data);
            return this;
        }

        public Sources context(DetectionContext ctx) {
            this.context = (type, id) -> Mono.just(ctx);
            return this;
        }
    }

    public static DetectionOrchestrator orchestrator(DetectionConfig config, Sources sources) {
        ClusterCenterProvider clusterProvider = sources.clusters == null ? null : () -> Mono.just(sources.clusters);
        return new DetectionOrchestrator(detectors(config), sources.history, sources.current, sources.context,
            Optional.ofNullable(clusterProvider), new ContextNormalizer(), config);
    }

    public static AnomalyDetectionEngine engine(DetectionConfig config, Sources sources) {
        return new AnomalyDetectionEngine(
            orchestrator(config, sources),
            new AlertFactory(config, sources.store, CLOCK),
            new AlertPipeline(config),
            sources.store,
            new AnomalyTrendAnalyzer(),
            new DetectionFlowLogger(),
            config,
            CLOCK);
    }
}
