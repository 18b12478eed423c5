package com.anomalyplatform.detection.service;

import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.AnomalyTrend;
import com.anomalyplatform.common.alert.Timeframe;
import com.anomalyplatform.common.config.AlertThreshold;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.SuppressionRule;
import com.anomalyplatform.common.exception.DataSourceUnavailableException;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.TimeWindow;
import com.anomalyplatform.common.trace.TraceContextUtil;
import com.anomalyplatform.detection.factory.AlertFactory;
import com.anomalyplatform.detection.model.DetectionOutcome;
import com.anomalyplatform.detection.model.DetectionReport;
import com.anomalyplatform.detection.pipeline.AlertPipeline;
import com.anomalyplatform.detection.pipeline.PipelineContext;
import com.anomalyplatform.detection.provider.HistoricalAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the detection library.
 *
 * <p>A run fetches data, runs the detectors, expands findings into alerts in detector
 * registration order and hands them to the {@link AlertPipeline}. The engine keeps no
 * state between runs besides the immutable {@link DetectionConfig}, so one instance may
 * serve concurrent callers. It never persists alerts.
 *
 * <pre>
 *   detect(type, id, window)            → ranked alerts
 *   detectWithReport(type, id, window)  → ranked alerts + diagnostics + degradations
 *   trends(timeframe)                   → rollup of stored alerts
 * </pre>
 */
@Service
public class AnomalyDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final DetectionOrchestrator orchestrator;
    private final AlertFactory alertFactory;
    private final AlertPipeline pipeline;
    private final HistoricalAlertStore alertStore;
    private final AnomalyTrendAnalyzer trendAnalyzer;
    private final DetectionFlowLogger flowLogger;
    private final DetectionConfig config;
    private final Clock clock;

    public AnomalyDetectionEngine(DetectionOrchestrator orchestrator,
                                  AlertFactory alertFactory,
                                  AlertPipeline pipeline,
                                  HistoricalAlertStore alertStore,
                                  AnomalyTrendAnalyzer trendAnalyzer,
                                  DetectionFlowLogger flowLogger,
                                  DetectionConfig config,
                                  Clock clock) {
        this.orchestrator = orchestrator;
        this.alertFactory = alertFactory;
        this.pipeline = pipeline;
        this.alertStore = alertStore;
        this.trendAnalyzer = trendAnalyzer;
        this.flowLogger = flowLogger;
        this.config = config;
        this.clock = clock;
    }

    public Mono<List<Alert>> detect(EntityType entityType, String entityId, Optional<TimeWindow> window) {
        return detectWithReport(entityType, entityId, window).map(DetectionReport::alerts);
    }

    public Mono<DetectionReport> detectWithReport(EntityType entityType, String entityId, Optional<TimeWindow> window) {
        EntityRef entity = EntityRef.of(entityType, entityId);
        TimeWindow w = window.orElseGet(() -> TimeWindow.lastDays(config.defaultWindowDays(), clock.instant()));
        String runId = TraceContextUtil.newRunId();

        Mono<DetectionReport> run = Mono.defer(() -> {
                flowLogger.logStage(DetectionFlowLogger.RUN_STARTED, entity, runId);
                return orchestrator.run(entity, w);
            })
            .doOnEach(flowLogger.stage(DetectionFlowLogger.DETECTORS_COMPLETED, entity))
            .flatMap(outcome -> buildAlerts(outcome)
                .doOnEach(flowLogger.stage(DetectionFlowLogger.ALERTS_BUILT, entity))
                .zipWith(recentAlerts(outcome.input().entity(), w))
                .map(t -> new DetectionReport(
                    outcome.input().entity(),
                    pipeline.process(t.getT1(), new PipelineContext(outcome.input().context().seasonPhase(), t.getT2())),
                    outcome.diagnostics(),
                    outcome.degradations())))
            .doOnEach(flowLogger.stage(DetectionFlowLogger.PIPELINE_COMPLETED, entity))
            .doOnError(e -> log.error("[Engine] detection failed for entity={} runId={}", entity, runId, e));

        return TraceContextUtil.withRunId(run, runId);
    }

    public Mono<AnomalyTrend> trends(Timeframe timeframe) {
        Instant to = clock.instant();
        Instant from = to.minus(timeframe.length());
        return Mono.defer(() -> alertStore.alertsBetween(from, to))
            .timeout(config.fetchTimeout())
            .defaultIfEmpty(List.of())
            .map(records -> trendAnalyzer.analyze(timeframe, records))
            .doOnNext(trend -> log.info("[Engine] trends period={} anomalies={} resolutionRate={}",
                timeframe.key(), trend.anomalyCount(), trend.resolutionRate()))
            .onErrorMap(e -> !(e instanceof DataSourceUnavailableException),
                e -> new DataSourceUnavailableException("alert-store", "timeframe " + timeframe.key(), e));
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private Mono<List<Alert>> buildAlerts(DetectionOutcome outcome) {
        return Flux.fromIterable(outcome.findings())
            .concatMap(finding -> alertFactory.create(finding, outcome.input()))
            .collectList();
    }

    /**
     * Stored alerts of the entity, fetched once per run for suppression and related-alert
     * lookup. Degrades to an empty list when the store is slow or down.
     */
    private Mono<List<AlertRecord>> recentAlerts(EntityRef entity, TimeWindow window) {
        Instant now = clock.instant();
        Duration horizon = lookbackHorizon();
        Instant reference = window.end().isBefore(now) ? window.end() : now;
        Instant since = reference.minus(horizon);
        return Mono.defer(() -> alertStore.recentAlerts(entity, since))
            .timeout(config.fetchTimeout())
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("[Engine] recent alerts unavailable for entity={}: {}", entity, e.getMessage());
                return Mono.just(List.of());
            });
    }

    Duration lookbackHorizon() {
        Duration horizon = config.relatedAlertWindow();
        for (AlertThreshold t : config.alertThresholds().values()) {
            for (SuppressionRule rule : t.suppressionRules()) {
                if (rule.lookback().compareTo(horizon) > 0) horizon = rule.lookback();
            }
        }
        return horizon;
    }
}
