package com.anomalyplatform.detection.service;

import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.exception.DataSourceUnavailableException;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.CurrentData;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.TimeWindow;
import com.anomalyplatform.detection.detector.AnomalyDetector;
import com.anomalyplatform.detection.model.ClusterCenters;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.DetectionOutcome;
import com.anomalyplatform.detection.model.DetectorDiagnostic;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.provider.ClusterCenterProvider;
import com.anomalyplatform.detection.provider.ContextProvider;
import com.anomalyplatform.detection.provider.CurrentDataProvider;
import com.anomalyplatform.detection.provider.HistoricalDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs every detector for one entity over one window.
 *
 * <p>The four collaborator fetches run concurrently, each bounded by the configured
 * fetch timeout. A failed or timed-out fetch degrades to "no data" and is reported, so
 * the detectors that depend on it skip instead of the run failing.
 *
 * <p>Enabled detectors run in parallel on {@code boundedElastic}. Results are merged in
 * detector registration order (statistical, pattern, trend, multivariate, cluster)
 * regardless of completion order. A detector failure becomes a FAILED diagnostic and a
 * data shortfall a SKIPPED one; neither affects the other detectors.
 */
@Service
public class DetectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

    static final String HISTORY_SOURCE = "historical-data";
    static final String CURRENT_SOURCE = "current-data";
    static final String CONTEXT_SOURCE = "context";
    static final String CLUSTER_SOURCE = "cluster-centers";

    private final List<AnomalyDetector> detectors;
    private final HistoricalDataProvider historyProvider;
    private final CurrentDataProvider currentProvider;
    private final ContextProvider contextProvider;
    private final ClusterCenterProvider clusterProvider;
    private final ContextNormalizer contextNormalizer;
    private final DetectionConfig config;

    public DetectionOrchestrator(List<AnomalyDetector> detectors,
                                 HistoricalDataProvider historyProvider,
                                 CurrentDataProvider currentProvider,
                                 ContextProvider contextProvider,
                                 Optional<ClusterCenterProvider> clusterProvider,
                                 ContextNormalizer contextNormalizer,
                                 DetectionConfig config) {
        List<AnomalyDetector> ordered = new ArrayList<>(detectors);
        ordered.sort(Comparator.comparingInt(d -> d.kind().ordinal()));
        this.detectors = List.copyOf(ordered);
        this.historyProvider = historyProvider;
        this.currentProvider = currentProvider;
        this.contextProvider = contextProvider;
        this.clusterProvider = clusterProvider.orElse(null);
        this.contextNormalizer = contextNormalizer;
        this.config = config;
    }

    public List<AnomalyDetector> detectors() {
        return detectors;
    }

    public Mono<DetectionOutcome> run(EntityRef entity, TimeWindow window) {
        Mono<Fetched<HistoricalData>> history = fetch(HISTORY_SOURCE, entity,
            () -> historyProvider.get(entity.type(), entity.id(), window));
        Mono<Fetched<CurrentData>> current = fetch(CURRENT_SOURCE, entity,
            () -> currentProvider.get(entity.type(), entity.id()));
        Mono<Fetched<DetectionContext>> context = fetch(CONTEXT_SOURCE, entity,
            () -> contextProvider.build(entity.type(), entity.id()));
        Mono<Fetched<ClusterCenters>> clusters = clusterProvider == null
            ? Mono.just(Fetched.<ClusterCenters>empty())
            : fetch(CLUSTER_SOURCE, entity, clusterProvider::current);

        return Mono.zip(history, current, context, clusters)
            .flatMap(t -> {
                List<String> degradations = new ArrayList<>();
                t.getT1().failure().ifPresent(degradations::add);
                t.getT2().failure().ifPresent(degradations::add);
                t.getT3().failure().ifPresent(degradations::add);
                t.getT4().failure().ifPresent(degradations::add);

                ContextNormalizer.NormalizedContext normalized =
                    contextNormalizer.normalize(t.getT3().value(), entity);
                if (normalized.isDegraded() && t.getT3().failure().isEmpty()) {
                    degradations.add(CONTEXT_SOURCE + ": defaults used for " + normalized.missingFields());
                }

                CurrentData currentData = t.getT2().value();
                DetectionInput input = new DetectionInput(
                    named(entity, currentData), window,
                    t.getT1().value(), currentData,
                    normalized.context(), normalized.isDegraded(),
                    t.getT4().value());

                return runDetectors(input)
                    .map(runs -> {
                        List<RawFinding> findings = new ArrayList<>();
                        List<DetectorDiagnostic> diagnostics = new ArrayList<>();
                        for (DetectorRun run : runs) {
                            findings.addAll(run.findings());
                            diagnostics.add(run.diagnostic());
                        }
                        log.info("[Orchestrator] entity={} findings={} detectors={} degradations={}",
                            entity, findings.size(), diagnostics.size(), degradations.size());
                        return new DetectionOutcome(input, findings, diagnostics, degradations);
                    });
            });
    }

    // ── detectors ────────────────────────────────────────────────────────────

    private Mono<List<DetectorRun>> runDetectors(DetectionInput input) {
        return Flux.fromIterable(detectors)
            .flatMapSequential(detector -> runOne(detector, input))
            .collectList();
    }

    private Mono<DetectorRun> runOne(AnomalyDetector detector, DetectionInput input) {
        String name = detector.detectorName();
        if (!config.isEnabled(detector.kind())) {
            return Mono.just(new DetectorRun(List.of(), DetectorDiagnostic.disabled(name)));
        }
        return Mono.fromCallable(() -> detector.detect(input))
            .subscribeOn(Schedulers.boundedElastic())
            .map(findings -> new DetectorRun(findings, DetectorDiagnostic.completed(name, findings.size())))
            .doOnNext(run -> log.debug("[Orchestrator] detector={} complete. findings={} entity={}",
                name, run.findings().size(), input.entity()))
            .onErrorResume(InsufficientDataException.class, e -> {
                log.info("[Orchestrator] detector={} skipped for entity={}: {}", name, input.entity(), e.getMessage());
                return Mono.just(new DetectorRun(List.of(), DetectorDiagnostic.skipped(name, e.getMessage())));
            })
            .onErrorResume(e -> {
                log.error("[Orchestrator] detector={} failed for entity={}", name, input.entity(), e);
                return Mono.just(new DetectorRun(List.of(), DetectorDiagnostic.failed(name, String.valueOf(e.getMessage()))));
            });
    }

    // ── fetches ──────────────────────────────────────────────────────────────

    private <T> Mono<Fetched<T>> fetch(String source, EntityRef entity, Supplier<Mono<T>> call) {
        return Mono.defer(call)
            .timeout(config.fetchTimeout())
            .map(value -> Fetched.of(value))
            .defaultIfEmpty(Fetched.<T>empty())
            .onErrorResume(e -> {
                DataSourceUnavailableException unavailable = new DataSourceUnavailableException(source, entity.toString(), e);
                log.warn("[Orchestrator] {}", unavailable.getMessage());
                return Mono.just(Fetched.<T>failed(source + ": " + describe(e)));
            });
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) return "timed out";
        return e.getMessage() != null ? "unavailable (" + e.getMessage() + ")" : "unavailable";
    }

    private static EntityRef named(EntityRef requested, CurrentData current) {
        if (requested.name() != null || current == null || current.entity().name() == null) {
            return requested;
        }
        return new EntityRef(requested.type(), requested.id(), current.entity().name());
    }

    private record DetectorRun(List<RawFinding> findings, DetectorDiagnostic diagnostic) {}

    private record Fetched<T>(T value, String failureMessage) {

        static <T> Fetched<T> of(T value) {
            return new Fetched<>(value, null);
        }

        static <T> Fetched<T> empty() {
            return new Fetched<>(null, null);
        }

        static <T> Fetched<T> failed(String message) {
            return new Fetched<>(null, message);
        }

        Optional<String> failure() {
            return Optional.ofNullable(failureMessage);
        }
    }
}
