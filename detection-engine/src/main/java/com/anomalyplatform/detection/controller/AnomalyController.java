package com.anomalyplatform.detection.controller;

import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.alert.AnomalyTrend;
import com.anomalyplatform.common.alert.Timeframe;
import com.anomalyplatform.common.exception.DataSourceUnavailableException;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.Granularity;
import com.anomalyplatform.common.model.TimeWindow;
import com.anomalyplatform.detection.dto.BatchDetectionRequest;
import com.anomalyplatform.detection.model.DetectionReport;
import com.anomalyplatform.detection.model.EntityDetectionResult;
import com.anomalyplatform.detection.service.AnomalyDetectionEngine;
import com.anomalyplatform.detection.service.BatchDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/anomalies")
public class AnomalyController {

    private static final Logger log = LoggerFactory.getLogger(AnomalyController.class);

    private final AnomalyDetectionEngine engine;
    private final BatchDetectionService batchService;

    public AnomalyController(AnomalyDetectionEngine engine, BatchDetectionService batchService) {
        this.engine = engine;
        this.batchService = batchService;
    }

    @GetMapping("/{entityType}/{entityId}")
    public Mono<ResponseEntity<List<Alert>>> detect(@PathVariable String entityType,
                                                    @PathVariable String entityId,
                                                    @RequestParam(required = false) Instant from,
                                                    @RequestParam(required = false) Instant to) {
        log.info("Detection requested. entity={}:{}", entityType, entityId);
        return Mono.fromCallable(() -> EntityType.fromKey(entityType))
            .flatMap(type -> engine.detect(type, entityId, window(from, to)))
            .map(ResponseEntity::ok)
            .onErrorResume(AnomalyController::errorResponse);
    }

    @GetMapping("/{entityType}/{entityId}/report")
    public Mono<ResponseEntity<DetectionReport>> report(@PathVariable String entityType,
                                                        @PathVariable String entityId,
                                                        @RequestParam(required = false) Instant from,
                                                        @RequestParam(required = false) Instant to) {
        log.info("Detection report requested. entity={}:{}", entityType, entityId);
        return Mono.fromCallable(() -> EntityType.fromKey(entityType))
            .flatMap(type -> engine.detectWithReport(type, entityId, window(from, to)))
            .map(ResponseEntity::ok)
            .onErrorResume(AnomalyController::errorResponse);
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<List<EntityDetectionResult>>> batch(@RequestBody BatchDetectionRequest request) {
        int concurrency = request.concurrency() != null
            ? request.concurrency()
            : BatchDetectionService.DEFAULT_CONCURRENCY;
        log.info("Batch detection requested. entities={} concurrency={}", request.entities().size(), concurrency);
        return Mono.fromCallable(() -> window(request.from(), request.to()))
            .flatMap(window -> batchService.detectAll(request.entities(), concurrency, window).collectList())
            .map(ResponseEntity::ok)
            .onErrorResume(AnomalyController::errorResponse);
    }

    @GetMapping("/trends")
    public Mono<ResponseEntity<AnomalyTrend>> trends(@RequestParam(defaultValue = "month") String timeframe) {
        log.info("Anomaly trends requested. timeframe={}", timeframe);
        return Mono.fromCallable(() -> Timeframe.fromKey(timeframe))
            .flatMap(engine::trends)
            .map(ResponseEntity::ok)
            .onErrorResume(AnomalyController::errorResponse);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    /** Both bounds or neither; one bound alone is rejected. */
    static Optional<TimeWindow> window(Instant from, Instant to) {
        if (from == null && to == null) return Optional.empty();
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to must be given together");
        }
        return Optional.of(new TimeWindow(from, to, Granularity.DAILY));
    }

    private static <T> Mono<ResponseEntity<T>> errorResponse(Throwable e) {
        if (e instanceof IllegalArgumentException) {
            log.warn("Rejected request: {}", e.getMessage());
            return Mono.just(ResponseEntity.badRequest().build());
        }
        if (e instanceof DataSourceUnavailableException) {
            log.warn("Data source unavailable: {}", e.getMessage());
            return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
        }
        return Mono.error(e);
    }
}
