package com.anomalyplatform.detection.service;

import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.TimeWindow;
import com.anomalyplatform.detection.model.EntityDetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Runs detection for many entities with bounded concurrency.
 *
 * <p>Emits exactly one result per requested entity, in request order: a report, or an
 * explicit error record. One entity failing never fails the batch.
 */
@Service
public class BatchDetectionService {

    private static final Logger log = LoggerFactory.getLogger(BatchDetectionService.class);

    public static final int DEFAULT_CONCURRENCY = 4;

    private final AnomalyDetectionEngine engine;

    public BatchDetectionService(AnomalyDetectionEngine engine) {
        this.engine = engine;
    }

    public Flux<EntityDetectionResult> detectAll(List<EntityRef> entities, int concurrency) {
        return detectAll(entities, concurrency, Optional.empty());
    }

    public Flux<EntityDetectionResult> detectAll(List<EntityRef> entities, int concurrency, Optional<TimeWindow> window) {
        int parallelism = Math.max(1, concurrency);
        log.info("[Batch] detecting entities={} concurrency={}", entities.size(), parallelism);
        return Flux.fromIterable(entities)
            .flatMapSequential(entity -> Mono.defer(() -> engine.detectWithReport(entity.type(), entity.id(), window))
                .map(EntityDetectionResult::success)
                .onErrorResume(e -> {
                    log.warn("[Batch] entity={} failed: {}", entity, e.getMessage());
                    return Mono.just(EntityDetectionResult.failure(entity,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
                }), parallelism);
    }
}
