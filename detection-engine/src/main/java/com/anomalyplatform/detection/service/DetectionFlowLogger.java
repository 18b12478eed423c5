package com.anomalyplatform.detection.service;

import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a detection run. Pure side effects; never changes the pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #RUN_STARTED}:         detect or report requested</li>
 *   <li>{@link #DETECTORS_COMPLETED}: data fetched; every detector completed, skipped or failed</li>
 *   <li>{@link #ALERTS_BUILT}:        findings expanded into alerts</li>
 *   <li>{@link #PIPELINE_COMPLETED}:  filtered, deduplicated, ranked output ready</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the run id from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(DetectionFlowLogger.ALERTS_BUILT, entity))
 * </pre>
 */
@Component
public class DetectionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DetectionFlowLogger.class);

    public static final String RUN_STARTED         = "RUN_STARTED";
    public static final String DETECTORS_COMPLETED = "DETECTORS_COMPLETED";
    public static final String ALERTS_BUILT        = "ALERTS_BUILT";
    public static final String PIPELINE_COMPLETED  = "PIPELINE_COMPLETED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on every
     * {@code onNext}. Errors and completion are ignored.
     */
    public <T> Consumer<Signal<T>> stage(String stageName, EntityRef entity) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = TraceContextUtil.getRunId(signal.getContextView());
            logStage(stageName, entity, runId);
        };
    }

    public void logStage(String stageName, EntityRef entity, String runId) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[DetectionFlow] stage={} entity={} runId={}", stageName, entity, runId)
        );
    }
}
