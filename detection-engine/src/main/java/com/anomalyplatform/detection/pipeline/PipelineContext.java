package com.anomalyplatform.detection.pipeline;

import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.model.SeasonPhase;

import java.util.List;

/**
 * Per-run inputs of the pipeline besides the alerts themselves.
 *
 * @param recentAlerts stored alerts of the same entity, fetched once per run, used for
 *                     suppression and related-alert lookup
 */
public record PipelineContext(SeasonPhase seasonPhase, List<AlertRecord> recentAlerts) {

    public PipelineContext {
        seasonPhase = seasonPhase == null ? SeasonPhase.REGULAR : seasonPhase;
        recentAlerts = recentAlerts == null ? List.of() : List.copyOf(recentAlerts);
    }

    public static PipelineContext of(SeasonPhase seasonPhase) {
        return new PipelineContext(seasonPhase, List.of());
    }
}
