package com.anomalyplatform.detection.provider;

import com.anomalyplatform.common.alert.AlertRecord;
import reactor.core.publisher.Mono;

/**
 * Alert store that also accepts records. Used by the lifecycle workflow, never by a
 * detection run.
 */
public interface WritableAlertStore extends HistoricalAlertStore {

    /** Inserts or replaces the record with the same alert id. */
    Mono<Void> record(AlertRecord record);
}
