package com.anomalyplatform.detection.provider;

import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.HistoricalComparison;
import com.anomalyplatform.common.model.EntityRef;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Read access to previously raised alerts. The engine never writes through this interface.
 */
public interface HistoricalAlertStore {

    /** Similar past alerts on {@code metricKey}, their frequency and how they were resolved. */
    Mono<HistoricalComparison> similarAlerts(String metricKey, double deviation);

    /** Alerts recorded for {@code entity} with a detection time at or after {@code since}. */
    Mono<List<AlertRecord>> recentAlerts(EntityRef entity, Instant since);

    /** Every alert detected in {@code [from, to)}. */
    Mono<List<AlertRecord>> alertsBetween(Instant from, Instant to);
}
