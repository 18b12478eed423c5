package com.anomalyplatform.detection.service;

import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.AlertStatus;
import com.anomalyplatform.common.alert.Resolution;
import com.anomalyplatform.common.alert.ResolutionType;
import com.anomalyplatform.detection.provider.HistoricalAlertStore;
import com.anomalyplatform.detection.provider.WritableAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * External resolution workflow for alerts the engine has emitted.
 *
 * <p>Every operation returns an updated copy; the input alert is never changed. When the
 * configured store is writable, the new state is recorded so later runs can suppress
 * repeats and relate alerts.
 */
@Service
public class AlertLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleService.class);

    private final WritableAlertStore store;
    private final Clock clock;

    public AlertLifecycleService(HistoricalAlertStore store, Clock clock) {
        this.store = store instanceof WritableAlertStore writable ? writable : null;
        this.clock = clock;
    }

    /** Records a freshly emitted alert so later runs see it. */
    public Mono<Alert> track(Alert alert) {
        return record(alert);
    }

    public Mono<Alert> startInvestigation(Alert alert, String note) {
        return Mono.fromCallable(() -> {
                Alert moved = alert.transitionTo(AlertStatus.INVESTIGATING);
                return note == null || note.isBlank() ? moved : moved.addInvestigationNote(note);
            })
            .flatMap(this::record);
    }

    public Mono<Alert> addNote(Alert alert, String note) {
        return Mono.fromCallable(() -> alert.addInvestigationNote(note)).flatMap(this::record);
    }

    public Mono<Alert> resolve(Alert alert, Resolution resolution) {
        return Mono.fromCallable(() -> alert.resolve(resolution)).flatMap(this::record);
    }

    public Mono<Alert> markFalsePositive(Alert alert, String resolvedBy, String reason) {
        Resolution resolution = new Resolution(clock.instant(), resolvedBy, ResolutionType.FALSE_POSITIVE,
            List.of(), reason, 0, List.of(), List.of());
        return resolve(alert, resolution);
    }

    public Mono<Alert> reopen(Alert alert, String reason) {
        return Mono.fromCallable(() -> {
                Alert reopened = alert.transitionTo(AlertStatus.NEW);
                return reason == null || reason.isBlank() ? reopened : reopened.addInvestigationNote("Reopened: " + reason);
            })
            .flatMap(this::record);
    }

    private Mono<Alert> record(Alert alert) {
        if (store == null) {
            return Mono.just(alert);
        }
        return store.record(AlertRecord.of(alert))
            .doOnSuccess(v -> log.info("[Lifecycle] alert={} status={} recorded", alert.id(), alert.status().key()))
            .thenReturn(alert);
    }
}
