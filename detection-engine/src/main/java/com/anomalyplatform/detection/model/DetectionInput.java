package com.anomalyplatform.detection.model;

import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.CurrentData;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.model.TimeWindow;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot every detector of one run reads. Immutable and shared across the
 * detectors running in parallel.
 *
 * @param current         latest data, {@code null} when the current-data fetch failed
 * @param contextDegraded true when context fields were missing and defaults were used
 * @param clusterCenters  {@code null} when no centers are available
 */
public record DetectionInput(
    EntityRef entity,
    TimeWindow window,
    HistoricalData history,
    CurrentData current,
    DetectionContext context,
    boolean contextDegraded,
    ClusterCenters clusterCenters
) {
    public DetectionInput {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(window, "window");
        history = history == null ? HistoricalData.empty() : history;
        context = context == null ? DetectionContext.defaults() : context;
    }

    /**
     * @throws InsufficientDataException when the current snapshot is missing
     */
    public MetricSnapshot requireCurrent(String detectorName) {
        if (current == null) {
            throw new InsufficientDataException(detectorName, "no current snapshot for " + entity);
        }
        return current.snapshot();
    }

    public Optional<ClusterCenters> clusters() {
        return Optional.ofNullable(clusterCenters);
    }

    /** When the evaluated values were observed: the current snapshot, else the newest history. */
    public Instant observedAt() {
        if (current != null) return current.snapshot().timestamp();
        if (!history.isEmpty()) return history.snapshots().get(history.size() - 1).timestamp();
        return window.end();
    }
}
