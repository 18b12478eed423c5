package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Historical snapshots for one entity, ordered oldest-first.
 */
public record HistoricalData(@JsonProperty("snapshots") List<MetricSnapshot> snapshots) {

    public HistoricalData {
        List<MetricSnapshot> sorted = new ArrayList<>(snapshots == null ? List.of() : snapshots);
        sorted.sort(Comparator.comparing(MetricSnapshot::timestamp));
        snapshots = List.copyOf(sorted);
    }

    public static HistoricalData empty() {
        return new HistoricalData(List.of());
    }

    public int size() {
        return snapshots.size();
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }

    /** Values of one metric in time order, skipping snapshots where it is absent. */
    public List<Double> series(MetricName metric) {
        List<Double> out = new ArrayList<>(snapshots.size());
        for (MetricSnapshot s : snapshots) {
            s.value(metric).ifPresent(out::add);
        }
        return out;
    }

    /** The newest {@code n} snapshots, still oldest-first. */
    public List<MetricSnapshot> tail(int n) {
        if (n >= snapshots.size()) return snapshots;
        return snapshots.subList(snapshots.size() - n, snapshots.size());
    }
}
