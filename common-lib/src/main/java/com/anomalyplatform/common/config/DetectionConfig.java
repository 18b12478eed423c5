package com.anomalyplatform.common.config;

import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.exception.ConfigurationException;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.SeasonPhase;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable settings for detection runs. Passed explicitly to every component that needs
 * it; there is no ambient instance.
 *
 * <p>{@link Builder#build()} validates the whole configuration and throws
 * {@link ConfigurationException} listing every violation, so an invalid configuration is
 * rejected before the first run.
 */
public final class DetectionConfig {

    private final SensitivityLevel sensitivity;
    private final Map<DetectorKind, DetectorSettings> detectors;
    private final List<MonitoredMetric> monitoredMetrics;
    private final List<MetricGroup> metricGroups;
    private final Map<AlertType, AlertThreshold> alertThresholds;
    private final double minConfidence;
    private final double maxFalsePositiveProbability;
    private final int maxAlerts;
    private final Duration relatedAlertWindow;
    private final Set<SeasonPhase> highStakesPhases;
    private final double highStakesThresholdFactor;
    private final double highStakesUrgencyFactor;
    private final double clusterDistanceThreshold;
    private final Duration fetchTimeout;
    private final int defaultWindowDays;

    private DetectionConfig(Builder b) {
        this.sensitivity = b.sensitivity;
        this.detectors = Collections.unmodifiableMap(new EnumMap<>(b.detectors));
        this.monitoredMetrics = List.copyOf(b.monitoredMetrics);
        this.metricGroups = List.copyOf(b.metricGroups);
        this.alertThresholds = Collections.unmodifiableMap(new LinkedHashMap<>(b.alertThresholds));
        this.minConfidence = b.minConfidence;
        this.maxFalsePositiveProbability = b.maxFalsePositiveProbability;
        this.maxAlerts = b.maxAlerts;
        this.relatedAlertWindow = b.relatedAlertWindow;
        this.highStakesPhases = b.highStakesPhases.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(b.highStakesPhases));
        this.highStakesThresholdFactor = b.highStakesThresholdFactor;
        this.highStakesUrgencyFactor = b.highStakesUrgencyFactor;
        this.clusterDistanceThreshold = b.clusterDistanceThreshold;
        this.fetchTimeout = b.fetchTimeout;
        this.defaultWindowDays = b.defaultWindowDays;
    }

    // ── defaults ─────────────────────────────────────────────────────────────

    /**
     * Production defaults: five watched metrics, three metric groups, all detectors on,
     * statistical outliers gated at confidence 70 / severity medium with a 24h
     * recent-similar-alert suppression.
     */
    public static DetectionConfig defaults() {
        return defaultBuilder().build();
    }

    public static Builder defaultBuilder() {
        Builder b = builder();
        for (DetectorKind kind : DetectorKind.values()) {
            b.detector(kind, DetectorSettings.enabled(kind.defaultWeight()));
        }
        b.monitoredMetric(new MonitoredMetric(MetricName.PERFORMANCE, MetricCategory.PERFORMANCE, 0.9,
            List.of(
                new MetricThreshold(ThresholdLevel.WARNING, 1.5, ThresholdCondition.OUTSIDE_RANGE, Duration.ofDays(7)),
                new MetricThreshold(ThresholdLevel.CRITICAL, 3.0, ThresholdCondition.OUTSIDE_RANGE, Duration.ofDays(3))),
            List.of(new ContextAdjustment(SeasonPhase.PRESEASON, 1.1,
                "Performance fluctuates while fitness is rebuilt"))));
        b.monitoredMetric(new MonitoredMetric(MetricName.LOAD, MetricCategory.LOAD, 0.8,
            List.of(new MetricThreshold(ThresholdLevel.WARNING, 2.0, ThresholdCondition.ABOVE, Duration.ofDays(5))),
            List.of()));
        b.monitoredMetric(new MonitoredMetric(MetricName.FATIGUE, MetricCategory.INJURY, 0.7,
            List.of(new MetricThreshold(ThresholdLevel.WARNING, 2.0, ThresholdCondition.ABOVE, Duration.ofDays(5))),
            List.of()));
        b.monitoredMetric(new MonitoredMetric(MetricName.WELLNESS, MetricCategory.WELLNESS, 0.7,
            List.of(new MetricThreshold(ThresholdLevel.WARNING, 2.0, ThresholdCondition.BELOW, Duration.ofDays(7))),
            List.of()));
        b.monitoredMetric(new MonitoredMetric(MetricName.RECOVERY, MetricCategory.RECOVERY, 0.7,
            List.of(new MetricThreshold(ThresholdLevel.WARNING, 2.0, ThresholdCondition.BELOW, Duration.ofDays(7))),
            List.of()));
        b.metricGroup(MetricGroup.of(MetricCategory.PERFORMANCE,
            MetricName.PERFORMANCE, MetricName.FATIGUE, MetricName.WELLNESS));
        b.metricGroup(MetricGroup.of(MetricCategory.LOAD,
            MetricName.LOAD, MetricName.RECOVERY, MetricName.READINESS));
        b.metricGroup(MetricGroup.of(MetricCategory.PERFORMANCE,
            MetricName.STRENGTH, MetricName.SPEED, MetricName.ENDURANCE));
        b.alertThreshold(new AlertThreshold(AlertType.STATISTICAL_OUTLIER, 70, Severity.MEDIUM,
            List.of(SuppressionRule.recentSimilarAlert(SuppressionRule.DEFAULT_LOOKBACK, "Avoid alert fatigue"))));
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.sensitivity = sensitivity;
        b.detectors.putAll(detectors);
        b.monitoredMetrics.addAll(monitoredMetrics);
        b.metricGroups.addAll(metricGroups);
        b.alertThresholds.putAll(alertThresholds);
        b.minConfidence = minConfidence;
        b.maxFalsePositiveProbability = maxFalsePositiveProbability;
        b.maxAlerts = maxAlerts;
        b.relatedAlertWindow = relatedAlertWindow;
        b.highStakesPhases.addAll(highStakesPhases);
        b.highStakesThresholdFactor = highStakesThresholdFactor;
        b.highStakesUrgencyFactor = highStakesUrgencyFactor;
        b.clusterDistanceThreshold = clusterDistanceThreshold;
        b.fetchTimeout = fetchTimeout;
        b.defaultWindowDays = defaultWindowDays;
        return b;
    }

    // ── accessors ────────────────────────────────────────────────────────────

    public SensitivityLevel sensitivity()                    { return sensitivity; }
    public Map<DetectorKind, DetectorSettings> detectors()   { return detectors; }
    public List<MonitoredMetric> monitoredMetrics()          { return monitoredMetrics; }
    public List<MetricGroup> metricGroups()                  { return metricGroups; }
    public Map<AlertType, AlertThreshold> alertThresholds()  { return alertThresholds; }
    public double minConfidence()                            { return minConfidence; }
    public double maxFalsePositiveProbability()              { return maxFalsePositiveProbability; }
    public int maxAlerts()                                   { return maxAlerts; }
    public Duration relatedAlertWindow()                     { return relatedAlertWindow; }
    public Set<SeasonPhase> highStakesPhases()               { return highStakesPhases; }
    public double highStakesThresholdFactor()                { return highStakesThresholdFactor; }
    public double highStakesUrgencyFactor()                  { return highStakesUrgencyFactor; }
    public double clusterDistanceThreshold()                 { return clusterDistanceThreshold; }
    public Duration fetchTimeout()                           { return fetchTimeout; }
    public int defaultWindowDays()                           { return defaultWindowDays; }

    public boolean isEnabled(DetectorKind kind) {
        DetectorSettings s = detectors.get(kind);
        return s != null && s.enabled();
    }

    /** Detector reliability weight; 0 for a detector that is not configured. */
    public double detectorWeight(DetectorKind kind) {
        DetectorSettings s = detectors.get(kind);
        return s == null ? 0.0 : s.weight();
    }

    public Optional<MonitoredMetric> monitoredMetric(MetricName metric) {
        return monitoredMetrics.stream().filter(m -> m.metric() == metric).findFirst();
    }

    public Optional<AlertThreshold> alertThreshold(AlertType type) {
        return Optional.ofNullable(alertThresholds.get(type));
    }

    public boolean isHighStakes(SeasonPhase phase) {
        return phase != null && highStakesPhases.contains(phase);
    }

    @Override
    public String toString() {
        return "DetectionConfig{sensitivity=" + sensitivity
            + ", detectors=" + detectors.keySet()
            + ", metrics=" + monitoredMetrics.size()
            + ", groups=" + metricGroups.size()
            + ", maxAlerts=" + maxAlerts + "}";
    }

    // ── builder ──────────────────────────────────────────────────────────────

    public static final class Builder {

        private SensitivityLevel sensitivity = SensitivityLevel.MEDIUM;
        private final Map<DetectorKind, DetectorSettings> detectors = new EnumMap<>(DetectorKind.class);
        private final List<MonitoredMetric> monitoredMetrics = new ArrayList<>();
        private final List<MetricGroup> metricGroups = new ArrayList<>();
        private final Map<AlertType, AlertThreshold> alertThresholds = new LinkedHashMap<>();
        private double minConfidence = 60;
        private double maxFalsePositiveProbability = 40;
        private int maxAlerts = 20;
        private Duration relatedAlertWindow = Duration.ofHours(48);
        private final Set<SeasonPhase> highStakesPhases = EnumSet.of(SeasonPhase.PLAYOFFS);
        private double highStakesThresholdFactor = 0.8;
        private double highStakesUrgencyFactor = 1.2;
        private double clusterDistanceThreshold = 15;
        private Duration fetchTimeout = Duration.ofSeconds(5);
        private int defaultWindowDays = 30;

        private Builder() {}

        public Builder sensitivity(SensitivityLevel sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public Builder detector(DetectorKind kind, DetectorSettings settings) {
            detectors.put(kind, settings);
            return this;
        }

        /** Replaces any existing entry for the same metric. */
        public Builder monitoredMetric(MonitoredMetric metric) {
            monitoredMetrics.removeIf(m -> m.metric() == metric.metric());
            monitoredMetrics.add(metric);
            return this;
        }

        /** Adds without replacing, so duplicates surface in validation. */
        public Builder addMonitoredMetric(MonitoredMetric metric) {
            monitoredMetrics.add(metric);
            return this;
        }

        public Builder clearMonitoredMetrics() {
            monitoredMetrics.clear();
            return this;
        }

        public Builder metricGroup(MetricGroup group) {
            metricGroups.add(group);
            return this;
        }

        public Builder clearMetricGroups() {
            metricGroups.clear();
            return this;
        }

        public Builder alertThreshold(AlertThreshold threshold) {
            alertThresholds.put(threshold.alertType(), threshold);
            return this;
        }

        public Builder clearAlertThresholds() {
            alertThresholds.clear();
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder maxFalsePositiveProbability(double maxFalsePositiveProbability) {
            this.maxFalsePositiveProbability = maxFalsePositiveProbability;
            return this;
        }

        public Builder maxAlerts(int maxAlerts) {
            this.maxAlerts = maxAlerts;
            return this;
        }

        public Builder relatedAlertWindow(Duration relatedAlertWindow) {
            this.relatedAlertWindow = relatedAlertWindow;
            return this;
        }

        public Builder highStakesPhases(Set<SeasonPhase> phases) {
            highStakesPhases.clear();
            if (phases != null) highStakesPhases.addAll(phases);
            return this;
        }

        public Builder highStakesThresholdFactor(double factor) {
            this.highStakesThresholdFactor = factor;
            return this;
        }

        public Builder highStakesUrgencyFactor(double factor) {
            this.highStakesUrgencyFactor = factor;
            return this;
        }

        public Builder clusterDistanceThreshold(double threshold) {
            this.clusterDistanceThreshold = threshold;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder defaultWindowDays(int days) {
            this.defaultWindowDays = days;
            return this;
        }

        public DetectionConfig build() {
            List<String> violations = validate();
            if (!violations.isEmpty()) {
                throw new ConfigurationException(violations);
            }
            return new DetectionConfig(this);
        }

        private List<String> validate() {
            List<String> v = new ArrayList<>();
            if (sensitivity == null) v.add("sensitivity is required");

            detectors.forEach((kind, s) -> {
                if (s == null) {
                    v.add("detector " + kind.detectorName() + " has no settings");
                } else if (!inUnitRange(s.weight())) {
                    v.add("detector " + kind.detectorName() + " weight " + s.weight() + " outside [0,1]");
                }
            });
            if (detectors.values().stream().noneMatch(s -> s != null && s.enabled())) {
                v.add("at least one detector must be enabled");
            }

            Set<MetricName> seen = new HashSet<>();
            for (MonitoredMetric m : monitoredMetrics) {
                if (m.metric() == null) {
                    v.add("monitored metric without a name");
                    continue;
                }
                String name = m.metric().key();
                if (!seen.add(m.metric())) v.add("metric " + name + " is monitored twice");
                if (m.category() == null) v.add("metric " + name + " has no category");
                if (!inUnitRange(m.weight())) v.add("metric " + name + " weight " + m.weight() + " outside [0,1]");
                if (m.thresholds().isEmpty()) v.add("metric " + name + " is missing a threshold");
                for (MetricThreshold t : m.thresholds()) {
                    if (t.level() == null || t.condition() == null) {
                        v.add("metric " + name + " has a threshold without level or condition");
                    }
                    if (!(t.value() > 0)) v.add("metric " + name + " threshold value must be positive");
                }
                for (ContextAdjustment adj : m.contextAdjustments()) {
                    if (adj.seasonPhase() == null || !(adj.adjustmentFactor() > 0)) {
                        v.add("metric " + name + " has an invalid context adjustment");
                    }
                }
            }

            for (MetricGroup g : metricGroups) {
                if (g.name() == null || g.name().isBlank()) v.add("metric group without a name");
                if (g.metrics().size() < 2) v.add("metric group " + g.name() + " needs at least two metrics");
                if (new HashSet<>(g.metrics()).size() != g.metrics().size()) {
                    v.add("metric group " + g.name() + " repeats a metric");
                }
                if (g.category() == null) v.add("metric group " + g.name() + " has no category");
                if (!inUnitRange(g.weight())) v.add("metric group " + g.name() + " weight outside [0,1]");
            }

            for (AlertThreshold t : alertThresholds.values()) {
                if (!inPercentRange(t.minimumConfidence())) {
                    v.add("alert threshold for " + t.alertType().key() + " has confidence outside [0,100]");
                }
                for (SuppressionRule rule : t.suppressionRules()) {
                    if (rule.condition() == null) {
                        v.add("suppression rule for " + t.alertType().key() + " has no condition");
                    } else if (rule.condition() == SuppressionCondition.MUTED_UNTIL && rule.mutedUntil() == null) {
                        v.add("muted_until rule for " + t.alertType().key() + " has no end time");
                    } else if (rule.lookback().isNegative() || rule.lookback().isZero()) {
                        v.add("suppression rule for " + t.alertType().key() + " has a non-positive lookback");
                    }
                }
            }

            if (!inPercentRange(minConfidence)) v.add("minConfidence outside [0,100]");
            if (!inPercentRange(maxFalsePositiveProbability)) v.add("maxFalsePositiveProbability outside [0,100]");
            if (maxAlerts < 1) v.add("maxAlerts must be at least 1");
            if (relatedAlertWindow == null || relatedAlertWindow.isNegative()) v.add("relatedAlertWindow must be non-negative");
            if (!(highStakesThresholdFactor > 0)) v.add("highStakesThresholdFactor must be positive");
            if (!(highStakesUrgencyFactor > 0)) v.add("highStakesUrgencyFactor must be positive");
            if (!(clusterDistanceThreshold > 0)) v.add("clusterDistanceThreshold must be positive");
            if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
                v.add("fetchTimeout must be positive");
            }
            if (defaultWindowDays < 1) v.add("defaultWindowDays must be at least 1");
            return v;
        }

        private static boolean inUnitRange(double x) {
            return x >= 0.0 && x <= 1.0;
        }

        private static boolean inPercentRange(double x) {
            return x >= 0.0 && x <= 100.0;
        }
    }
}
