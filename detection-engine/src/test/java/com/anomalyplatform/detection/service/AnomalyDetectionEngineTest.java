package com.anomalyplatform.detection.service;

import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.AlertStatus;
import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.alert.Recommendation;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.alert.Timeframe;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.MetricGroup;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.SeasonPhase;
import com.anomalyplatform.detection.Fixtures.Sources;
import com.anomalyplatform.detection.model.DetectionReport;
import com.anomalyplatform.detection.model.DiagnosticStatus;
import com.anomalyplatform.detection.model.DetectorDiagnostic;
import com.anomalyplatform.detection.store.InMemoryHistoricalAlertStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.anomalyplatform.detection.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of {@link AnomalyDetectionEngine} over in-memory collaborators.
 */
class AnomalyDetectionEngineTest {

    /** History mean 80, stddev 5; current 96 gives z = 3.2. */
    private static Sources outlierSources() {
        return new Sources()
            .history(alternating(20, MetricName.PERFORMANCE, 75, 85))
            .current(current(values(MetricName.PERFORMANCE, 96)));
    }

    private static List<Alert> detect(DetectionConfig config, Sources sources) {
        return engine(config, sources)
            .detect(EntityType.PLAYER, "p1", Optional.empty())
            .block(Duration.ofSeconds(10));
    }

    private static DetectionReport report(DetectionConfig config, Sources sources) {
        return engine(config, sources)
            .detectWithReport(EntityType.PLAYER, "p1", Optional.empty())
            .block(Duration.ofSeconds(10));
    }

    private static Alert ofType(List<Alert> alerts, AlertType type) {
        return alerts.stream().filter(a -> a.type() == type).findFirst()
            .orElseThrow(() -> new AssertionError("no " + type.key() + " alert in " + alerts));
    }

    @Nested
    @DisplayName("default configuration, 30 days around 80 ± 5, current 95")
    class DefaultConfigOutlier {

        /** 30 daily draws from N(80, 5); seed 9 gives mean ≈ 79.5, stddev ≈ 4.8. */
        private HistoricalData gaussianHistory() {
            Random random = new Random(9);
            double[] samples = new double[30];
            for (int i = 0; i < samples.length; i++) {
                samples[i] = 80 + 5 * random.nextGaussian();
            }
            return history(30, i -> values(MetricName.PERFORMANCE, samples[i]));
        }

        private void assertHighConfidenceOutlier(HistoricalData history) {
            Sources sources = new Sources()
                .history(history)
                .current(current(values(MetricName.PERFORMANCE, 95)));

            Alert a = ofType(detect(DetectionConfig.defaults(), sources), AlertType.STATISTICAL_OUTLIER);
            assertTrue(a.severity() == Severity.HIGH || a.severity() == Severity.CRITICAL,
                "severity " + a.severity());
            assertTrue(a.confidence() >= 80.0, "confidence " + a.confidence());
            assertEquals("performance", a.metricKey());
        }

        @Test
        @DisplayName("exact alternation 75/85 → z = 3, high severity")
        void exactAlternation() {
            assertHighConfidenceOutlier(alternating(30, MetricName.PERFORMANCE, 75, 85));
        }

        @Test
        @DisplayName("seeded normal sample → high or critical severity")
        void seededNormalSample() {
            assertHighConfidenceOutlier(gaussianHistory());
        }
    }

    @Nested
    @DisplayName("statistical outlier")
    class Outlier {

        @Test
        @DisplayName("z = 3.2 on a full-weight metric → high severity, confidence 82")
        void highSeverityOutlier() {
            List<Alert> alerts = detect(config(), outlierSources());

            Alert a = ofType(alerts, AlertType.STATISTICAL_OUTLIER);
            assertEquals(Severity.HIGH, a.severity());
            assertEquals(82.0, a.confidence(), 1e-9);
            assertEquals(9.0, a.falsePositiveProbability(), 1e-9);
            assertEquals(88.0, a.urgency(), 1e-9);
            assertEquals("performance", a.metricKey());
            assertEquals(3.2, a.anomalyData().deviation(), 1e-9);
            assertEquals(80.0, a.anomalyData().expectedValue(), 1e-9);
            assertEquals(NOW, a.detectedAt());
            assertEquals(AlertStatus.NEW, a.status());
            assertEquals("Statistical Anomaly in performance", a.title());
        }

        @Test
        @DisplayName("alerts are ranked by urgency and cross-reference each other")
        void rankingAndRelatedAlerts() {
            List<Alert> alerts = detect(config(), outlierSources());

            assertEquals(2, alerts.size(), alerts::toString);
            assertEquals(AlertType.STATISTICAL_OUTLIER, alerts.get(0).type());
            assertEquals(AlertType.PATTERN_DEVIATION, alerts.get(1).type());
            assertTrue(alerts.get(0).urgency() >= alerts.get(1).urgency());
            assertEquals(List.of(alerts.get(1).id()), alerts.get(0).relatedAlerts());
            assertEquals(List.of(alerts.get(0).id()), alerts.get(1).relatedAlerts());
        }

        @Test
        @DisplayName("flat history (stddev 0) never produces an alert")
        void zeroSpread() {
            Sources sources = new Sources()
                .history(constant(20, values(MetricName.PERFORMANCE, 80)))
                .current(current(values(MetricName.PERFORMANCE, 96)));
            assertTrue(detect(config(), sources).isEmpty());
        }

        @Test
        @DisplayName("same inputs and clock → identical alerts")
        void deterministic() {
            List<Alert> first = detect(config(), outlierSources());
            List<Alert> second = detect(config(), outlierSources());
            assertEquals(first, second);
        }
    }

    @Test
    @DisplayName("two groups scoring 72 and 74 → two medium multivariate alerts")
    void multivariateMedium() {
        DetectionConfig config = configBuilder()
            .clearMetricGroups()
            .metricGroup(MetricGroup.of(MetricCategory.PERFORMANCE, MetricName.PERFORMANCE, MetricName.FATIGUE))
            .metricGroup(MetricGroup.of(MetricCategory.LOAD, MetricName.LOAD, MetricName.RECOVERY))
            .build();
        Sources sources = new Sources()
            .history(constant(20, values(MetricName.PERFORMANCE, 80, MetricName.FATIGUE, 40,
                MetricName.LOAD, 60, MetricName.RECOVERY, 70)))
            .current(current(values(MetricName.PERFORMANCE, 94.4, MetricName.FATIGUE, 40,
                MetricName.LOAD, 74.8, MetricName.RECOVERY, 70)));

        List<Alert> alerts = detect(config, sources);

        assertEquals(2, alerts.size(), alerts::toString);
        for (Alert a : alerts) {
            assertEquals(AlertType.MULTI_VARIATE_ANOMALY, a.type());
            assertEquals(Severity.MEDIUM, a.severity());
        }
        assertEquals(List.of("performance_fatigue", "load_recovery"),
            alerts.stream().map(Alert::metricKey).toList());
        assertEquals(72.0, alerts.get(0).anomalyData().currentValue(), 1e-6);
        assertEquals(74.0, alerts.get(1).anomalyData().currentValue(), 1e-6);
    }

    @Test
    @DisplayName("5 samples of history → empty alert list, every detector skipped")
    void insufficientHistory() {
        Sources sources = new Sources()
            .history(alternating(5, MetricName.PERFORMANCE, 75, 85))
            .current(current(values(MetricName.PERFORMANCE, 96)));

        DetectionReport report = report(config(), sources);

        assertTrue(report.alerts().isEmpty());
        assertEquals(List.of("statistical_outlier", "pattern_detection", "trend_break", "multi_variate", "cluster_distance"),
            report.diagnostics().stream().map(DetectorDiagnostic::detector).toList());
        assertTrue(report.diagnostics().stream().allMatch(d -> d.status() == DiagnosticStatus.SKIPPED),
            report.diagnostics()::toString);
    }

    @Test
    @DisplayName("a failing history source degrades the run instead of failing it")
    void failingSource() {
        Sources sources = outlierSources();
        sources.history = (type, id, window) -> Mono.error(new IllegalStateException("boom"));

        DetectionReport report = report(config(), sources);

        assertTrue(report.alerts().isEmpty());
        assertTrue(report.isDegraded());
        assertEquals(List.of("historical-data: unavailable (boom)"), report.degradations());
    }

    @Test
    @DisplayName("a recent similar alert in the store suppresses the repeat")
    void recentSimilarAlertSuppresses() {
        InMemoryHistoricalAlertStore store = new InMemoryHistoricalAlertStore(CLOCK);
        store.record(new AlertRecord("old-1", PLAYER, "performance", AlertType.STATISTICAL_OUTLIER, Severity.HIGH,
            3.0, NOW.minus(Duration.ofDays(1)), NOW.minus(Duration.ofHours(1)), AlertStatus.NEW,
            null, null, null, 0)).block();
        Sources sources = outlierSources();
        sources.store = store;

        List<Alert> alerts = detect(config(), sources);

        assertEquals(List.of(AlertType.PATTERN_DEVIATION), alerts.stream().map(Alert::type).toList());
        assertTrue(alerts.get(0).relatedAlerts().contains("old-1"));
    }

    @Test
    @DisplayName("playoffs raise urgency and annotate recommendations")
    void highStakesPhase() {
        Sources sources = outlierSources().context(DetectionContext.forPhase(SeasonPhase.PLAYOFFS));

        Alert a = ofType(detect(config(), sources), AlertType.STATISTICAL_OUTLIER);

        assertEquals(100.0, a.urgency(), 1e-9);
        assertFalse(a.recommendations().isEmpty());
        for (Recommendation r : a.recommendations()) {
            assertTrue(r.description().endsWith(" (Adjusted for playoffs context)"), r.description());
        }
    }

    @Test
    @DisplayName("maxAlerts bounds the result to the most urgent alerts")
    void boundedResult() {
        List<Alert> alerts = detect(configBuilder().maxAlerts(1).build(), outlierSources());
        assertEquals(1, alerts.size());
        assertEquals(AlertType.STATISTICAL_OUTLIER, alerts.get(0).type());
    }

    @Test
    @DisplayName("trends() rolls up stored alerts of the timeframe")
    void trends() {
        InMemoryHistoricalAlertStore store = new InMemoryHistoricalAlertStore(CLOCK);
        store.record(new AlertRecord("a-1", PLAYER, "performance", AlertType.STATISTICAL_OUTLIER, Severity.HIGH,
            3.0, NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(2)), AlertStatus.NEW,
            null, null, null, 0)).block();
        store.record(new AlertRecord("a-2", PLAYER, "load", AlertType.STATISTICAL_OUTLIER, Severity.MEDIUM,
            2.2, NOW.minus(Duration.ofDays(40)), NOW.minus(Duration.ofDays(40)), AlertStatus.NEW,
            null, null, null, 0)).block();
        Sources sources = new Sources();
        sources.store = store;

        StepVerifier.create(engine(config(), sources).trends(Timeframe.WEEK))
            .assertNext(trend -> {
                assertEquals(Timeframe.WEEK, trend.period());
                assertEquals(1, trend.anomalyCount());
                assertEquals(1, trend.severityDistribution().get(Severity.HIGH));
            })
            .verifyComplete();
    }
}
