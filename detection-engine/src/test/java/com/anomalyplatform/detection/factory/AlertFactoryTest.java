package com.anomalyplatform.detection.factory;

import com.anomalyplatform.common.alert.AffectedEntity;
import com.anomalyplatform.common.alert.Alert;
import com.anomalyplatform.common.alert.AlertRecord;
import com.anomalyplatform.common.alert.CauseCategory;
import com.anomalyplatform.common.alert.HistoricalComparison;
import com.anomalyplatform.common.alert.ImpactLevel;
import com.anomalyplatform.common.alert.ImpactSeverity;
import com.anomalyplatform.common.alert.PossibleCause;
import com.anomalyplatform.common.alert.Priority;
import com.anomalyplatform.common.alert.Recommendation;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.model.ContextEvent;
import com.anomalyplatform.common.model.CurrentData;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.EnvironmentalFactor;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.ImpactDirection;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.model.SeasonPhase;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.provider.HistoricalAlertStore;
import com.anomalyplatform.detection.store.InMemoryHistoricalAlertStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.anomalyplatform.detection.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class AlertFactoryTest {

    private final AlertFactory factory = new AlertFactory(config(), new InMemoryHistoricalAlertStore(CLOCK), CLOCK);

    private static RawFinding finding(String metricKey, double z, double current, double expected) {
        return new RawFinding(DetectorKind.STATISTICAL, DetectorKind.STATISTICAL.alertType(), metricKey,
            MetricCategory.PERFORMANCE, 1.0, z, 1.0, null, current, expected,
            (current - expected) / expected * 100.0, 1.5, 90, 64, NOW, WINDOW, List.of(), Map.of());
    }

    private Alert build(RawFinding f) {
        return build(f, DetectionContext.defaults(), false);
    }

    private Alert build(RawFinding f, DetectionContext ctx, boolean degraded) {
        DetectionInput input = new DetectionInput(PLAYER, WINDOW, HistoricalData.empty(), current(values()), ctx, degraded, null);
        return factory.build(f, input, HistoricalComparison.empty());
    }

    @Nested
    @DisplayName("identity and wording")
    class Identity {

        @Test
        @DisplayName("the id depends only on type, entity, metric and observation time")
        void deterministicId() {
            Alert a = build(finding("performance", 3.2, 96, 80));
            Alert b = build(finding("performance", 3.9, 99, 80));
            Alert other = build(finding("load", 3.2, 96, 80));

            assertEquals(a.id(), b.id());
            assertNotEquals(a.id(), other.id());
            assertTrue(a.id().startsWith("statistical_outlier-"), a.id());
        }

        @Test
        void titleAndDescription() {
            Alert a = build(finding("performance", 3.2, 96, 80));
            assertEquals("Statistical Anomaly in performance", a.title());
            assertEquals("performance value (96.00) is 3.20 standard deviations from the expected value (80.00)",
                a.description());
        }

        @Test
        @DisplayName("a player's team is listed as a secondary affected entity")
        void affectedEntities() {
            assertEquals(List.of(
                    new AffectedEntity(EntityType.PLAYER, "p1", "Player p1", null, ImpactLevel.HIGH),
                    new AffectedEntity(EntityType.TEAM, "t1", "Wolves", null, ImpactLevel.MEDIUM)),
                build(finding("performance", 3.2, 96, 80)).affectedEntities());

            EntityRef team = EntityRef.of(EntityType.TEAM, "t1");
            DetectionInput teamInput = new DetectionInput(team, WINDOW, HistoricalData.empty(),
                new CurrentData(team, "t1", "Wolves", MetricSnapshot.of(NOW, values())),
                DetectionContext.defaults(), false, null);
            assertEquals(1, AlertFactory.affectedEntities(teamInput).size());
        }
    }

    @Nested
    @DisplayName("scores")
    class Scores {

        @Test
        void fromStrength() {
            Alert a = build(finding("performance", 3.2, 96, 80));
            assertEquals(Severity.HIGH, a.severity());
            assertEquals(82.0, a.confidence(), 1e-9);
            assertEquals(9.0, a.falsePositiveProbability(), 1e-9);
            assertEquals(88.0, a.urgency(), 1e-9);
            assertEquals(NOW, a.detectedAt());
        }

        @Test
        @DisplayName("a degraded context costs 5 confidence points")
        void degradedContext() {
            assertEquals(77.0, build(finding("performance", 3.2, 96, 80), DetectionContext.defaults(), true)
                .confidence(), 1e-9);
        }

        @Test
        @DisplayName("critical alerts lead with an urgent escalation")
        void criticalEscalation() {
            Alert a = build(finding("performance", 4.5, 102.5, 80));
            assertEquals(Severity.CRITICAL, a.severity());
            Recommendation first = a.recommendations().get(0);
            assertEquals(Priority.URGENT, first.priority());
            assertEquals("Escalate to medical and performance staff", first.action());
        }
    }

    @Nested
    @DisplayName("causes")
    class Causes {

        @Test
        void loadIncreasePointsAtTraining() {
            PossibleCause top = build(finding("load", 3.2, 96, 80)).possibleCauses().get(0);
            assertEquals("Training intensity increase", top.cause());
            assertEquals(CauseCategory.TRAINING, top.category());
            assertEquals(60.0, top.probability(), 1e-9);
        }

        @Test
        @DisplayName("context adds environmental, psychological and event causes, ordered by probability")
        void contextCauses() {
            DetectionContext base = DetectionContext.forPhase(SeasonPhase.REGULAR);
            DetectionContext ctx = new DetectionContext(base.seasonPhase(),
                List.of(new ContextEvent("travel", "Long-haul away trip", NOW.minus(Duration.ofDays(2)),
                        ImpactDirection.NEGATIVE, 0.8),
                    new ContextEvent("game", "Friendly", NOW, ImpactDirection.NEUTRAL, 0.2)),
                List.of(new EnvironmentalFactor("altitude", "1800m", ImpactDirection.NEGATIVE, 0.7)),
                base.teamState(), base.playerState(), base.workloadContext());

            List<PossibleCause> causes = build(finding("load", 3.2, 96, 80), ctx, false).possibleCauses();

            assertEquals(List.of(CauseCategory.TRAINING, CauseCategory.ENVIRONMENTAL, CauseCategory.EXTERNAL),
                causes.stream().map(PossibleCause::category).toList());
            assertEquals("Recent travel: Long-haul away trip", causes.get(2).cause());
            assertEquals(40.0, causes.get(2).probability(), 1e-9);
        }
    }

    @Test
    @DisplayName("a performance drop over 20% asks for an evaluation")
    void performanceDropRecommendation() {
        List<String> actions = build(finding("performance", -3.2, 60, 80)).recommendations().stream()
            .map(Recommendation::action).toList();
        assertTrue(actions.contains("Performance evaluation"), actions::toString);
        assertTrue(actions.contains("Increase monitoring frequency"), actions::toString);
    }

    @Test
    @DisplayName("impact severity follows the percentage deviation")
    void impact() {
        assertEquals(ImpactSeverity.LOW, build(finding("performance", 3.2, 96, 80)).impactAssessment().immediate().severity());
        assertEquals(ImpactSeverity.HIGH, build(finding("load", 3.2, 130, 80)).impactAssessment().immediate().severity());
    }

    @Nested
    @DisplayName("historical comparison")
    class Comparison {

        @Test
        void attachedFromTheStore() {
            InMemoryHistoricalAlertStore store = new InMemoryHistoricalAlertStore(CLOCK);
            store.record(record("old-1", "performance", 3.0, NOW.minus(Duration.ofDays(3)), null)).block();
            AlertFactory withHistory = new AlertFactory(config(), store, CLOCK);

            StepVerifier.create(withHistory.create(finding("performance", 3.2, 96, 80),
                    input(HistoricalData.empty(), current(values()))))
                .assertNext(a -> assertEquals("old-1", a.historicalComparison().similarAnomalies().get(0).id()))
                .verifyComplete();
        }

        @Test
        @DisplayName("a failing store yields an empty comparison, not an error")
        void storeFailure() {
            HistoricalAlertStore broken = new HistoricalAlertStore() {
                @Override
                public Mono<HistoricalComparison> similarAlerts(String metricKey, double deviation) {
                    return Mono.error(new IllegalStateException("store down"));
                }

                @Override
                public Mono<List<AlertRecord>> recentAlerts(EntityRef entity, Instant since) {
                    return Mono.just(List.of());
                }

                @Override
                public Mono<List<AlertRecord>> alertsBetween(Instant from, Instant to) {
                    return Mono.just(List.of());
                }
            };

            StepVerifier.create(new AlertFactory(config(), broken, CLOCK)
                    .create(finding("performance", 3.2, 96, 80), input(HistoricalData.empty(), current(values()))))
                .assertNext(a -> assertEquals(HistoricalComparison.empty(), a.historicalComparison()))
                .verifyComplete();
        }
    }
}
