package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.config.MetricGroup;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.MetricCategory;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.MetricSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.anomalyplatform.detection.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MultivariateScorerTest {

    private static final MetricGroup GROUP =
        MetricGroup.of(MetricCategory.LOAD, MetricName.LOAD, MetricName.RECOVERY, MetricName.READINESS);

    private static final HistoricalData HISTORY =
        constant(20, values(MetricName.LOAD, 60, MetricName.RECOVERY, 70, MetricName.READINESS, 65));

    @Test
    @DisplayName("distance 5 → score 25, not flagged")
    void quietGroup() {
        GroupScore s = MultivariateScorer.score(GROUP, HISTORY,
            MetricSnapshot.of(NOW, values(MetricName.LOAD, 63, MetricName.RECOVERY, 74, MetricName.READINESS, 65)))
            .orElseThrow();

        assertEquals(5.0, s.distance(), 1e-9);
        assertEquals(25.0, s.score(), 1e-9);
        assertFalse(s.isFlagged());
        assertEquals(3, s.means().size());
    }

    @Test
    @DisplayName("score above 85 escalates; score is capped at 100")
    void escalatedAndCapped() {
        GroupScore high = MultivariateScorer.score(GROUP, HISTORY,
            MetricSnapshot.of(NOW, values(MetricName.LOAD, 78, MetricName.RECOVERY, 70, MetricName.READINESS, 65)))
            .orElseThrow();
        assertEquals(90.0, high.score(), 1e-9);
        assertTrue(high.isFlagged());
        assertTrue(high.isEscalated());

        GroupScore capped = MultivariateScorer.score(GROUP, HISTORY,
            MetricSnapshot.of(NOW, values(MetricName.LOAD, 160, MetricName.RECOVERY, 70, MetricName.READINESS, 65)))
            .orElseThrow();
        assertEquals(100.0, capped.score(), 1e-9);
    }

    @Test
    @DisplayName("dimensions missing from the snapshot are left out")
    void partialDimensions() {
        GroupScore s = MultivariateScorer.score(GROUP, HISTORY,
            MetricSnapshot.of(NOW, values(MetricName.LOAD, 63, MetricName.RECOVERY, 74)))
            .orElseThrow();
        assertEquals(2, s.current().size());
        assertFalse(s.current().containsKey(MetricName.READINESS));
    }

    @Test
    @DisplayName("fewer than two usable dimensions → no score")
    void singleDimension() {
        Optional<GroupScore> s = MultivariateScorer.score(GROUP, HISTORY,
            MetricSnapshot.of(NOW, values(MetricName.LOAD, 90)));
        assertTrue(s.isEmpty());
    }
}
