package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.config.MetricGroup;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.stats.StatisticsCalculator;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;
import com.anomalyplatform.detection.scoring.GroupScore;
import com.anomalyplatform.detection.scoring.MultivariateScorer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores every configured metric group with {@link MultivariateScorer}. A score above 70
 * raises a medium finding, above 85 a high one.
 *
 * <p>Strength maps the score onto the z scale as {@code (score − 30) / 20}, so a group at
 * the flag threshold lands at z = 2.
 */
@Component
public class MultivariateAnomalyDetector implements AnomalyDetector {

    static final double EXPECTED_SCORE = 30.0;
    static final double SCORE_UNIT = 20.0;

    private final DetectionConfig config;

    public MultivariateAnomalyDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorKind kind() { return DetectorKind.MULTIVARIATE; }

    @Override
    public List<RawFinding> detect(DetectionInput input) {
        MetricSnapshot current = input.requireCurrent(detectorName());
        if (input.history().size() < StatisticsCalculator.MIN_SAMPLES) {
            throw new InsufficientDataException(detectorName(), input.history().size(), StatisticsCalculator.MIN_SAMPLES);
        }

        List<RawFinding> findings = new ArrayList<>();
        for (MetricGroup group : config.metricGroups()) {
            Optional<GroupScore> scored = MultivariateScorer.score(group, input.history(), current);
            if (scored.isEmpty() || !scored.get().isFlagged()) continue;
            findings.add(finding(input, scored.get()));
        }
        return findings;
    }

    private RawFinding finding(DetectionInput input, GroupScore score) {
        MetricGroup group = score.group();
        double z = (score.score() - EXPECTED_SCORE) / SCORE_UNIT;
        Severity severity = score.isEscalated() ? Severity.HIGH : Severity.MEDIUM;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("group", group.label());
        details.put("distance", score.distance());
        details.put("dimensions", score.means().size());

        return new RawFinding(
            kind(), kind().alertType(), group.name(), group.category(), group.weight(),
            z, 1.0, severity,
            score.score(), EXPECTED_SCORE,
            (score.score() - EXPECTED_SCORE) / EXPECTED_SCORE * 100.0,
            MultivariateScorer.FLAG_THRESHOLD,
            StatisticsCalculator.significance(z),
            score.score(),
            input.observedAt(), input.window(),
            List.of(), details);
    }
}
