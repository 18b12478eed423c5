package com.anomalyplatform.detection.scoring;

import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.MetricSnapshot;
import com.anomalyplatform.common.stats.StatisticsCalculator;
import com.anomalyplatform.common.stats.SummaryStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Compares the newest 7-sample pattern with every complete 7-sample window of history.
 *
 * <p>The historical distribution is the list of scores of all sliding windows of
 * history. The current window is the last six historical snapshots plus the current
 * snapshot. The pattern is anomalous when it sits more than two standard deviations from
 * the historical mean; a zero-variance history never flags.
 */
public class PatternComparator {

    public static final int WINDOW_SIZE = 7;
    public static final int MIN_WINDOWS = 10;
    static final double DEVIATION_FACTOR = 2.0;

    private final PatternScorer scorer;

    public PatternComparator(PatternScorer scorer) {
        this.scorer = scorer;
    }

    /** Number of complete windows {@code history} yields. */
    public static int windowCount(HistoricalData history) {
        return Math.max(0, history.size() - WINDOW_SIZE + 1);
    }

    /**
     * @return empty when fewer than {@link #MIN_WINDOWS} windows could be scored or the
     *         current window has no score
     */
    public Optional<PatternComparison> compare(HistoricalData history, MetricSnapshot current) {
        List<MetricSnapshot> snapshots = history.snapshots();
        List<Double> scores = new ArrayList<>();
        for (int start = 0; start + WINDOW_SIZE <= snapshots.size(); start++) {
            OptionalDouble s = scorer.score(snapshots.subList(start, start + WINDOW_SIZE));
            s.ifPresent(scores::add);
        }
        if (scores.size() < MIN_WINDOWS) {
            return Optional.empty();
        }

        List<MetricSnapshot> currentWindow = new ArrayList<>(history.tail(WINDOW_SIZE - 1));
        currentWindow.add(current);
        OptionalDouble currentScore = scorer.score(currentWindow);
        if (currentScore.isEmpty()) {
            return Optional.empty();
        }

        SummaryStatistics stats = StatisticsCalculator.stats(scores);
        double value = currentScore.getAsDouble();
        double z = StatisticsCalculator.zScore(value, stats.mean(), stats.stddev());
        boolean anomalous = stats.stddev() > 0
            && Math.abs(value - stats.mean()) > DEVIATION_FACTOR * stats.stddev();
        return Optional.of(new PatternComparison(value, stats.mean(), stats.stddev(), scores.size(), z, anomalous));
    }
}
