package com.anomalyplatform.common.stats;

public record ExpectedTrend(double slope, TrendDirection direction) {

    public static ExpectedTrend of(double slope) {
        return new ExpectedTrend(slope, TrendDirection.ofSlope(slope));
    }

    public static ExpectedTrend flat() {
        return new ExpectedTrend(0.0, TrendDirection.STABLE);
    }
}
