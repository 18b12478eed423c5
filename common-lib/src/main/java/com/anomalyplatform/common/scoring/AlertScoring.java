package com.anomalyplatform.common.scoring;

import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.model.MetricCategory;

/**
 * Scoring formulas that turn a finding's strength into alert severity, confidence,
 * false-positive probability and urgency.
 *
 * <p>Every method takes the absolute strength {@code |z|}, so callers may pass a signed
 * deviation. All percentages returned are within [0,100].
 *
 * <pre>
 *   severity    z·weight  &gt; 4 critical, &gt; 3 high, &gt; 2 medium, else low
 *   confidence  clamp(50 + 10z, 20, 95) · reliability   (−5 on a degraded context)
 *   fpp         max(5, 25 − 5z + 25·(1 − reliability))
 *   urgency     min(100, min(100, 25z) · categoryFactor)
 * </pre>
 */
public final class AlertScoring {

    static final double CRITICAL_CUTOFF = 4.0;
    static final double HIGH_CUTOFF     = 3.0;
    static final double MEDIUM_CUTOFF   = 2.0;

    static final double CONFIDENCE_BASE  = 50.0;
    static final double CONFIDENCE_SLOPE = 10.0;
    static final double CONFIDENCE_FLOOR = 20.0;
    static final double CONFIDENCE_CAP   = 95.0;
    static final double DEGRADED_CONTEXT_PENALTY = 5.0;

    static final double FPP_BASE        = 25.0;
    static final double FPP_SLOPE       = 5.0;
    static final double FPP_FLOOR       = 5.0;
    static final double FPP_UNRELIABLE  = 25.0;

    static final double URGENCY_SLOPE   = 25.0;
    static final double ANOMALY_SCORE_SLOPE = 20.0;

    // caps infinite strengths; far beyond every cutoff
    static final double MAX_STRENGTH = 1_000.0;

    private AlertScoring() {}

    public static Severity severity(double z, double metricWeight) {
        double adjusted = Math.abs(z) * sanitizeUnit(metricWeight);
        if (adjusted > CRITICAL_CUTOFF) return Severity.CRITICAL;
        if (adjusted > HIGH_CUTOFF)     return Severity.HIGH;
        if (adjusted > MEDIUM_CUTOFF)   return Severity.MEDIUM;
        return Severity.LOW;
    }

    public static double confidence(double z, double reliability, boolean degradedContext) {
        double base = clamp(CONFIDENCE_BASE + strength(z) * CONFIDENCE_SLOPE, CONFIDENCE_FLOOR, CONFIDENCE_CAP);
        double scaled = base * sanitizeUnit(reliability);
        if (degradedContext) scaled -= DEGRADED_CONTEXT_PENALTY;
        return clampPercent(scaled);
    }

    public static double falsePositiveProbability(double z, double reliability) {
        double raw = FPP_BASE - strength(z) * FPP_SLOPE + FPP_UNRELIABLE * (1.0 - sanitizeUnit(reliability));
        return clampPercent(Math.max(FPP_FLOOR, raw));
    }

    public static double urgency(double z, MetricCategory category) {
        double base = Math.min(100.0, strength(z) * URGENCY_SLOPE);
        double factor = category == null ? 1.0 : category.urgencyFactor();
        return clampPercent(Math.round(base * factor));
    }

    /** Context-driven urgency scaling, e.g. ×1.2 during the playoffs. */
    public static double adjustUrgency(double urgency, double factor) {
        return clampPercent(Math.round(urgency * factor));
    }

    /** Finding strength on a 0–100 scale. */
    public static double anomalyScore(double z) {
        return clampPercent(strength(z) * ANOMALY_SCORE_SLOPE);
    }

    public static double clampPercent(double v) {
        if (Double.isNaN(v)) return 0.0;
        return clamp(v, 0.0, 100.0);
    }

    private static double strength(double z) {
        if (Double.isNaN(z)) return 0.0;
        return Math.min(Math.abs(z), MAX_STRENGTH);
    }

    private static double sanitizeUnit(double v) {
        if (Double.isNaN(v)) return 0.0;
        return clamp(v, 0.0, 1.0);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
