package com.metricsentinel.core.classify;

import com.metricsentinel.core.model.Severity;

/**
 * Maps a score to a {@link Severity} by its ratio to the effective threshold.
 *
 * <pre>
 *   ratio &lt; 1.5          → low
 *   1.5 ≤ ratio &lt; 2.5    → medium
 *   2.5 ≤ ratio &lt; 4.0    → high
 *   ratio ≥ 4.0          → critical
 * </pre>
 *
 * <p>
 * Ratios below 1 only occur for collective runs and ensemble consensus; they
 * classify as low.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    public static final double MEDIUM_RATIO = 1.5;
    public static final double HIGH_RATIO = 2.5;
    public static final double CRITICAL_RATIO = 4.0;

    private SeverityClassifier() {
        // static utility
    }

    /**
     * @param score              algorithm score, ≥ 0
     * @param effectiveThreshold threshold the score was compared against, &gt; 0
     * @return the severity for {@code score / effectiveThreshold}
     * @throws IllegalArgumentException if {@code effectiveThreshold} is not
     *                                  positive
     */
    public static Severity classify(double score, double effectiveThreshold) {
        if (!(effectiveThreshold > 0)) {
            throw new IllegalArgumentException("effectiveThreshold must be > 0, got: " + effectiveThreshold);
        }
        return fromRatio(score / effectiveThreshold);
    }

    public static Severity fromRatio(double ratio) {
        if (ratio >= CRITICAL_RATIO) {
            return Severity.CRITICAL;
        }
        if (ratio >= HIGH_RATIO) {
            return Severity.HIGH;
        }
        if (ratio >= MEDIUM_RATIO) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
