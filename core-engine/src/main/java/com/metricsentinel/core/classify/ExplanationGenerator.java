package com.metricsentinel.core.classify;

import com.metricsentinel.core.model.Algorithm;

import java.util.Locale;

/**
 * Human-readable anomaly explanations.
 *
 * <p>
 * Every explanation names the metric, the direction and magnitude of the
 * deviation, and the algorithm with its score and threshold, e.g.
 * {@code "cpu_usage reading 95.00 is 90.0% above the expected 50.00 (Z-Score
 * score 12.31, threshold 2.50)"}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExplanationGenerator {

    private ExplanationGenerator() {
        // static utility
    }

    public static String explainPoint(String metricName, Algorithm algorithm, boolean contextual,
            double value, double expected, double score, double threshold) {
        Direction direction = Direction.of(value, expected);
        return String.format(Locale.ROOT, "%s reading %.2f is %s %s the expected %.2f%s (%s score %.2f, threshold %.2f)",
                metricName, value, magnitude(value, expected), direction.label(), expected,
                contextual ? " for this hour of day" : "",
                algorithm.displayName(), score, threshold);
    }

    public static String explainCollective(String metricName, Algorithm algorithm, int runLength,
            double peakValue, double expected, double peakScore, double threshold) {
        Direction direction = Direction.of(peakValue, expected);
        return String.format(Locale.ROOT,
                "%s stayed %s the expected level for %d consecutive points, peaking at %.2f (%s %s the expected %.2f; "
                        + "%s score %.2f, threshold %.2f)",
                metricName, direction.label(), runLength, peakValue, magnitude(peakValue, expected),
                direction.label(), expected, algorithm.displayName(), peakScore, threshold);
    }

    /** Relative deviation as a percentage, or the absolute difference when the expected value is ~0. */
    static String magnitude(double value, double expected) {
        double diff = Math.abs(value - expected);
        if (Math.abs(expected) > 1e-9) {
            return String.format(Locale.ROOT, "%.1f%%", diff / Math.abs(expected) * 100.0);
        }
        return String.format(Locale.ROOT, "%.2f", diff);
    }
}
