package com.metricsentinel.core.classify;

import com.metricsentinel.core.model.AnomalyContext;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.model.Trend;
import com.metricsentinel.core.window.Stats;

import java.util.List;

/**
 * Derives the {@link AnomalyContext} attached to every anomaly from the
 * samples that preceded it.
 *
 * @since 1.0.0
 */
public final class ContextAnalyzer {

    /** Relative change between halves that counts as a trend. */
    static final double TREND_BAND = 0.1;

    /** Squared coefficient of variation below which history counts as stable. */
    static final double STABLE_VARIATION = 0.1;

    private ContextAnalyzer() {
        // static utility
    }

    public static AnomalyContext analyze(String metricName, List<Sample> history, boolean seasonality) {
        MetricType type = MetricType.resolve(metricName);
        Trend trend = trend(history);
        return new AnomalyContext(metricName, seasonality, trend, type.relatedMetrics(),
                type.businessContext(), historicalPattern(history, trend));
    }

    /**
     * Compare the mean of the first half of {@code history} with the mean of
     * the second half.
     */
    public static Trend trend(List<Sample> history) {
        if (history.size() < 2) {
            return Trend.STABLE;
        }
        double[] values = Stats.values(history);
        int mid = values.length / 2;
        double first = 0;
        for (int i = 0; i < mid; i++) {
            first += values[i];
        }
        first /= mid;
        double second = 0;
        for (int i = mid; i < values.length; i++) {
            second += values[i];
        }
        second /= values.length - mid;

        if (first == 0.0) {
            return second > 0 ? Trend.INCREASING : second < 0 ? Trend.DECREASING : Trend.STABLE;
        }
        double change = (second - first) / Math.abs(first);
        if (change > TREND_BAND) {
            return Trend.INCREASING;
        }
        if (change < -TREND_BAND) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    public static String historicalPattern(List<Sample> history, Trend trend) {
        if (history.isEmpty()) {
            return "Insufficient history";
        }
        double[] values = Stats.values(history);
        double mean = Stats.mean(values);
        double stdDev = Stats.stdDev(values, mean);
        double variation = mean == 0.0
                ? (stdDev == 0.0 ? 0.0 : Double.POSITIVE_INFINITY)
                : (stdDev * stdDev) / (mean * mean);

        if (variation < STABLE_VARIATION) {
            return "Stable pattern";
        }
        return switch (trend) {
            case INCREASING -> "Upward trend";
            case DECREASING -> "Downward trend";
            default -> "Variable pattern";
        };
    }
}
