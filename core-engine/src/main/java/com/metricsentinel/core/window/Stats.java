package com.metricsentinel.core.window;

import com.metricsentinel.core.model.Sample;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics over sample windows.
 *
 * <p>
 * Quantiles use linear interpolation between closest ranks (R-7, the
 * spreadsheet convention), so the median of an even-sized window is the mean
 * of its two middle values.
 * </p>
 *
 * @since 1.0.0
 */
public final class Stats {

    /** Relative spread below which a window is treated as constant. */
    static final double DEGENERATE_EPSILON = 1e-9;

    private Stats() {
        // static utility
    }

    public static double[] values(List<Sample> samples) {
        double[] out = new double[samples.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = samples.get(i).getValue();
        }
        return out;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population standard deviation around {@code mean}. */
    public static double stdDev(double[] values, double mean) {
        if (values.length == 0) {
            return 0.0;
        }
        double sumSq = 0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }

    /**
     * @param values input values (not modified)
     * @param p      percentile in (0, 100]
     * @return interpolated percentile, or 0 for an empty array
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /** Median absolute deviation around {@code median}. */
    public static double mad(double[] values, double median) {
        double[] deviations = Arrays.stream(values).map(v -> Math.abs(v - median)).toArray();
        return median(deviations);
    }

    /**
     * @return {@code true} when {@code spread} is negligible relative to
     *         {@code center}, i.e. the window is effectively constant
     */
    public static boolean isDegenerate(double spread, double center) {
        return spread <= DEGENERATE_EPSILON * Math.max(1.0, Math.abs(center));
    }
}
