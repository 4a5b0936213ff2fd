package com.metricsentinel.core.window;

/**
 * Incremental mean and population variance over a sliding window.
 *
 * <p>
 * Uses Welford's update for {@link #add(double)} and its inverse for
 * {@link #remove(double)}, so each step is O(1). Repeated add/remove cycles
 * accumulate rounding error; owners call {@link #reset(double[])} from time to
 * time to re-anchor on an exact two-pass computation.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunningStatistics {

    private long count;
    private double mean;
    private double m2;

    public void add(double x) {
        count++;
        double delta = x - mean;
        mean += delta / count;
        m2 += delta * (x - mean);
    }

    /**
     * Remove a value that was previously added.
     *
     * @param x the value leaving the window
     * @throws IllegalStateException if the statistics are empty
     */
    public void remove(double x) {
        if (count == 0) {
            throw new IllegalStateException("Cannot remove from empty statistics");
        }
        if (count == 1) {
            clear();
            return;
        }
        double oldMean = mean;
        count--;
        mean = oldMean - (x - oldMean) / count;
        m2 -= (x - oldMean) * (x - mean);
        if (m2 < 0) {
            m2 = 0;
        }
    }

    /**
     * Replace the accumulated state with an exact computation over
     * {@code values}.
     */
    public void reset(double[] values) {
        clear();
        if (values.length == 0) {
            return;
        }
        double exactMean = Stats.mean(values);
        double sumSq = 0;
        for (double v : values) {
            double d = v - exactMean;
            sumSq += d * d;
        }
        this.count = values.length;
        this.mean = exactMean;
        this.m2 = sumSq;
    }

    public void clear() {
        count = 0;
        mean = 0;
        m2 = 0;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return count > 0 ? m2 / count : 0.0;
    }

    public double getStdDev() {
        return Math.sqrt(getVariance());
    }

    @Override
    public String toString() {
        return String.format("RunningStatistics{count=%d, mean=%.4f, stddev=%.4f}",
                count, mean, getStdDev());
    }
}
