package com.metricsentinel.core.window;

import com.metricsentinel.core.model.Sample;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of the samples that precede a candidate point.
 *
 * <p>
 * Mean and standard deviation are computed lazily with an exact two-pass
 * formula, unless the owner already tracks them incrementally and passes them
 * in through {@link #withMoments(List, double, double)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoringWindow {

    private final List<Sample> samples;
    private double[] values;
    private Double mean;
    private Double stdDev;

    private ScoringWindow(List<Sample> samples, Double mean, Double stdDev) {
        this.samples = List.copyOf(Objects.requireNonNull(samples, "samples must not be null"));
        this.mean = mean;
        this.stdDev = stdDev;
    }

    public static ScoringWindow of(List<Sample> samples) {
        return new ScoringWindow(samples, null, null);
    }

    /**
     * @param mean   precomputed mean of {@code samples}
     * @param stdDev precomputed population standard deviation of
     *               {@code samples}
     */
    public static ScoringWindow withMoments(List<Sample> samples, double mean, double stdDev) {
        return new ScoringWindow(samples, mean, stdDev);
    }

    public List<Sample> samples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public double[] values() {
        if (values == null) {
            values = Stats.values(samples);
        }
        return values.clone();
    }

    public double mean() {
        if (mean == null) {
            mean = Stats.mean(valuesRef());
        }
        return mean;
    }

    public double stdDev() {
        if (stdDev == null) {
            stdDev = Stats.stdDev(valuesRef(), mean());
        }
        return stdDev;
    }

    public Instant start() {
        return samples.isEmpty() ? null : samples.get(0).getTimestamp();
    }

    public Instant end() {
        return samples.isEmpty() ? null : samples.get(samples.size() - 1).getTimestamp();
    }

    private double[] valuesRef() {
        if (values == null) {
            values = Stats.values(samples);
        }
        return values;
    }

    @Override
    public String toString() {
        return "ScoringWindow{size=" + samples.size() + ", start=" + start() + ", end=" + end() + '}';
    }
}
