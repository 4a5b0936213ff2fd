package com.metricsentinel.core.window;

import com.metricsentinel.core.model.Sample;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Hour-of-day baseline over a window.
 *
 * <p>
 * Samples are grouped into 24 cohorts by their UTC hour. A cohort contributes
 * a baseline once it holds at least {@code minCohortSamples} samples; the
 * profile as a whole is usable once two or more cohorts qualify. Below that
 * there is not enough history to separate a seasonal component and callers
 * fall back to flat statistics.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalProfile {

    public static final int DEFAULT_MIN_COHORT_SAMPLES = 3;

    private static final int COHORTS = 24;

    private final double[] sums = new double[COHORTS];
    private final int[] counts = new int[COHORTS];
    private final int minCohortSamples;
    private final double overallMean;
    private final int qualifiedCohorts;

    private SeasonalProfile(List<Sample> samples, int minCohortSamples) {
        this.minCohortSamples = minCohortSamples;
        double total = 0;
        for (Sample s : samples) {
            int c = cohortOf(s.getTimestamp());
            sums[c] += s.getValue();
            counts[c]++;
            total += s.getValue();
        }
        this.overallMean = samples.isEmpty() ? 0.0 : total / samples.size();
        int qualified = 0;
        for (int count : counts) {
            if (count >= minCohortSamples) {
                qualified++;
            }
        }
        this.qualifiedCohorts = qualified;
    }

    public static SeasonalProfile of(List<Sample> samples) {
        return new SeasonalProfile(samples, DEFAULT_MIN_COHORT_SAMPLES);
    }

    public static SeasonalProfile of(List<Sample> samples, int minCohortSamples) {
        return new SeasonalProfile(samples, minCohortSamples);
    }

    public static int cohortOf(Instant timestamp) {
        return timestamp.atOffset(ZoneOffset.UTC).getHour();
    }

    public boolean isUsable() {
        return qualifiedCohorts >= 2;
    }

    public double overallMean() {
        return overallMean;
    }

    /**
     * @return the cohort mean for {@code timestamp}, or empty when the profile
     *         is unusable or the cohort has too little history
     */
    public OptionalDouble baselineFor(Instant timestamp) {
        int c = cohortOf(timestamp);
        if (!isUsable() || counts[c] < minCohortSamples) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sums[c] / counts[c]);
    }

    /**
     * Seasonal offset of the cohort relative to the overall mean; 0 when no
     * baseline is available.
     */
    public double offsetFor(Instant timestamp) {
        OptionalDouble baseline = baselineFor(timestamp);
        return baseline.isPresent() ? baseline.getAsDouble() - overallMean : 0.0;
    }

    @Override
    public String toString() {
        return "SeasonalProfile{qualifiedCohorts=" + qualifiedCohorts + ", overallMean=" + overallMean + '}';
    }
}
