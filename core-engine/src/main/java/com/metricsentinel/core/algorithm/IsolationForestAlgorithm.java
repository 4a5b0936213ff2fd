package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.config.IsolationForestOptions;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;

import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * One-dimensional isolation forest.
 *
 * <p>
 * Each tree is grown on a random subsample of the window plus the candidate,
 * and only the branch that contains the candidate is followed, so the cost
 * per tree is proportional to the path length. Trees are re-seeded from
 * {@link IsolationForestOptions#getSeed()} on every call, which keeps scores
 * reproducible.
 * </p>
 *
 * <p>
 * The isolation score {@code s = 2^(−E[h] / c(ψ))} sits at 0.5 for points
 * that are as hard to isolate as an average point and approaches 1 for clear
 * outliers. It is mapped onto the common threshold scale as
 * {@code max(0, s − 0.5) · 20}.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestAlgorithm extends WindowAlgorithm {

    static final double SCORE_SCALE = 20.0;

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final IsolationForestOptions options;

    public IsolationForestAlgorithm(IsolationForestOptions options) {
        this.options = Objects.requireNonNull(options, "IsolationForestOptions must not be null");
    }

    @Override
    public Algorithm id() {
        return Algorithm.ISOLATION_FOREST;
    }

    @Override
    protected ScoreResult evaluate(ScoringWindow window, Sample candidate, DetectionConfig config) {
        double[] values = window.values();
        double mean = window.mean();
        if (values.length < 1) {
            return ScoreResult.of(0.0, false, mean);
        }

        // the candidate always takes one slot of the subsample
        int psi = Math.min(options.getSubsampleSize(), values.length + 1);
        int heightLimit = (int) Math.ceil(log2(psi));
        Random random = new Random(options.getSeed());
        double x = candidate.getValue();

        double totalPath = 0;
        for (int t = 0; t < options.getTrees(); t++) {
            double[] subsample = subsample(values, psi - 1, x, random);
            totalPath += pathLength(subsample, subsample.length, x, 0, heightLimit, random);
        }
        double meanPath = totalPath / options.getTrees();
        double isolation = Math.pow(2.0, -meanPath / averagePathLength(psi));
        double score = Math.max(0.0, isolation - 0.5) * SCORE_SCALE;

        return ScoreResult.evaluate(score, config.getThreshold(), mean)
                .withDetails(Map.of("isolationScore", isolation, "meanPathLength", meanPath,
                        "subsampleSize", psi));
    }

    // ---------------------------------------------------------------
    // Tree helpers
    // ---------------------------------------------------------------

    /**
     * Draw {@code k} values without replacement (partial Fisher-Yates) and
     * append the candidate.
     */
    private static double[] subsample(double[] values, int k, double candidate, Random random) {
        double[] pool = values.clone();
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(pool.length - i);
            double tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        double[] out = new double[k + 1];
        System.arraycopy(pool, 0, out, 0, k);
        out[k] = candidate;
        return out;
    }

    /**
     * Follow the candidate down one randomly grown tree. {@code data[0..size)}
     * is partitioned in place at each level.
     */
    private static double pathLength(double[] data, int size, double x, int depth, int heightLimit,
            Random random) {
        if (size <= 1 || depth >= heightLimit) {
            return depth + averagePathLength(size);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < size; i++) {
            min = Math.min(min, data[i]);
            max = Math.max(max, data[i]);
        }
        if (min == max) {
            return depth + averagePathLength(size);
        }

        double split = min + random.nextDouble() * (max - min);
        boolean goLeft = x < split;
        int kept = 0;
        for (int i = 0; i < size; i++) {
            if ((data[i] < split) == goLeft) {
                double tmp = data[kept];
                data[kept] = data[i];
                data[i] = tmp;
                kept++;
            }
        }
        return pathLength(data, kept, x, depth + 1, heightLimit, random);
    }

    /** Average path length of an unsuccessful BST search over {@code n} keys. */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static double log2(double v) {
        return Math.log(v) / Math.log(2.0);
    }
}
