package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * Tuning for the isolation-forest scorer.
 *
 * <p>
 * The seed is fixed per configuration so that scoring the same window twice
 * yields the same result; batch and streaming runs rely on this.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForestOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_TREES = 100;
    public static final int DEFAULT_SUBSAMPLE_SIZE = 256;
    public static final long DEFAULT_SEED = 42L;

    private static final IsolationForestOptions DEFAULTS =
            new IsolationForestOptions(DEFAULT_TREES, DEFAULT_SUBSAMPLE_SIZE, DEFAULT_SEED);

    private final int trees;
    private final int subsampleSize;
    private final long seed;

    /**
     * @throws InvalidConfigException if {@code trees < 1} or
     *                                {@code subsampleSize < 2}
     */
    public IsolationForestOptions(int trees, int subsampleSize, long seed) {
        if (trees < 1) {
            throw new InvalidConfigException("isolation forest 'trees' must be >= 1, got: " + trees);
        }
        if (subsampleSize < 2) {
            throw new InvalidConfigException(
                    "isolation forest 'subsampleSize' must be >= 2, got: " + subsampleSize);
        }
        this.trees = trees;
        this.subsampleSize = subsampleSize;
        this.seed = seed;
    }

    public static IsolationForestOptions defaults() {
        return DEFAULTS;
    }

    public int getTrees() {
        return trees;
    }

    public int getSubsampleSize() {
        return subsampleSize;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IsolationForestOptions that))
            return false;
        return trees == that.trees && subsampleSize == that.subsampleSize && seed == that.seed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(trees, subsampleSize, seed);
    }

    @Override
    public String toString() {
        return "IsolationForestOptions{trees=" + trees + ", subsampleSize=" + subsampleSize
                + ", seed=" + seed + '}';
    }
}
