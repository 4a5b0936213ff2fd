package com.metricsentinel.core.config;

import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sensitivity;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration for one detection run or one streaming
 * detector.
 *
 * <p>
 * {@link #getThreshold()} returns the effective cutoff: the explicit override
 * when one was given, otherwise the value derived from
 * {@link #getSensitivity()}. Algorithm-specific tuning lives in separate
 * option objects so that each scorer only sees the fields it understands.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder()}, {@link #batchDefaults()} or
 * {@link #streamingDefaults()}. The builder validates every field at
 * {@link Builder#build()} time and reports all problems in one
 * {@link InvalidConfigException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Algorithm algorithm;
    private final Sensitivity sensitivity;
    private final int windowSize;
    private final int minSamples;
    private final boolean enableContextual;
    private final boolean enableCollective;
    private final boolean enableRealtime;
    private final Double thresholdOverride;
    private final IsolationForestOptions isolationForest;
    private final SeasonalEsdOptions seasonalEsd;
    private final EnsembleOptions ensemble;

    private DetectionConfig(Builder b) {
        this.algorithm = b.algorithm;
        this.sensitivity = b.sensitivity;
        this.windowSize = b.windowSize;
        this.minSamples = b.minSamples;
        this.enableContextual = b.enableContextual;
        this.enableCollective = b.enableCollective;
        this.enableRealtime = b.enableRealtime;
        this.thresholdOverride = b.threshold;
        this.isolationForest = b.isolationForest;
        this.seasonalEsd = b.seasonalEsd;
        this.ensemble = b.ensemble;
    }

    // ---------------------------------------------------------------
    // Presets
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for one-shot analysis of a historical window: ensemble, medium
     * sensitivity, window 100, 20 warm-up samples.
     */
    public static DetectionConfig batchDefaults() {
        return builder().build();
    }

    /**
     * Defaults for a streaming detector: modified Z-score, medium sensitivity,
     * window 50, 10 warm-up samples.
     */
    public static DetectionConfig streamingDefaults() {
        return builder()
                .algorithm(Algorithm.MODIFIED_ZSCORE)
                .windowSize(50)
                .minSamples(10)
                .enableRealtime(true)
                .build();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        Builder b = new Builder()
                .algorithm(algorithm)
                .sensitivity(sensitivity)
                .windowSize(windowSize)
                .minSamples(minSamples)
                .enableContextual(enableContextual)
                .enableCollective(enableCollective)
                .enableRealtime(enableRealtime)
                .isolationForest(isolationForest)
                .seasonalEsd(seasonalEsd)
                .ensemble(ensemble);
        b.threshold = thresholdOverride;
        return b;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public Sensitivity getSensitivity() {
        return sensitivity;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public boolean isEnableContextual() {
        return enableContextual;
    }

    public boolean isEnableCollective() {
        return enableCollective;
    }

    /**
     * Usage hint only: whether this configuration targets a streaming
     * detector. It does not change any scoring behaviour.
     */
    public boolean isEnableRealtime() {
        return enableRealtime;
    }

    /**
     * @return the effective threshold; always &gt; 0
     */
    public double getThreshold() {
        return thresholdOverride != null ? thresholdOverride : sensitivity.threshold();
    }

    public boolean isThresholdOverridden() {
        return thresholdOverride != null;
    }

    public IsolationForestOptions getIsolationForest() {
        return isolationForest;
    }

    public SeasonalEsdOptions getSeasonalEsd() {
        return seasonalEsd;
    }

    public EnsembleOptions getEnsemble() {
        return ensemble;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionConfig}.
     *
     * <p>
     * {@link #build()} enforces {@code windowSize > 0},
     * {@code 0 < minSamples <= windowSize} and a finite positive threshold
     * override.
     * </p>
     */
    public static class Builder {
        private Algorithm algorithm = Algorithm.ENSEMBLE;
        private Sensitivity sensitivity = Sensitivity.MEDIUM;
        private int windowSize = 100;
        private int minSamples = 20;
        private boolean enableContextual;
        private boolean enableCollective;
        private boolean enableRealtime;
        private Double threshold;
        private IsolationForestOptions isolationForest = IsolationForestOptions.defaults();
        private SeasonalEsdOptions seasonalEsd = SeasonalEsdOptions.defaults();
        private EnsembleOptions ensemble = EnsembleOptions.defaults();

        public Builder algorithm(Algorithm v) {
            this.algorithm = v;
            return this;
        }

        /**
         * @throws InvalidConfigException if {@code id} is not a known algorithm
         */
        public Builder algorithm(String id) {
            this.algorithm = Algorithm.fromId(id);
            return this;
        }

        public Builder sensitivity(Sensitivity v) {
            this.sensitivity = v;
            return this;
        }

        /**
         * @throws InvalidConfigException if {@code id} is not a known sensitivity
         */
        public Builder sensitivity(String id) {
            this.sensitivity = Sensitivity.fromId(id);
            return this;
        }

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder minSamples(int v) {
            this.minSamples = v;
            return this;
        }

        public Builder enableContextual(boolean v) {
            this.enableContextual = v;
            return this;
        }

        public Builder enableCollective(boolean v) {
            this.enableCollective = v;
            return this;
        }

        public Builder enableRealtime(boolean v) {
            this.enableRealtime = v;
            return this;
        }

        /** Override the sensitivity-derived threshold. */
        public Builder threshold(double v) {
            this.threshold = v;
            return this;
        }

        /** Drop any override and derive the threshold from sensitivity again. */
        public Builder clearThreshold() {
            this.threshold = null;
            return this;
        }

        public Builder isolationForest(IsolationForestOptions v) {
            this.isolationForest = v;
            return this;
        }

        public Builder seasonalEsd(SeasonalEsdOptions v) {
            this.seasonalEsd = v;
            return this;
        }

        public Builder ensemble(EnsembleOptions v) {
            this.ensemble = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectionConfig}
         * @throws InvalidConfigException if any value is invalid
         */
        public DetectionConfig build() {
            List<String> errors = new ArrayList<>();

            if (algorithm == null) {
                errors.add("'algorithm' is required");
            }
            if (sensitivity == null) {
                errors.add("'sensitivity' is required");
            }
            if (windowSize <= 0) {
                errors.add("'windowSize' must be > 0, got: " + windowSize);
            }
            if (minSamples <= 0) {
                errors.add("'minSamples' must be > 0, got: " + minSamples);
            }
            if (windowSize > 0 && minSamples > windowSize) {
                errors.add("'minSamples' (" + minSamples + ") must be <= 'windowSize' (" + windowSize + ")");
            }
            if (threshold != null && !(threshold > 0 && Double.isFinite(threshold))) {
                errors.add("'threshold' must be a finite value > 0, got: " + threshold);
            }
            if (isolationForest == null || seasonalEsd == null || ensemble == null) {
                errors.add("algorithm options must not be null");
            }

            if (!errors.isEmpty()) {
                throw new InvalidConfigException(
                        "Invalid DetectionConfig: " + String.join("; ", errors));
            }
            return new DetectionConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionConfig that))
            return false;
        return windowSize == that.windowSize
                && minSamples == that.minSamples
                && enableContextual == that.enableContextual
                && enableCollective == that.enableCollective
                && enableRealtime == that.enableRealtime
                && algorithm == that.algorithm
                && sensitivity == that.sensitivity
                && Objects.equals(thresholdOverride, that.thresholdOverride)
                && isolationForest.equals(that.isolationForest)
                && seasonalEsd.equals(that.seasonalEsd)
                && ensemble.equals(that.ensemble);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, sensitivity, windowSize, minSamples,
                enableContextual, enableCollective, enableRealtime, thresholdOverride,
                isolationForest, seasonalEsd, ensemble);
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "algorithm=" + algorithm.id() +
                ", sensitivity=" + sensitivity.id() +
                ", threshold=" + getThreshold() +
                ", windowSize=" + windowSize +
                ", minSamples=" + minSamples +
                ", contextual=" + enableContextual +
                ", collective=" + enableCollective +
                ", realtime=" + enableRealtime +
                '}';
    }
}
