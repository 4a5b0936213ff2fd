package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * Describes one streaming detector as declared in {@code detectors.yml}.
 *
 * <p>
 * Every field except {@code metric} is optional; unset fields fall back to
 * {@link DetectionConfig#streamingDefaults()}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Metric the detector is bound to, e.g. {@code cpu_usage}. */
    private String metric;

    /** Algorithm id, e.g. {@code modified_zscore}. */
    private String algorithm;

    /** Sensitivity id: low, medium, high or critical. */
    private String sensitivity;

    private Integer windowSize;
    private Integer minSamples;
    private Boolean enableContextual;
    private Boolean enableCollective;

    /** Explicit threshold; overrides the sensitivity-derived one. */
    private Double threshold;

    /**
     * Overlay this profile on the streaming defaults.
     *
     * @return the detection configuration
     * @throws InvalidConfigException if the metric is missing or any field is
     *                                invalid
     */
    public DetectionConfig toDetectionConfig() {
        if (metric == null || metric.isBlank()) {
            throw new InvalidConfigException("'metric' is required");
        }
        DetectionConfig.Builder b = DetectionConfig.streamingDefaults().toBuilder();
        if (algorithm != null) {
            b.algorithm(algorithm);
        }
        if (sensitivity != null) {
            b.sensitivity(sensitivity);
        }
        if (windowSize != null) {
            b.windowSize(windowSize);
        }
        if (minSamples != null) {
            b.minSamples(minSamples);
        }
        if (enableContextual != null) {
            b.enableContextual(enableContextual);
        }
        if (enableCollective != null) {
            b.enableCollective(enableCollective);
        }
        if (threshold != null) {
            b.threshold(threshold);
        }
        return b.enableRealtime(true).build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public String getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(String sensitivity) {
        this.sensitivity = sensitivity;
    }

    public Integer getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(Integer windowSize) {
        this.windowSize = windowSize;
    }

    public Integer getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(Integer minSamples) {
        this.minSamples = minSamples;
    }

    public Boolean getEnableContextual() {
        return enableContextual;
    }

    public void setEnableContextual(Boolean enableContextual) {
        this.enableContextual = enableContextual;
    }

    public Boolean getEnableCollective() {
        return enableCollective;
    }

    public void setEnableCollective(Boolean enableCollective) {
        this.enableCollective = enableCollective;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorProfile that))
            return false;
        return Objects.equals(metric, that.metric) && Objects.equals(algorithm, that.algorithm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, algorithm);
    }

    @Override
    public String toString() {
        return "DetectorProfile{" +
                "metric='" + metric + '\'' +
                ", algorithm='" + algorithm + '\'' +
                ", sensitivity='" + sensitivity + '\'' +
                ", windowSize=" + windowSize +
                ", minSamples=" + minSamples +
                ", threshold=" + threshold +
                '}';
    }
}
