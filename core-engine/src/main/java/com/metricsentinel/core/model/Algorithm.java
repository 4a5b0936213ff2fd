package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.metricsentinel.core.config.InvalidConfigException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Scoring strategies understood by the engine.
 *
 * <p>
 * Each constant carries its configuration identifier (as used in YAML and
 * JSON) and a nominal confidence that is reported on every anomaly the
 * algorithm produces.
 * </p>
 *
 * @since 1.0.0
 */
public enum Algorithm {
    ZSCORE("zscore", "Z-Score", 0.75),
    MODIFIED_ZSCORE("modified_zscore", "Modified Z-Score", 0.82),
    IQR("iqr", "Interquartile Range", 0.78),
    ISOLATION_FOREST("isolation_forest", "Isolation Forest", 0.88),
    SEASONAL_ESD("seasonal_esd", "Seasonal ESD", 0.85),
    ENSEMBLE("ensemble", "Ensemble", 0.92);

    /** Every algorithm except {@link #ENSEMBLE}, in declaration order. */
    public static final List<Algorithm> SINGLE = List.of(
            ZSCORE, MODIFIED_ZSCORE, IQR, ISOLATION_FOREST, SEASONAL_ESD);

    private final String id;
    private final String displayName;
    private final double nominalConfidence;

    Algorithm(String id, String displayName, double nominalConfidence) {
        this.id = id;
        this.displayName = displayName;
        this.nominalConfidence = nominalConfidence;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public double nominalConfidence() {
        return nominalConfidence;
    }

    /**
     * Resolve an algorithm from its identifier (case-insensitive).
     *
     * @param id identifier such as {@code "modified_zscore"}
     * @return the matching algorithm
     * @throws InvalidConfigException if {@code id} is {@code null} or unknown
     */
    public static Algorithm fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (Algorithm a : values()) {
                if (a.id.equals(normalized)) {
                    return a;
                }
            }
        }
        throw new InvalidConfigException("Unknown algorithm: '" + id + "'. Supported: "
                + Arrays.stream(values()).map(Algorithm::id).collect(Collectors.joining(", ")));
    }
}
