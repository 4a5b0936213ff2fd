package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.metricsentinel.core.config.InvalidConfigException;

import java.util.Locale;

/**
 * Detection sensitivity. Higher sensitivity means a lower threshold and
 * therefore more flagged points.
 *
 * <table>
 * <caption>Derived thresholds</caption>
 * <tr><th>sensitivity</th><th>threshold</th></tr>
 * <tr><td>low</td><td>3.5</td></tr>
 * <tr><td>medium</td><td>2.5</td></tr>
 * <tr><td>high</td><td>2.0</td></tr>
 * <tr><td>critical</td><td>1.5</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum Sensitivity {
    LOW(3.5),
    MEDIUM(2.5),
    HIGH(2.0),
    CRITICAL(1.5);

    private final double threshold;

    Sensitivity(double threshold) {
        this.threshold = threshold;
    }

    /**
     * @return the score cutoff derived from this sensitivity; always &gt; 0
     */
    public double threshold() {
        return threshold;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param id identifier such as {@code "high"} (case-insensitive)
     * @return the matching sensitivity
     * @throws InvalidConfigException if {@code id} is {@code null} or unknown
     */
    public static Sensitivity fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toUpperCase(Locale.ROOT);
            for (Sensitivity s : values()) {
                if (s.name().equals(normalized)) {
                    return s;
                }
            }
        }
        throw new InvalidConfigException(
                "Unknown sensitivity: '" + id + "'. Supported: low, medium, high, critical");
    }
}
