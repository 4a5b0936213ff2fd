package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of anomaly reported.
 *
 * <ul>
 * <li>{@code POINT} — a single sample deviates from a flat baseline</li>
 * <li>{@code CONTEXTUAL} — a single sample deviates from its seasonal
 * (time-of-day) baseline</li>
 * <li>{@code COLLECTIVE} — a run of individually sub-threshold samples that
 * is jointly anomalous</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum AnomalyType {
    POINT,
    CONTEXTUAL,
    COLLECTIVE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
