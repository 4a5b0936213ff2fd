package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse direction of a metric over the context window.
 */
public enum Trend {
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
