package com.metricsentinel.core.config;

/**
 * Verdict the ensemble returns when its members split exactly in half.
 *
 * @since 1.0.0
 */
public enum TieBreakPolicy {

    /** An even split is reported as not anomalous. */
    FAVOR_PRECISION,

    /** An even split is reported as anomalous. */
    FAVOR_RECALL;

    public boolean resolve() {
        return this == FAVOR_RECALL;
    }
}
