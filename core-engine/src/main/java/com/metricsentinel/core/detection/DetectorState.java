package com.metricsentinel.core.detection;

/**
 * Lifecycle of a {@link StreamingDetector}.
 *
 * <pre>
 *   CREATED ──first point──▶ WARMING ──minSamples buffered──▶ ACTIVE
 *      │                        │                               │
 *      └────────────────────────┴──────────dispose()────────────┴──▶ DISPOSED
 * </pre>
 */
public enum DetectorState {
    CREATED,
    WARMING,
    ACTIVE,
    DISPOSED
}
