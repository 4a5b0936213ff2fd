package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.Anomaly;

/**
 * Callback for anomalies emitted by streaming detectors, typically the hook
 * into alert routing.
 *
 * <p>
 * Listeners run on the thread that processed the point. A listener that
 * throws is logged and skipped; it never affects detection or other
 * listeners.
 * </p>
 */
@FunctionalInterface
public interface AnomalyListener {

    void onAnomaly(String detectorId, Anomaly anomaly);
}
