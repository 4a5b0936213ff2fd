/**
 * Domain model classes for Metric Sentinel.
 *
 * <p>
 * This package contains the value objects exchanged between the detection
 * engine and its callers:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.model.Sample} — one metric
 * observation</li>
 * <li>{@link com.metricsentinel.core.model.Anomaly} — labeled anomaly emitted
 * by detectors</li>
 * <li>{@link com.metricsentinel.core.model.AnomalyDetectionResult} — batch run
 * report</li>
 * <li>{@link com.metricsentinel.core.model.Algorithm} and
 * {@link com.metricsentinel.core.model.Sensitivity} — configuration
 * vocabulary</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.model;
