/**
 * Detection drivers.
 *
 * <ul>
 * <li>{@link com.metricsentinel.core.detection.BatchDetector} — sliding-window
 * detection over a historical series</li>
 * <li>{@link com.metricsentinel.core.detection.StreamingDetector} — per-metric
 * incremental detection, one point per call</li>
 * <li>{@link com.metricsentinel.core.detection.DetectionRegistry} — owned map
 * of streaming detectors with listener fan-out</li>
 * <li>{@link com.metricsentinel.core.detection.AnomalyDetectionService} —
 * facade over both</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.detection;
