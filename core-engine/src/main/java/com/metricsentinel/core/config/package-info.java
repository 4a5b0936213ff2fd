/**
 * Detection configuration and its validation.
 *
 * <p>
 * {@link com.metricsentinel.core.config.DetectionConfig} is the complete
 * tunable surface of the engine. Streaming detectors can also be declared in
 * YAML and loaded by
 * {@link com.metricsentinel.core.config.DetectorProfilesLoader}, which
 * resolves them into one validated configuration per metric.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.config;
