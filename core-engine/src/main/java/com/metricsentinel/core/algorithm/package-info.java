/**
 * Scoring strategies: single statistical scorers, the contextual decorator,
 * the ensemble coordinator and the factory that assembles them from a
 * {@link com.metricsentinel.core.config.DetectionConfig}.
 */
package com.metricsentinel.core.algorithm;
