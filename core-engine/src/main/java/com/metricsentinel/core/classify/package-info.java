/**
 * Post-scoring enrichment: severity from the score-to-threshold ratio,
 * explanations, remediation hints and anomaly context.
 */
package com.metricsentinel.core.classify;
