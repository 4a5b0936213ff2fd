/**
 * Jackson-based JSON codec for anomalies, detection results and inbound
 * samples.
 */
package com.metricsentinel.core.codec;
