/**
 * Sample windows and the statistics computed over them.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.window;
