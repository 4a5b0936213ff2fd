package com.metricsentinel.core.config;

/**
 * Thrown when a detection configuration is rejected: {@code minSamples}
 * larger than {@code windowSize}, an unknown algorithm or sensitivity, a
 * non-positive window, and so on.
 *
 * <p>
 * Configuration errors are never coerced; they surface at the entry point that
 * received the configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidConfigException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
