package com.metricsentinel.core.classify;

/**
 * Side of the expected value an anomalous reading falls on.
 */
public enum Direction {
    ABOVE("above"),
    BELOW("below");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** {@link #ABOVE} unless {@code value} is strictly below {@code expected}. */
    public static Direction of(double value, double expected) {
        return value < expected ? BELOW : ABOVE;
    }
}
