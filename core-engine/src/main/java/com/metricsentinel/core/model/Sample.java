package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single metric observation.
 *
 * <p>
 * Immutable once created. Samples are produced by the ingestion layer and
 * consumed by the batch and streaming detectors.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /**
     * @param timestamp instant of the observation; must not be {@code null}
     * @param value     observed value
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    @JsonCreator
    public Sample(@JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("value") double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "Sample timestamp must not be null");
        this.value = value;
    }

    public static Sample of(Instant timestamp, double value) {
        return new Sample(timestamp, value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "Sample{" + timestamp + ", " + value + '}';
    }
}
