package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Labeled anomaly produced by a batch or streaming detection call.
 *
 * <p>
 * Immutable after construction. The dashboard renders {@code severity},
 * {@code explanation} and {@code recommendations} verbatim, so the engine owns
 * the vocabulary of those fields.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricName}, {@code timestamp},
 * {@code severity}, {@code type} and {@code algorithm} are required; a random
 * {@code id} is assigned when none is given.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String metricName;
    private final Instant timestamp;
    private final double value;
    private final double expectedValue;
    private final double score;
    private final Severity severity;
    private final AnomalyType type;
    private final Algorithm algorithm;
    private final double confidence;
    private final String explanation;
    private final List<String> recommendations;
    private final AnomalyContext context;
    private final Map<String, Object> metadata;

    private Anomaly(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.value = builder.value;
        this.expectedValue = builder.expectedValue;
        this.score = builder.score;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.algorithm = Objects.requireNonNull(builder.algorithm, "algorithm must not be null");
        this.confidence = builder.confidence;
        this.explanation = builder.explanation != null ? builder.explanation : "";
        this.recommendations = builder.recommendations != null
                ? List.copyOf(builder.recommendations)
                : List.of();
        this.context = builder.context;
        this.metadata = builder.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
                : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private String id;
        private String metricName;
        private Instant timestamp;
        private double value;
        private double expectedValue;
        private double score;
        private Severity severity;
        private AnomalyType type = AnomalyType.POINT;
        private Algorithm algorithm;
        private double confidence;
        private String explanation;
        private List<String> recommendations;
        private AnomalyContext context;
        private Map<String, Object> metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder algorithm(Algorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        public Builder context(AnomalyContext context) {
            this.context = context;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException if a required field is missing
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getScore() {
        return score;
    }

    public Severity getSeverity() {
        return severity;
    }

    public AnomalyType getType() {
        return type;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getExplanation() {
        return explanation;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public AnomalyContext getContext() {
        return context;
    }

    /**
     * @return unmodifiable metadata bag (algorithm, threshold, window bounds,
     *         ensemble contributors, collective run span)
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly anomaly))
            return false;
        return id.equals(anomaly.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "metric='" + metricName + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", expected=" + expectedValue +
                ", score=" + score +
                ", severity=" + severity +
                ", type=" + type +
                ", algorithm=" + algorithm.id() +
                '}';
    }
}
