package com.metricsentinel.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyDetectionResult;
import com.metricsentinel.core.model.Sample;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * JSON rendering for the dashboard and alert-routing collaborators.
 *
 * <p>
 * Instants are written as ISO-8601 strings and enums as their lowercase
 * identifiers. Unknown properties in inbound sample payloads are ignored.
 * Instances are thread-safe once constructed.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyJsonCodec {

    private static final TypeReference<List<Sample>> SAMPLE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public AnomalyJsonCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String toJson(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        return write(anomaly, "anomaly");
    }

    public byte[] toBytes(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        try {
            return mapper.writeValueAsBytes(anomaly);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize anomaly: " + e.getMessage(), e);
        }
    }

    public String toJson(AnomalyDetectionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return write(result, "detection result");
    }

    /**
     * Parse a series such as
     * {@code [{"timestamp":"2024-01-01T00:00:00Z","value":1.5}, ...]}.
     *
     * @throws IllegalArgumentException if the payload is not a valid series
     */
    public List<Sample> readSamples(String json) {
        Objects.requireNonNull(json, "json must not be null");
        List<Sample> samples;
        try {
            samples = mapper.readValue(json, SAMPLE_LIST);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed sample series: " + e.getMessage(), e);
        }
        if (samples == null || samples.contains(null)) {
            throw new IllegalArgumentException("Malformed sample series: null entry");
        }
        return List.copyOf(samples);
    }

    public Sample readSample(byte[] payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        try {
            return mapper.readValue(payload, Sample.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed sample: " + e.getMessage(), e);
        }
    }

    private String write(Object value, String what) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
