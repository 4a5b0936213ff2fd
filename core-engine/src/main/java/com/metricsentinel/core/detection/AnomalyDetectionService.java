package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyDetectionResult;
import com.metricsentinel.core.model.Sample;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the engine: one-shot batch detection plus an owned registry
 * of streaming detectors.
 *
 * <p>
 * Instances are independent; a host application typically creates one and
 * shares it.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionService {

    private final BatchDetector batchDetector;
    private final DetectionRegistry registry;

    public AnomalyDetectionService() {
        this(new BatchDetector(), new DetectionRegistry());
    }

    public AnomalyDetectionService(BatchDetector batchDetector, DetectionRegistry registry) {
        this.batchDetector = Objects.requireNonNull(batchDetector, "batchDetector must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Create a service with one streaming detector per metric.
     *
     * @param profiles configurations keyed by metric, as resolved by
     *                 {@link com.metricsentinel.core.config.DetectorProfilesLoader}
     */
    public static AnomalyDetectionService withProfiles(Map<String, DetectionConfig> profiles) {
        AnomalyDetectionService service = new AnomalyDetectionService();
        service.registry.createAll(profiles);
        return service;
    }

    // ---------------------------------------------------------------
    // Batch
    // ---------------------------------------------------------------

    /** Batch detection with {@link DetectionConfig#batchDefaults()}. */
    public AnomalyDetectionResult detectAnomalies(String metricName, List<Sample> samples) {
        return batchDetector.detectAnomalies(metricName, samples, DetectionConfig.batchDefaults());
    }

    public AnomalyDetectionResult detectAnomalies(String metricName, List<Sample> samples, DetectionConfig config) {
        return batchDetector.detectAnomalies(metricName, samples, config);
    }

    public AnomalyDetectionResult detectAnomalies(String metricName, List<Sample> samples, DetectionConfig config,
            Set<Instant> groundTruth) {
        return batchDetector.detectAnomalies(metricName, samples, config, groundTruth);
    }

    // ---------------------------------------------------------------
    // Streaming
    // ---------------------------------------------------------------

    /** Create a detector with {@link DetectionConfig#streamingDefaults()}. */
    public String createStreamingDetector(String metricName) {
        return registry.createStreamingDetector(metricName, DetectionConfig.streamingDefaults());
    }

    public String createStreamingDetector(String metricName, DetectionConfig config) {
        return registry.createStreamingDetector(metricName, config);
    }

    public Anomaly processStreamingPoint(String detectorId, Sample sample) {
        return registry.processStreamingPoint(detectorId, sample);
    }

    public Anomaly flush(String detectorId) {
        return registry.flush(detectorId);
    }

    public boolean removeStreamingDetector(String detectorId) {
        return registry.removeStreamingDetector(detectorId);
    }

    public RegistryStats getDetectorStats() {
        return registry.getDetectorStats();
    }

    public void addListener(AnomalyListener listener) {
        registry.addListener(listener);
    }

    public DetectionRegistry getRegistry() {
        return registry;
    }
}
