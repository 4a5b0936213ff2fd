package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owned collection of streaming detectors, at most one per metric.
 *
 * <p>
 * Creating a detector for a metric that already has one replaces it: the old
 * detector is disposed and its id stops resolving. Lookups and point
 * processing go through concurrent maps; only create, replace and remove take
 * the registry lock, so detectors for different metrics are processed in
 * parallel.
 * </p>
 *
 * <p>
 * Lifecycle is entirely caller-driven: there is no idle eviction.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionRegistry.class);

    private final ConcurrentMap<String, StreamingDetector> byId = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idByMetric = new ConcurrentHashMap<>();
    private final List<AnomalyListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object mutationLock = new Object();

    /**
     * Create a detector for {@code metricName}, replacing any existing one.
     *
     * @return the new detector's id
     * @throws com.metricsentinel.core.config.InvalidConfigException if
     *                                                                {@code metricName}
     *                                                                is blank
     */
    public String createStreamingDetector(String metricName, DetectionConfig config) {
        BatchDetector.validateMetricName(metricName);
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        String id = metricName + "-" + sequence.incrementAndGet();
        StreamingDetector detector = new StreamingDetector(id, metricName, config);

        StreamingDetector replaced;
        synchronized (mutationLock) {
            // resolvable by id before the metric points at it
            byId.put(id, detector);
            String previousId = idByMetric.put(metricName, id);
            replaced = previousId == null ? null : byId.remove(previousId);
        }

        if (replaced != null) {
            replaced.dispose();
            LOG.info("Replaced detector [{}] for metric '{}' with [{}] ({})", replaced.getId(), metricName, id,
                    config.getAlgorithm().id());
        } else {
            LOG.info("Created detector [{}] for metric '{}' ({}, window={}, minSamples={})", id, metricName,
                    config.getAlgorithm().id(), config.getWindowSize(), config.getMinSamples());
        }
        return id;
    }

    /**
     * Create one detector per metric, typically from
     * {@link com.metricsentinel.core.config.DetectorProfilesLoader}.
     *
     * @param configs validated configurations keyed by metric
     * @return detector ids in map iteration order
     */
    public List<String> createAll(Map<String, DetectionConfig> configs) {
        Objects.requireNonNull(configs, "configs must not be null");
        LOG.info("Creating {} detector(s) from profiles", configs.size());
        List<String> ids = new ArrayList<>(configs.size());
        configs.forEach((metric, config) -> ids.add(createStreamingDetector(metric, config)));
        return ids;
    }

    /**
     * Feed one point to a detector and notify listeners when it emits an
     * anomaly.
     *
     * @throws UnknownDetectorException if {@code detectorId} is not registered,
     *                                  or is replaced or removed while the point
     *                                  is being processed
     */
    public Anomaly processStreamingPoint(String detectorId, Sample sample) {
        StreamingDetector detector = require(detectorId);
        Anomaly anomaly;
        try {
            anomaly = detector.process(sample);
        } catch (DetectorDisposedException e) {
            // replaced or removed between lookup and processing
            throw new UnknownDetectorException(detectorId, e);
        }
        return publish(detectorId, anomaly);
    }

    /**
     * Feed one point to the detector currently bound to {@code metricName}.
     *
     * @throws UnknownDetectorException if the metric has no detector
     */
    public Anomaly processMetricPoint(String metricName, Sample sample) {
        String id = idByMetric.get(metricName);
        if (id == null) {
            throw new UnknownDetectorException(metricName);
        }
        return processStreamingPoint(id, sample);
    }

    /**
     * Close any open collective run on a detector.
     *
     * @throws UnknownDetectorException if {@code detectorId} is not registered
     */
    public Anomaly flush(String detectorId) {
        StreamingDetector detector = require(detectorId);
        Anomaly anomaly = detector.flush();
        if (anomaly == null && detector.getState() == DetectorState.DISPOSED) {
            throw new UnknownDetectorException(detectorId);
        }
        return publish(detectorId, anomaly);
    }

    /**
     * Dispose and unregister a detector.
     *
     * @return {@code true} if the detector existed
     */
    public boolean removeStreamingDetector(String detectorId) {
        StreamingDetector removed;
        synchronized (mutationLock) {
            removed = byId.remove(detectorId);
            if (removed != null) {
                idByMetric.remove(removed.getMetricName(), detectorId);
            }
        }
        if (removed == null) {
            return false;
        }
        removed.dispose();
        LOG.info("Removed detector [{}] for metric '{}'", detectorId, removed.getMetricName());
        return true;
    }

    /**
     * @throws UnknownDetectorException if {@code detectorId} is not registered
     */
    public StreamingDetector getDetector(String detectorId) {
        return require(detectorId);
    }

    public Optional<StreamingDetector> detectorFor(String metricName) {
        String id = idByMetric.get(metricName);
        if (id == null) {
            return Optional.empty();
        }
        StreamingDetector detector = byId.get(id);
        if (detector == null) {
            // lost a race with a replacement; re-read under the lock
            synchronized (mutationLock) {
                String current = idByMetric.get(metricName);
                detector = current == null ? null : byId.get(current);
            }
        }
        return Optional.ofNullable(detector);
    }

    public boolean contains(String detectorId) {
        return byId.containsKey(detectorId);
    }

    public int size() {
        return byId.size();
    }

    public RegistryStats getDetectorStats() {
        Map<DetectorState, Integer> byState = new EnumMap<>(DetectorState.class);
        Set<Algorithm> algorithms = EnumSet.noneOf(Algorithm.class);
        List<String> metrics = new ArrayList<>();
        long processed = 0;
        long anomalies = 0;
        List<StreamingDetector> snapshot = new ArrayList<>(byId.values());
        for (StreamingDetector d : snapshot) {
            byState.merge(d.getState(), 1, Integer::sum);
            algorithms.add(d.getConfig().getAlgorithm());
            metrics.add(d.getMetricName());
            processed += d.getProcessedCount();
            anomalies += d.getAnomalyCount();
        }
        metrics.sort(null);
        return new RegistryStats(snapshot.size(), byState, algorithms, processed, anomalies, metrics);
    }

    // ---------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------

    public void addListener(AnomalyListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public boolean removeListener(AnomalyListener listener) {
        return listeners.remove(listener);
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private StreamingDetector require(String detectorId) {
        StreamingDetector detector = detectorId == null ? null : byId.get(detectorId);
        if (detector == null) {
            throw new UnknownDetectorException(detectorId);
        }
        return detector;
    }

    private Anomaly publish(String detectorId, Anomaly anomaly) {
        if (anomaly == null) {
            return null;
        }
        for (AnomalyListener listener : listeners) {
            try {
                listener.onAnomaly(detectorId, anomaly);
            } catch (Exception e) {
                LOG.error("Listener threw an exception for detector [{}] – continuing with next listener",
                        detectorId, e);
            }
        }
        return anomaly;
    }
}
