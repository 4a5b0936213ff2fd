package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.Algorithm;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time snapshot of a {@link DetectionRegistry}.
 *
 * @since 1.0.0
 */
public final class RegistryStats {

    private final int totalDetectors;
    private final Map<DetectorState, Integer> byState;
    private final Set<Algorithm> algorithms;
    private final long pointsProcessed;
    private final long anomaliesEmitted;
    private final List<String> metrics;

    RegistryStats(int totalDetectors, Map<DetectorState, Integer> byState, Set<Algorithm> algorithms,
            long pointsProcessed, long anomaliesEmitted, List<String> metrics) {
        this.totalDetectors = totalDetectors;
        this.byState = Collections.unmodifiableMap(new EnumMap<>(byState));
        this.algorithms = Collections.unmodifiableSet(algorithms);
        this.pointsProcessed = pointsProcessed;
        this.anomaliesEmitted = anomaliesEmitted;
        this.metrics = List.copyOf(metrics);
    }

    public int getTotalDetectors() {
        return totalDetectors;
    }

    public int getActiveDetectors() {
        return byState.getOrDefault(DetectorState.ACTIVE, 0);
    }

    public int count(DetectorState state) {
        return byState.getOrDefault(state, 0);
    }

    public Map<DetectorState, Integer> getByState() {
        return byState;
    }

    /** Algorithms used by at least one registered detector. */
    public Set<Algorithm> getAlgorithms() {
        return algorithms;
    }

    public long getPointsProcessed() {
        return pointsProcessed;
    }

    public long getAnomaliesEmitted() {
        return anomaliesEmitted;
    }

    public List<String> getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "RegistryStats{" +
                "totalDetectors=" + totalDetectors +
                ", byState=" + byState +
                ", pointsProcessed=" + pointsProcessed +
                ", anomaliesEmitted=" + anomaliesEmitted +
                '}';
    }
}
