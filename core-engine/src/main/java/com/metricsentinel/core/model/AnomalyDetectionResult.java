package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One-shot report returned by a batch detection run.
 *
 * <p>
 * {@code anomalies} are ordered by timestamp. {@code modelPerformance} is only
 * present when the caller supplied ground truth (validation mode).
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnomalyDetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Anomaly> anomalies;
    private final Summary summary;
    private final ModelPerformance modelPerformance;

    public AnomalyDetectionResult(List<Anomaly> anomalies, Summary summary,
            ModelPerformance modelPerformance) {
        this.anomalies = List.copyOf(Objects.requireNonNull(anomalies, "anomalies must not be null"));
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.modelPerformance = modelPerformance;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public Summary getSummary() {
        return summary;
    }

    /**
     * @return precision/recall figures, or {@code null} without ground truth
     */
    public ModelPerformance getModelPerformance() {
        return modelPerformance;
    }

    @Override
    public String toString() {
        return "AnomalyDetectionResult{" +
                "anomalies=" + anomalies.size() +
                ", summary=" + summary +
                '}';
    }

    // ---------------------------------------------------------------
    // Summary
    // ---------------------------------------------------------------

    /**
     * Aggregate figures for a detection run.
     *
     * <p>
     * {@code accuracy} is a self-reported quality estimate computed only when
     * ground truth is available; otherwise it is {@code 0.0}.
     * </p>
     */
    public static final class Summary implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double accuracy;
        private final int totalPoints;
        private final int anomalyCount;
        private final Algorithm algorithmUsed;
        private final Map<String, Integer> bySeverity;
        private final Map<String, Integer> byType;
        private final long processingTimeMillis;

        public Summary(double accuracy, int totalPoints, int anomalyCount, Algorithm algorithmUsed,
                Map<String, Integer> bySeverity, Map<String, Integer> byType, long processingTimeMillis) {
            this.accuracy = accuracy;
            this.totalPoints = totalPoints;
            this.anomalyCount = anomalyCount;
            this.algorithmUsed = Objects.requireNonNull(algorithmUsed, "algorithmUsed must not be null");
            this.bySeverity = Collections.unmodifiableMap(new LinkedHashMap<>(bySeverity));
            this.byType = Collections.unmodifiableMap(new LinkedHashMap<>(byType));
            this.processingTimeMillis = processingTimeMillis;
        }

        public double getAccuracy() {
            return accuracy;
        }

        public int getTotalPoints() {
            return totalPoints;
        }

        public int getAnomalyCount() {
            return anomalyCount;
        }

        public Algorithm getAlgorithmUsed() {
            return algorithmUsed;
        }

        public Map<String, Integer> getBySeverity() {
            return bySeverity;
        }

        public Map<String, Integer> getByType() {
            return byType;
        }

        public long getProcessingTimeMillis() {
            return processingTimeMillis;
        }

        @Override
        public String toString() {
            return "Summary{" +
                    "totalPoints=" + totalPoints +
                    ", anomalyCount=" + anomalyCount +
                    ", algorithmUsed=" + algorithmUsed.id() +
                    ", accuracy=" + accuracy +
                    ", bySeverity=" + bySeverity +
                    '}';
        }
    }

    // ---------------------------------------------------------------
    // Model performance (validation mode)
    // ---------------------------------------------------------------

    /** Precision / recall against caller-supplied ground truth. */
    public static final class ModelPerformance implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double precision;
        private final double recall;
        private final double f1Score;

        public ModelPerformance(double precision, double recall, double f1Score) {
            this.precision = precision;
            this.recall = recall;
            this.f1Score = f1Score;
        }

        public double getPrecision() {
            return precision;
        }

        public double getRecall() {
            return recall;
        }

        public double getF1Score() {
            return f1Score;
        }

        @Override
        public String toString() {
            return String.format("ModelPerformance{precision=%.3f, recall=%.3f, f1=%.3f}",
                    precision, recall, f1Score);
        }
    }
}
