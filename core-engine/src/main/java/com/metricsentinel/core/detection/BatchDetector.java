package com.metricsentinel.core.detection;

import com.metricsentinel.core.algorithm.AlgorithmFactory;
import com.metricsentinel.core.algorithm.DetectionAlgorithm;
import com.metricsentinel.core.algorithm.ScoreResult;
import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.config.InvalidConfigException;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyDetectionResult;
import com.metricsentinel.core.model.AnomalyDetectionResult.ModelPerformance;
import com.metricsentinel.core.model.AnomalyDetectionResult.Summary;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.window.ScoringWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * One-shot detection over a historical series.
 *
 * <p>
 * Every point from index {@code minSamples} onwards is scored against the
 * {@code windowSize} points that precede it. With collective detection
 * enabled, runs of borderline points are reported as one collective anomaly
 * each; a run still open at the end of the series is closed there. The
 * detector holds no state between calls.
 * </p>
 *
 * <h3>Validation mode</h3>
 * <p>
 * When a set of known-anomalous timestamps is supplied, every evaluated point
 * is classified as a true/false positive/negative. A point counts as
 * predicted when it was flagged on its own or belongs to a reported
 * collective run. The summary then reports accuracy and the result carries
 * precision, recall and F1.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BatchDetector.class);

    /**
     * Detect anomalies in {@code samples}.
     *
     * @param metricName name used for labeling and recommendations
     * @param samples    series ordered by timestamp; not bounded by the window
     * @param config     detection configuration
     * @return anomalies ordered by timestamp plus a run summary
     * @throws InvalidConfigException if {@code metricName} is blank
     * @throws NullPointerException   if any argument is {@code null}
     */
    public AnomalyDetectionResult detectAnomalies(String metricName, List<Sample> samples, DetectionConfig config) {
        return detect(metricName, samples, config, null);
    }

    /**
     * Detect anomalies and evaluate them against known-anomalous timestamps.
     *
     * @param groundTruth timestamps of samples known to be anomalous
     */
    public AnomalyDetectionResult detectAnomalies(String metricName, List<Sample> samples, DetectionConfig config,
            Set<Instant> groundTruth) {
        Objects.requireNonNull(groundTruth, "groundTruth must not be null");
        return detect(metricName, samples, config, groundTruth);
    }

    private AnomalyDetectionResult detect(String metricName, List<Sample> samples, DetectionConfig config,
            Set<Instant> groundTruth) {
        validateMetricName(metricName);
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        long started = System.nanoTime();
        DetectionAlgorithm algorithm = AlgorithmFactory.create(config);
        CollectiveRunTracker tracker = config.isEnableCollective()
                ? new CollectiveRunTracker(algorithm.effectiveThreshold(config))
                : null;

        List<Anomaly> anomalies = new ArrayList<>();
        Set<Instant> predicted = new HashSet<>();
        List<Instant> evaluated = new ArrayList<>();

        for (int i = config.getMinSamples(); i < samples.size(); i++) {
            Sample candidate = Objects.requireNonNull(samples.get(i), "samples must not contain null");
            ScoringWindow window = ScoringWindow.of(samples.subList(Math.max(0, i - config.getWindowSize()), i));
            ScoreResult result = algorithm.score(window, candidate, config);
            evaluated.add(candidate.getTimestamp());

            if (result.isAnomalous()) {
                Anomaly anomaly = AnomalyFactory.point(metricName, candidate, window, result, algorithm, config);
                LOG.debug("[{}] anomaly at {}: value={} score={} severity={}", metricName,
                        candidate.getTimestamp(), candidate.getValue(), result.getScore(), anomaly.getSeverity());
                anomalies.add(anomaly);
                predicted.add(candidate.getTimestamp());
            }
            if (tracker != null) {
                addCollective(tracker.observe(candidate, window, result), metricName, algorithm, config,
                        anomalies, predicted);
            }
        }
        if (tracker != null) {
            addCollective(tracker.close(), metricName, algorithm, config, anomalies, predicted);
        }
        anomalies.sort(Comparator.comparing(Anomaly::getTimestamp));

        double accuracy = 0.0;
        ModelPerformance performance = null;
        if (groundTruth != null) {
            Confusion confusion = Confusion.of(evaluated, predicted, groundTruth);
            accuracy = confusion.accuracy();
            performance = confusion.toPerformance();
        }

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        Summary summary = new Summary(accuracy, samples.size(), anomalies.size(), config.getAlgorithm(),
                countBySeverity(anomalies), countByType(anomalies), elapsedMillis);
        LOG.info("[{}] batch detection over {} point(s) with {} found {} anomaly(ies) in {} ms",
                metricName, samples.size(), config.getAlgorithm().id(), anomalies.size(), elapsedMillis);
        return new AnomalyDetectionResult(anomalies, summary, performance);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static void addCollective(CollectiveRunTracker.Run run, String metricName, DetectionAlgorithm algorithm,
            DetectionConfig config, List<Anomaly> anomalies, Set<Instant> predicted) {
        if (run == null) {
            return;
        }
        Anomaly anomaly = AnomalyFactory.collective(metricName, run, algorithm, config);
        LOG.debug("[{}] collective anomaly over {} point(s) from {} to {}", metricName, run.length(),
                run.start(), run.end());
        anomalies.add(anomaly);
        predicted.addAll(run.members());
    }

    static void validateMetricName(String metricName) {
        if (metricName == null || metricName.isBlank()) {
            throw new InvalidConfigException("metricName must not be blank");
        }
    }

    private static Map<String, Integer> countBySeverity(List<Anomaly> anomalies) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Severity s : Severity.values()) {
            counts.put(s.id(), 0);
        }
        anomalies.forEach(a -> counts.merge(a.getSeverity().id(), 1, Integer::sum));
        return counts;
    }

    private static Map<String, Integer> countByType(List<Anomaly> anomalies) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AnomalyType t : AnomalyType.values()) {
            counts.put(t.id(), 0);
        }
        anomalies.forEach(a -> counts.merge(a.getType().id(), 1, Integer::sum));
        return counts;
    }

    /** Confusion matrix over the evaluated points. */
    private static final class Confusion {

        private int truePositives;
        private int falsePositives;
        private int trueNegatives;
        private int falseNegatives;

        static Confusion of(List<Instant> evaluated, Set<Instant> predicted, Set<Instant> truth) {
            Confusion c = new Confusion();
            for (Instant t : evaluated) {
                boolean p = predicted.contains(t);
                boolean a = truth.contains(t);
                if (p && a) {
                    c.truePositives++;
                } else if (p) {
                    c.falsePositives++;
                } else if (a) {
                    c.falseNegatives++;
                } else {
                    c.trueNegatives++;
                }
            }
            return c;
        }

        double accuracy() {
            int total = truePositives + falsePositives + trueNegatives + falseNegatives;
            return total == 0 ? 0.0 : (double) (truePositives + trueNegatives) / total;
        }

        ModelPerformance toPerformance() {
            double precision = ratio(truePositives, truePositives + falsePositives);
            double recall = ratio(truePositives, truePositives + falseNegatives);
            double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
            return new ModelPerformance(precision, recall, f1);
        }

        private static double ratio(int num, int den) {
            return den == 0 ? 0.0 : (double) num / den;
        }
    }
}
