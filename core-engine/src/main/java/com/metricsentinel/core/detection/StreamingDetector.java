package com.metricsentinel.core.detection;

import com.metricsentinel.core.algorithm.AlgorithmFactory;
import com.metricsentinel.core.algorithm.DetectionAlgorithm;
import com.metricsentinel.core.algorithm.ScoreResult;
import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.RunningStatistics;
import com.metricsentinel.core.window.SampleBuffer;
import com.metricsentinel.core.window.ScoringWindow;
import com.metricsentinel.core.window.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Stateful, per-metric incremental detector.
 *
 * <p>
 * Each call to {@link #process(Sample)} scores the incoming point against the
 * samples buffered so far (once at least {@code minSamples} are buffered),
 * then pushes it into the window, evicting the oldest sample beyond
 * {@code windowSize}. Mean and variance are maintained incrementally and
 * re-anchored with an exact pass every {@code windowSize} evictions to bound
 * floating-point drift.
 * </p>
 *
 * <h3>Collective runs</h3>
 * <p>
 * A collective anomaly is only known once its run closes. If the closing
 * point is itself anomalous, that point is returned first and the collective
 * anomaly is held back until the next call that has nothing else to return,
 * or until {@link #flush()}.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * All state-mutating methods are {@code synchronized} on the detector, so one
 * detector may be fed from several threads while different detectors never
 * contend.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamingDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingDetector.class);

    private final String id;
    private final String metricName;
    private final DetectionConfig config;
    private final DetectionAlgorithm algorithm;

    private final SampleBuffer window;
    private final RunningStatistics runningStats = new RunningStatistics();
    private final CollectiveRunTracker collective;

    private DetectorState state = DetectorState.CREATED;
    private long processedCount;
    private long anomalyCount;
    private Instant lastAnomalyAt;
    private int evictionsSinceAnchor;
    private Anomaly pendingCollective;

    /**
     * @param id         unique detector id
     * @param metricName metric this detector is bound to
     * @param config     detection configuration
     * @throws NullPointerException if any argument is {@code null}
     */
    public StreamingDetector(String id, String metricName, DetectionConfig config) {
        this.id = Objects.requireNonNull(id, "Detector id must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.algorithm = AlgorithmFactory.create(config);
        this.window = new SampleBuffer(config.getWindowSize());
        this.collective = config.isEnableCollective()
                ? new CollectiveRunTracker(algorithm.effectiveThreshold(config))
                : null;
    }

    /**
     * Evaluate one point and add it to the window.
     *
     * @param sample the incoming point; callers feed non-decreasing timestamps
     * @return an anomaly, or {@code null} when the point is normal, the
     *         detector is still warming up, or nothing is pending
     * @throws DetectorDisposedException if the detector has been disposed
     */
    public synchronized Anomaly process(Sample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        if (state == DetectorState.DISPOSED) {
            throw new DetectorDisposedException(id);
        }

        Anomaly point = null;
        if (window.size() >= config.getMinSamples()) {
            ScoringWindow context = ScoringWindow.withMoments(window.asOrderedSequence(),
                    runningStats.getMean(), runningStats.getStdDev());
            ScoreResult result = algorithm.score(context, sample, config);
            if (result.isAnomalous()) {
                point = AnomalyFactory.point(metricName, sample, context, result, algorithm, config);
            }
            if (collective != null) {
                CollectiveRunTracker.Run run = collective.observe(sample, context, result);
                if (run != null) {
                    pendingCollective = AnomalyFactory.collective(metricName, run, algorithm, config);
                }
            }
        } else {
            LOG.trace("[{}] warming up: {}/{} samples", id, window.size(), config.getMinSamples());
        }

        append(sample);

        Anomaly emitted = point;
        if (emitted == null && pendingCollective != null) {
            emitted = pendingCollective;
            pendingCollective = null;
        }
        return record(emitted);
    }

    /**
     * Close any open collective run and return the anomaly it produced, or a
     * collective anomaly still held back.
     *
     * @return the pending anomaly, or {@code null}
     */
    public synchronized Anomaly flush() {
        if (state == DetectorState.DISPOSED) {
            return null;
        }
        Anomaly emitted = pendingCollective;
        pendingCollective = null;
        // a held-back collective implies the run it came from is already closed
        if (emitted == null && collective != null) {
            CollectiveRunTracker.Run run = collective.close();
            if (run != null) {
                emitted = AnomalyFactory.collective(metricName, run, algorithm, config);
            }
        }
        return record(emitted);
    }

    /**
     * Release the window. Further calls to {@link #process(Sample)} fail.
     */
    public synchronized void dispose() {
        if (state == DetectorState.DISPOSED) {
            return;
        }
        state = DetectorState.DISPOSED;
        pendingCollective = null;
        runningStats.clear();
        LOG.debug("[{}] disposed after {} point(s)", id, processedCount);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getMetricName() {
        return metricName;
    }

    public DetectionConfig getConfig() {
        return config;
    }

    public synchronized DetectorState getState() {
        return state;
    }

    public synchronized long getProcessedCount() {
        return processedCount;
    }

    public synchronized long getAnomalyCount() {
        return anomalyCount;
    }

    public synchronized Instant getLastAnomalyAt() {
        return lastAnomalyAt;
    }

    public synchronized int getWindowFill() {
        return window.size();
    }

    /** Incrementally tracked mean of the current window. */
    public synchronized double getWindowMean() {
        return runningStats.getMean();
    }

    /** Incrementally tracked population standard deviation of the current window. */
    public synchronized double getWindowStdDev() {
        return runningStats.getStdDev();
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private void append(Sample sample) {
        Sample evicted = window.push(sample);
        if (evicted != null) {
            runningStats.remove(evicted.getValue());
        }
        runningStats.add(sample.getValue());
        if (evicted != null && ++evictionsSinceAnchor >= config.getWindowSize()) {
            runningStats.reset(Stats.values(window.asOrderedSequence()));
            evictionsSinceAnchor = 0;
        }
        processedCount++;
        state = window.size() >= config.getMinSamples() ? DetectorState.ACTIVE : DetectorState.WARMING;
    }

    private Anomaly record(Anomaly emitted) {
        if (emitted != null) {
            anomalyCount++;
            lastAnomalyAt = emitted.getTimestamp();
            LOG.debug("[{}] {} anomaly at {}: value={} score={} severity={}", id, emitted.getType().id(),
                    emitted.getTimestamp(), emitted.getValue(), emitted.getScore(), emitted.getSeverity().id());
        }
        return emitted;
    }

    @Override
    public String toString() {
        return "StreamingDetector{id='" + id + "', metric='" + metricName + "', algorithm="
                + config.getAlgorithm().id() + '}';
    }
}
