package com.metricsentinel.core.detection;

import com.metricsentinel.core.algorithm.ScoreResult;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks runs of borderline points for collective detection.
 *
 * <p>
 * A point is borderline when it was scored, was not flagged on its own, and
 * its score reached {@value #BORDERLINE_FRACTION} of the effective threshold.
 * A run of at least {@value #MIN_RUN_LENGTH} consecutive borderline points is
 * reported once, when the run closes, anchored at its highest-scoring point.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by a single batch run or streaming detector.
 * </p>
 *
 * @since 1.0.0
 */
final class CollectiveRunTracker {

    static final double BORDERLINE_FRACTION = 0.7;
    static final int MIN_RUN_LENGTH = 3;

    private final double floor;

    private final List<Instant> members = new ArrayList<>();
    private Sample peak;
    private ScoreResult peakResult;
    private ScoringWindow peakWindow;

    /**
     * @param effectiveThreshold threshold of the scoring algorithm
     */
    CollectiveRunTracker(double effectiveThreshold) {
        this.floor = BORDERLINE_FRACTION * effectiveThreshold;
    }

    /**
     * Feed the next scored point.
     *
     * @return the run this point closed, or {@code null}
     */
    Run observe(Sample sample, ScoringWindow window, ScoreResult result) {
        if (isBorderline(result)) {
            members.add(sample.getTimestamp());
            if (peak == null || result.getScore() > peakResult.getScore()) {
                peak = sample;
                peakResult = result;
                peakWindow = window;
            }
            return null;
        }
        return close();
    }

    /**
     * Close the current run.
     *
     * @return the run if it was long enough to report, otherwise {@code null}
     */
    Run close() {
        Run run = members.size() >= MIN_RUN_LENGTH
                ? new Run(List.copyOf(members), peak, peakResult, peakWindow)
                : null;
        members.clear();
        peak = null;
        peakResult = null;
        peakWindow = null;
        return run;
    }

    int openRunLength() {
        return members.size();
    }

    private boolean isBorderline(ScoreResult result) {
        return !result.isAnomalous() && !result.isInsufficientData() && result.getScore() >= floor;
    }

    /** A closed run of borderline points. */
    static final class Run {

        private final List<Instant> members;
        private final Sample peak;
        private final ScoreResult peakResult;
        private final ScoringWindow peakWindow;

        private Run(List<Instant> members, Sample peak, ScoreResult peakResult, ScoringWindow peakWindow) {
            this.members = members;
            this.peak = peak;
            this.peakResult = peakResult;
            this.peakWindow = peakWindow;
        }

        List<Instant> members() {
            return members;
        }

        int length() {
            return members.size();
        }

        Instant start() {
            return members.get(0);
        }

        Instant end() {
            return members.get(members.size() - 1);
        }

        Sample peak() {
            return peak;
        }

        ScoreResult peakResult() {
            return peakResult;
        }

        ScoringWindow peakWindow() {
            return peakWindow;
        }
    }
}
