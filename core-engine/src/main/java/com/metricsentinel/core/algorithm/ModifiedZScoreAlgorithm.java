package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;
import com.metricsentinel.core.window.Stats;

import java.util.Map;

/**
 * Robust standard score after Iglewicz and Hoaglin:
 * {@code 0.6745 · |x − median| / MAD}.
 *
 * <p>
 * Median and MAD are insensitive to the outliers already sitting in the
 * window, which makes this the default for streaming detectors.
 * </p>
 *
 * @since 1.0.0
 */
public class ModifiedZScoreAlgorithm extends WindowAlgorithm {

    /** Φ⁻¹(0.75); makes MAD a consistent estimator of σ for normal data. */
    static final double CONSISTENCY_CONSTANT = 0.6745;

    @Override
    public Algorithm id() {
        return Algorithm.MODIFIED_ZSCORE;
    }

    @Override
    protected ScoreResult evaluate(ScoringWindow window, Sample candidate, DetectionConfig config) {
        double[] values = window.values();
        double median = Stats.median(values);
        double mad = Stats.mad(values, median);

        if (Stats.isDegenerate(mad, median)) {
            return ScoreResult.of(0.0, false, median)
                    .withDetails(Map.of("median", median, "mad", mad, "degenerate", true));
        }

        double score = CONSISTENCY_CONSTANT * Math.abs(candidate.getValue() - median) / mad;
        return ScoreResult.evaluate(score, config.getThreshold(), median)
                .withDetails(Map.of("median", median, "mad", mad));
    }
}
