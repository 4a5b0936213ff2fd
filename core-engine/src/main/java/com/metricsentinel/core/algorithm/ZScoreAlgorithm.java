package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;
import com.metricsentinel.core.window.Stats;

import java.util.Map;

/**
 * Classic standard score: {@code |x − mean| / σ} with the population standard
 * deviation of the window.
 *
 * <p>
 * A constant window has no spread to measure against, so every candidate
 * scores 0 rather than being flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAlgorithm extends WindowAlgorithm {

    @Override
    public Algorithm id() {
        return Algorithm.ZSCORE;
    }

    @Override
    protected ScoreResult evaluate(ScoringWindow window, Sample candidate, DetectionConfig config) {
        double mean = window.mean();
        double stdDev = window.stdDev();

        if (Stats.isDegenerate(stdDev, mean)) {
            return ScoreResult.of(0.0, false, mean)
                    .withDetails(Map.of("mean", mean, "stdDev", stdDev, "degenerate", true));
        }

        double score = Math.abs(candidate.getValue() - mean) / stdDev;
        return ScoreResult.evaluate(score, config.getThreshold(), mean)
                .withDetails(Map.of("mean", mean, "stdDev", stdDev));
    }
}
