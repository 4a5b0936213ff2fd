package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;
import com.metricsentinel.core.window.Stats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tukey fences on the interquartile range.
 *
 * <p>
 * The fence multiplier scales with the threshold as
 * {@code k = 0.6 · threshold}, which gives the textbook {@code 1.5 · IQR} at
 * medium sensitivity. The score is the outward distance from the nearer
 * quartile in units of {@code 0.6 · IQR}, so {@code score > threshold} exactly
 * when the candidate lies beyond a fence. Points between the quartiles score
 * 0.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrAlgorithm extends WindowAlgorithm {

    static final double FENCE_FACTOR = 0.6;

    @Override
    public Algorithm id() {
        return Algorithm.IQR;
    }

    @Override
    protected ScoreResult evaluate(ScoringWindow window, Sample candidate, DetectionConfig config) {
        double[] values = window.values();
        double q1 = Stats.percentile(values, 25.0);
        double q3 = Stats.percentile(values, 75.0);
        double iqr = q3 - q1;
        double midhinge = (q1 + q3) / 2.0;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("q1", q1);
        details.put("q3", q3);
        details.put("iqr", iqr);

        if (Stats.isDegenerate(iqr, midhinge)) {
            details.put("degenerate", true);
            return ScoreResult.of(0.0, false, midhinge).withDetails(details);
        }

        double k = FENCE_FACTOR * config.getThreshold();
        details.put("lowerFence", q1 - k * iqr);
        details.put("upperFence", q3 + k * iqr);

        double x = candidate.getValue();
        double distance;
        if (x < q1) {
            distance = q1 - x;
        } else if (x > q3) {
            distance = x - q3;
        } else {
            distance = 0.0;
        }

        double score = distance / (FENCE_FACTOR * iqr);
        return ScoreResult.evaluate(score, config.getThreshold(), midhinge).withDetails(details);
    }
}
