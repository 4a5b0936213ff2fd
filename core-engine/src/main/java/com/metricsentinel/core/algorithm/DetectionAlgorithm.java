package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;

/**
 * Contract for all scoring strategies.
 *
 * <p>
 * Implementations are stateless per call: scoring the same window and
 * candidate twice yields the same result. The window holds the samples that
 * precede the candidate, oldest first; it never contains the candidate
 * itself.
 * </p>
 *
 * @since 1.0.0
 */
public interface DetectionAlgorithm {

    /**
     * @return the algorithm this strategy implements
     */
    Algorithm id();

    /**
     * Score {@code candidate} against {@code window}.
     *
     * <p>
     * Returns {@link ScoreResult#insufficientData(int, int)} when the window
     * holds fewer than {@code config.getMinSamples()} samples.
     * </p>
     *
     * @param window    preceding samples
     * @param candidate the point under evaluation
     * @param config    detection configuration
     * @return the score, verdict and expected value
     */
    ScoreResult score(ScoringWindow window, Sample candidate, DetectionConfig config);

    /**
     * Threshold that this strategy's score is measured against. Severity is
     * classified on {@code score / effectiveThreshold}.
     */
    default double effectiveThreshold(DetectionConfig config) {
        return config.getThreshold();
    }
}
