package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base class that applies the minimum-samples guard before delegating to
 * {@link #evaluate(ScoringWindow, Sample, DetectionConfig)}.
 *
 * @since 1.0.0
 */
public abstract class WindowAlgorithm implements DetectionAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(WindowAlgorithm.class);

    @Override
    public final ScoreResult score(ScoringWindow window, Sample candidate, DetectionConfig config) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (window.size() < config.getMinSamples()) {
            LOG.trace("[{}] insufficient data: {} < {} samples", id().id(),
                    window.size(), config.getMinSamples());
            return ScoreResult.insufficientData(window.size(), config.getMinSamples());
        }
        return evaluate(window, candidate, config);
    }

    /**
     * Score a candidate once the window is known to be large enough.
     */
    protected abstract ScoreResult evaluate(ScoringWindow window, Sample candidate, DetectionConfig config);
}
