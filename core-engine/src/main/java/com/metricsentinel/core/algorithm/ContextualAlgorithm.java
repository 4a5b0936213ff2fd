package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;
import com.metricsentinel.core.window.SeasonalProfile;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decorator that scores a single algorithm on deseasonalized values.
 *
 * <p>
 * Every window sample and the candidate are shifted by their hour-of-day
 * offset {@code cohortMean − overallMean}; the delegate scores the shifted
 * series and its expected value is moved back into raw units by adding the
 * candidate's offset. When the window has too little cohort history, or the
 * candidate's own hour has none, the delegate sees the raw values unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class ContextualAlgorithm implements DetectionAlgorithm {

    private final DetectionAlgorithm delegate;

    public ContextualAlgorithm(DetectionAlgorithm delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public Algorithm id() {
        return delegate.id();
    }

    @Override
    public double effectiveThreshold(DetectionConfig config) {
        return delegate.effectiveThreshold(config);
    }

    public DetectionAlgorithm getDelegate() {
        return delegate;
    }

    @Override
    public ScoreResult score(ScoringWindow window, Sample candidate, DetectionConfig config) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");

        SeasonalProfile profile = SeasonalProfile.of(window.samples());
        if (profile.baselineFor(candidate.getTimestamp()).isEmpty()) {
            return delegate.score(window, candidate, config);
        }

        List<Sample> adjusted = window.samples().stream()
                .map(s -> Sample.of(s.getTimestamp(), s.getValue() - profile.offsetFor(s.getTimestamp())))
                .toList();
        double offset = profile.offsetFor(candidate.getTimestamp());
        Sample adjustedCandidate = Sample.of(candidate.getTimestamp(), candidate.getValue() - offset);

        ScoreResult result = delegate.score(ScoringWindow.of(adjusted), adjustedCandidate, config);
        if (result.isInsufficientData()) {
            return result;
        }
        return result.withExpectedValue(result.getExpectedValue() + offset)
                .withDetails(Map.of("seasonalOffset", offset))
                .asContextual();
    }
}
