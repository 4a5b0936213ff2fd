package com.metricsentinel.core.detection;

import com.metricsentinel.core.algorithm.DetectionAlgorithm;
import com.metricsentinel.core.algorithm.ScoreResult;
import com.metricsentinel.core.classify.ContextAnalyzer;
import com.metricsentinel.core.classify.ExplanationGenerator;
import com.metricsentinel.core.classify.RecommendationCatalog;
import com.metricsentinel.core.classify.SeverityClassifier;
import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;
import com.metricsentinel.core.window.SeasonalProfile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns scored points into fully labeled {@link Anomaly} records. Shared by the
 * batch and streaming paths so both produce identical output for the same
 * input.
 */
final class AnomalyFactory {

    private AnomalyFactory() {
        // static utility
    }

    static Anomaly point(String metricName, Sample candidate, ScoringWindow window, ScoreResult result,
            DetectionAlgorithm algorithm, DetectionConfig config) {
        double threshold = algorithm.effectiveThreshold(config);
        Map<String, Object> metadata = baseMetadata(window, result, algorithm, threshold);

        return Anomaly.builder()
                .metricName(metricName)
                .timestamp(candidate.getTimestamp())
                .value(candidate.getValue())
                .expectedValue(result.getExpectedValue())
                .score(result.getScore())
                .severity(SeverityClassifier.classify(result.getScore(), threshold))
                .type(result.isContextual() ? AnomalyType.CONTEXTUAL : AnomalyType.POINT)
                .algorithm(algorithm.id())
                .confidence(algorithm.id().nominalConfidence())
                .explanation(ExplanationGenerator.explainPoint(metricName, algorithm.id(), result.isContextual(),
                        candidate.getValue(), result.getExpectedValue(), result.getScore(), threshold))
                .recommendations(RecommendationCatalog.forMetric(metricName, candidate.getValue(),
                        result.getExpectedValue()))
                .context(ContextAnalyzer.analyze(metricName, window.samples(),
                        SeasonalProfile.of(window.samples()).isUsable()))
                .metadata(metadata)
                .build();
    }

    static Anomaly collective(String metricName, CollectiveRunTracker.Run run, DetectionAlgorithm algorithm,
            DetectionConfig config) {
        double threshold = algorithm.effectiveThreshold(config);
        Sample peak = run.peak();
        ScoreResult result = run.peakResult();
        ScoringWindow window = run.peakWindow();

        Map<String, Object> metadata = baseMetadata(window, result, algorithm, threshold);
        metadata.put("runStart", run.start());
        metadata.put("runEnd", run.end());
        metadata.put("runLength", run.length());

        return Anomaly.builder()
                .metricName(metricName)
                .timestamp(peak.getTimestamp())
                .value(peak.getValue())
                .expectedValue(result.getExpectedValue())
                .score(result.getScore())
                .severity(SeverityClassifier.classify(result.getScore(), threshold))
                .type(AnomalyType.COLLECTIVE)
                .algorithm(algorithm.id())
                .confidence(algorithm.id().nominalConfidence())
                .explanation(ExplanationGenerator.explainCollective(metricName, algorithm.id(), run.length(),
                        peak.getValue(), result.getExpectedValue(), result.getScore(), threshold))
                .recommendations(RecommendationCatalog.forMetric(metricName, peak.getValue(),
                        result.getExpectedValue()))
                .context(ContextAnalyzer.analyze(metricName, window.samples(),
                        SeasonalProfile.of(window.samples()).isUsable()))
                .metadata(metadata)
                .build();
    }

    private static Map<String, Object> baseMetadata(ScoringWindow window, ScoreResult result,
            DetectionAlgorithm algorithm, double threshold) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("algorithm", algorithm.id().id());
        metadata.put("threshold", threshold);
        metadata.put("windowStart", window.start());
        metadata.put("windowEnd", window.end());
        metadata.put("windowSize", window.size());
        metadata.putAll(result.getDetails());
        return metadata;
    }
}
