package com.metricsentinel.core.algorithm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of scoring one candidate point against its window.
 *
 * <p>
 * {@link Verdict#INSUFFICIENT_DATA} lets callers tell "not anomalous" apart
 * from "not enough history to say"; in both cases {@link #isAnomalous()} is
 * {@code false} and the score is 0.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoreResult {

    /** Reason attached to a score. */
    public enum Verdict {
        ANOMALOUS,
        NORMAL,
        INSUFFICIENT_DATA
    }

    private final double score;
    private final boolean anomalous;
    private final double expectedValue;
    private final Verdict verdict;
    private final boolean contextual;
    private final Map<String, Object> details;

    private ScoreResult(double score, boolean anomalous, double expectedValue, Verdict verdict,
            boolean contextual, Map<String, Object> details) {
        this.score = score;
        this.anomalous = anomalous;
        this.expectedValue = expectedValue;
        this.verdict = verdict;
        this.contextual = contextual;
        this.details = details;
    }

    /**
     * Compare {@code score} against {@code threshold}: anomalous iff strictly
     * greater.
     */
    public static ScoreResult evaluate(double score, double threshold, double expectedValue) {
        return of(score, score > threshold, expectedValue);
    }

    public static ScoreResult of(double score, boolean anomalous, double expectedValue) {
        return new ScoreResult(score, anomalous, expectedValue,
                anomalous ? Verdict.ANOMALOUS : Verdict.NORMAL, false, Map.of());
    }

    /**
     * @param available samples in the window
     * @param required  configured {@code minSamples}
     */
    public static ScoreResult insufficientData(int available, int required) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("available", available);
        details.put("required", required);
        return new ScoreResult(0.0, false, Double.NaN, Verdict.INSUFFICIENT_DATA, false,
                Collections.unmodifiableMap(details));
    }

    public ScoreResult withDetails(Map<String, Object> extra) {
        Objects.requireNonNull(extra, "details must not be null");
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(extra);
        return new ScoreResult(score, anomalous, expectedValue, verdict, contextual,
                Collections.unmodifiableMap(merged));
    }

    public ScoreResult withExpectedValue(double expected) {
        return new ScoreResult(score, anomalous, expected, verdict, contextual, details);
    }

    /** Mark this result as computed against a seasonal baseline. */
    public ScoreResult asContextual() {
        return new ScoreResult(score, anomalous, expectedValue, verdict, true, details);
    }

    public double getScore() {
        return score;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isInsufficientData() {
        return verdict == Verdict.INSUFFICIENT_DATA;
    }

    public boolean isContextual() {
        return contextual;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "ScoreResult{" +
                "score=" + score +
                ", verdict=" + verdict +
                ", expected=" + expectedValue +
                (contextual ? ", contextual" : "") +
                '}';
    }
}
