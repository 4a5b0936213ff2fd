package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.config.TieBreakPolicy;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Majority vote over member algorithms.
 *
 * <p>
 * The candidate is anomalous when strictly more than half of the members flag
 * it. An exact split is settled by the configured {@link TieBreakPolicy}.
 * The ensemble score is the mean of each member's score divided by that
 * member's own threshold, so it is already normalized and the ensemble's
 * effective threshold is 1. Per-member verdicts are reported under the
 * {@code contributors} detail key.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleCoordinator extends WindowAlgorithm {

    public static final String CONTRIBUTORS = "contributors";

    private final List<DetectionAlgorithm> members;
    private final TieBreakPolicy tieBreak;

    public EnsembleCoordinator(List<DetectionAlgorithm> members, TieBreakPolicy tieBreak) {
        Objects.requireNonNull(members, "members must not be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Ensemble needs at least one member");
        }
        this.members = List.copyOf(members);
        this.tieBreak = Objects.requireNonNull(tieBreak, "tieBreak must not be null");
    }

    @Override
    public Algorithm id() {
        return Algorithm.ENSEMBLE;
    }

    @Override
    public double effectiveThreshold(DetectionConfig config) {
        return 1.0;
    }

    public List<DetectionAlgorithm> getMembers() {
        return members;
    }

    public TieBreakPolicy getTieBreak() {
        return tieBreak;
    }

    @Override
    protected ScoreResult evaluate(ScoringWindow window, Sample candidate, DetectionConfig config) {
        int votes = 0;
        double normalizedSum = 0;
        double expectedSum = 0;
        boolean contextual = false;
        Map<String, Object> contributors = new LinkedHashMap<>();

        for (DetectionAlgorithm member : members) {
            ScoreResult r = member.score(window, candidate, config);
            if (r.isAnomalous()) {
                votes++;
                contextual |= r.isContextual();
            }
            normalizedSum += r.getScore() / member.effectiveThreshold(config);
            expectedSum += r.getExpectedValue();

            Map<String, Object> verdict = new LinkedHashMap<>();
            verdict.put("score", r.getScore());
            verdict.put("anomalous", r.isAnomalous());
            verdict.put("expectedValue", r.getExpectedValue());
            contributors.put(member.id().id(), Collections.unmodifiableMap(verdict));
        }

        int total = members.size();
        boolean anomalous;
        if (votes * 2 > total) {
            anomalous = true;
        } else if (votes * 2 == total) {
            anomalous = tieBreak.resolve();
        } else {
            anomalous = false;
        }

        ScoreResult result = ScoreResult.of(normalizedSum / total, anomalous, expectedSum / total)
                .withDetails(Map.of(CONTRIBUTORS, Collections.unmodifiableMap(contributors),
                        "votes", votes, "members", total));
        return anomalous && contextual ? result.asContextual() : result;
    }
}
