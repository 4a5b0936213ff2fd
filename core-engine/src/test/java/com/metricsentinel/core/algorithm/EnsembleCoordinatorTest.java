package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.config.TieBreakPolicy;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EnsembleCoordinator}.
 */
class EnsembleCoordinatorTest {

    private final DetectionConfig config = DetectionConfig.builder().windowSize(50).minSamples(10).build();

    @Test
    @DisplayName("Should NOT flag an exact half split by default")
    void shouldFavorPrecisionOnTie() {
        EnsembleCoordinator ensemble = new EnsembleCoordinator(
                List.of(fixed(Algorithm.ZSCORE, 5.0, true), fixed(Algorithm.IQR, 1.0, false)),
                TieBreakPolicy.FAVOR_PRECISION);

        assertThat(ensemble.score(window(20), at(20, 1), config).isAnomalous()).isFalse();
    }

    @Test
    @DisplayName("Should NOT flag a 2-2 split among four members")
    void shouldNotFlagFourWayTie() {
        EnsembleCoordinator ensemble = new EnsembleCoordinator(List.of(
                fixed(Algorithm.ZSCORE, 5.0, true),
                fixed(Algorithm.MODIFIED_ZSCORE, 4.0, true),
                fixed(Algorithm.IQR, 1.0, false),
                fixed(Algorithm.ISOLATION_FOREST, 0.0, false)),
                TieBreakPolicy.FAVOR_PRECISION);

        ScoreResult result = ensemble.score(window(20), at(20, 1), config);

        assertThat(result.isAnomalous()).isFalse();
        assertThat(result.getDetails()).containsEntry("votes", 2).containsEntry("members", 4);
    }

    @Test
    @DisplayName("Should flag an exact half split when favoring recall")
    void shouldFavorRecallWhenConfigured() {
        EnsembleCoordinator ensemble = new EnsembleCoordinator(
                List.of(fixed(Algorithm.ZSCORE, 5.0, true), fixed(Algorithm.IQR, 1.0, false)),
                TieBreakPolicy.FAVOR_RECALL);

        assertThat(ensemble.score(window(20), at(20, 1), config).isAnomalous()).isTrue();
    }

    @Test
    @DisplayName("Should flag on a strict majority and average normalized scores")
    void shouldFlagOnMajority() {
        EnsembleCoordinator ensemble = new EnsembleCoordinator(List.of(
                fixed(Algorithm.ZSCORE, 5.0, true),
                fixed(Algorithm.MODIFIED_ZSCORE, 3.0, true),
                fixed(Algorithm.IQR, 0.5, false)),
                TieBreakPolicy.FAVOR_PRECISION);

        ScoreResult result = ensemble.score(window(20), at(20, 1), config);

        assertThat(result.isAnomalous()).isTrue();
        // (5 + 3 + 0.5) / 2.5 / 3
        assertThat(result.getScore()).isCloseTo(8.5 / 2.5 / 3, within(1e-12));
        assertThat(ensemble.effectiveThreshold(config)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record each member's verdict under contributors")
    @SuppressWarnings("unchecked")
    void shouldRecordContributors() {
        EnsembleCoordinator ensemble = new EnsembleCoordinator(List.of(
                fixed(Algorithm.ZSCORE, 5.0, true),
                fixed(Algorithm.IQR, 0.5, false)),
                TieBreakPolicy.FAVOR_PRECISION);

        ScoreResult result = ensemble.score(window(20), at(20, 1), config);

        Map<String, Object> contributors =
                (Map<String, Object>) result.getDetails().get(EnsembleCoordinator.CONTRIBUTORS);
        assertThat(contributors).containsOnlyKeys("zscore", "iqr");
        assertThat((Map<String, Object>) contributors.get("zscore")).containsEntry("anomalous", true);
        assertThat((Map<String, Object>) contributors.get("iqr")).containsEntry("anomalous", false);
    }

    @Test
    @DisplayName("Should expose contributor verdicts read-only")
    @SuppressWarnings("unchecked")
    void shouldExposeContributorsReadOnly() {
        EnsembleCoordinator ensemble = new EnsembleCoordinator(List.of(
                fixed(Algorithm.ZSCORE, 5.0, true),
                fixed(Algorithm.IQR, 0.5, false)),
                TieBreakPolicy.FAVOR_PRECISION);

        ScoreResult result = ensemble.score(window(20), at(20, 1), config);

        Map<String, Object> contributors =
                (Map<String, Object>) result.getDetails().get(EnsembleCoordinator.CONTRIBUTORS);
        Map<String, Object> zscore = (Map<String, Object>) contributors.get("zscore");
        assertThatThrownBy(() -> contributors.remove("iqr"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> zscore.put("anomalous", false))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(zscore).containsEntry("anomalous", true);
    }

    @Test
    @DisplayName("Should average the members' expected values")
    void shouldAverageExpectedValues() {
        EnsembleCoordinator ensemble = new EnsembleCoordinator(List.of(
                fixed(Algorithm.ZSCORE, 0, false, 10.0),
                fixed(Algorithm.IQR, 0, false, 14.0)),
                TieBreakPolicy.FAVOR_PRECISION);

        assertThat(ensemble.score(window(20), at(20, 1), config).getExpectedValue()).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Should flag a clear spike with all five default members agreeing")
    void shouldFlagSpikeWithDefaultMembers() {
        DetectionAlgorithm ensemble = AlgorithmFactory.create(DetectionConfig.batchDefaults());
        DetectionConfig batch = DetectionConfig.batchDefaults();

        ScoreResult result = ensemble.score(window(60), at(60, 500), batch);

        assertThat(result.isAnomalous()).isTrue();
        assertThat(result.getDetails()).containsEntry("votes", 5);
    }

    @Test
    @DisplayName("Should report insufficient data without consulting members")
    void shouldReportInsufficientData() {
        EnsembleCoordinator ensemble = new EnsembleCoordinator(
                List.of(fixed(Algorithm.ZSCORE, 5.0, true)), TieBreakPolicy.FAVOR_PRECISION);

        assertThat(ensemble.score(window(5), at(5, 1), config).isInsufficientData()).isTrue();
    }

    @Test
    @DisplayName("Should reject an empty member list")
    void shouldRejectEmptyMembers() {
        assertThatThrownBy(() -> new EnsembleCoordinator(List.of(), TieBreakPolicy.FAVOR_PRECISION))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DetectionAlgorithm fixed(Algorithm id, double score, boolean anomalous) {
        return fixed(id, score, anomalous, 0.0);
    }

    private static DetectionAlgorithm fixed(Algorithm id, double score, boolean anomalous, double expected) {
        return new DetectionAlgorithm() {
            @Override
            public Algorithm id() {
                return id;
            }

            @Override
            public ScoreResult score(ScoringWindow window, Sample candidate, DetectionConfig config) {
                return ScoreResult.of(score, anomalous, expected);
            }
        };
    }

    private static ScoringWindow window(int n) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            samples.add(at(i, 50 + ((i * 37) % 21 - 10) / 10.0));
        }
        return ScoringWindow.of(samples);
    }

    private static Sample at(int minute, double value) {
        return Sample.of(Instant.parse("2024-01-01T00:00:00Z").plusSeconds(60L * minute), value);
    }
}
