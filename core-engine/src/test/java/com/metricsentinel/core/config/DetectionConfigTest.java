package com.metricsentinel.core.config;

import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sensitivity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionConfig} and its option objects.
 */
class DetectionConfigTest {

    @Test
    @DisplayName("Should apply batch defaults")
    void shouldApplyBatchDefaults() {
        DetectionConfig config = DetectionConfig.batchDefaults();

        assertThat(config.getAlgorithm()).isEqualTo(Algorithm.ENSEMBLE);
        assertThat(config.getSensitivity()).isEqualTo(Sensitivity.MEDIUM);
        assertThat(config.getWindowSize()).isEqualTo(100);
        assertThat(config.getMinSamples()).isEqualTo(20);
        assertThat(config.getThreshold()).isEqualTo(2.5);
        assertThat(config.isThresholdOverridden()).isFalse();
        assertThat(config.getEnsemble().getMembers()).containsExactlyElementsOf(Algorithm.SINGLE);
        assertThat(config.getEnsemble().getTieBreak()).isEqualTo(TieBreakPolicy.FAVOR_PRECISION);
    }

    @Test
    @DisplayName("Should apply streaming defaults")
    void shouldApplyStreamingDefaults() {
        DetectionConfig config = DetectionConfig.streamingDefaults();

        assertThat(config.getAlgorithm()).isEqualTo(Algorithm.MODIFIED_ZSCORE);
        assertThat(config.getWindowSize()).isEqualTo(50);
        assertThat(config.getMinSamples()).isEqualTo(10);
        assertThat(config.isEnableRealtime()).isTrue();
    }

    @Test
    @DisplayName("Should derive strictly decreasing thresholds from sensitivity")
    void shouldDeriveThresholdsFromSensitivity() {
        assertThat(thresholdFor(Sensitivity.LOW)).isEqualTo(3.5);
        assertThat(thresholdFor(Sensitivity.MEDIUM)).isEqualTo(2.5);
        assertThat(thresholdFor(Sensitivity.HIGH)).isEqualTo(2.0);
        assertThat(thresholdFor(Sensitivity.CRITICAL)).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Should prefer an explicit threshold over the sensitivity")
    void shouldPreferExplicitThreshold() {
        DetectionConfig config = DetectionConfig.builder().sensitivity(Sensitivity.LOW).threshold(1.2).build();

        assertThat(config.getThreshold()).isEqualTo(1.2);
        assertThat(config.isThresholdOverridden()).isTrue();
        assertThat(config.toBuilder().clearThreshold().build().getThreshold()).isEqualTo(3.5);
    }

    @Test
    @DisplayName("Should parse algorithm and sensitivity identifiers case-insensitively")
    void shouldParseIdentifiers() {
        DetectionConfig config = DetectionConfig.builder()
                .algorithm("Isolation_Forest")
                .sensitivity("CRITICAL")
                .build();

        assertThat(config.getAlgorithm()).isEqualTo(Algorithm.ISOLATION_FOREST);
        assertThat(config.getSensitivity()).isEqualTo(Sensitivity.CRITICAL);
    }

    @Test
    @DisplayName("Should reject unknown algorithm and sensitivity identifiers")
    void shouldRejectUnknownIdentifiers() {
        assertThatThrownBy(() -> DetectionConfig.builder().algorithm("prophet"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Unknown algorithm");
        assertThatThrownBy(() -> DetectionConfig.builder().sensitivity("extreme"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Unknown sensitivity");
    }

    @Test
    @DisplayName("Should collect every validation error into one exception")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> DetectionConfig.builder().windowSize(0).minSamples(-1).threshold(-2).build())
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("'windowSize' must be > 0")
                .hasMessageContaining("'minSamples' must be > 0")
                .hasMessageContaining("'threshold' must be a finite value > 0");
    }

    @Test
    @DisplayName("Should reject minSamples greater than windowSize")
    void shouldRejectMinSamplesAboveWindow() {
        assertThatThrownBy(() -> DetectionConfig.builder().windowSize(10).minSamples(11).build())
                .isInstanceOf(InvalidConfigException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'minSamples' (11) must be <= 'windowSize' (10)");
    }

    @Test
    @DisplayName("Should reject ensemble options that nest the ensemble or repeat a member")
    void shouldRejectInvalidEnsembleOptions() {
        assertThatThrownBy(() -> new EnsembleOptions(List.of(Algorithm.ZSCORE, Algorithm.ENSEMBLE),
                TieBreakPolicy.FAVOR_PRECISION))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> new EnsembleOptions(List.of(Algorithm.IQR, Algorithm.IQR),
                TieBreakPolicy.FAVOR_PRECISION))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> new EnsembleOptions(List.of(), TieBreakPolicy.FAVOR_RECALL))
                .isInstanceOf(InvalidConfigException.class);
    }

    @Test
    @DisplayName("Should validate per-algorithm option ranges")
    void shouldValidateOptionRanges() {
        assertThatThrownBy(() -> new IsolationForestOptions(0, 256, 1))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> new SeasonalEsdOptions(1.5, 0.1))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> new SeasonalEsdOptions(0.05, 0.9))
                .isInstanceOf(InvalidConfigException.class);
    }

    @Test
    @DisplayName("Should distinguish configs that differ only in algorithm options")
    void shouldCompareAlgorithmOptions() {
        DetectionConfig base = DetectionConfig.batchDefaults();
        DetectionConfig recall = base.toBuilder()
                .ensemble(new EnsembleOptions(Algorithm.SINGLE, TieBreakPolicy.FAVOR_RECALL))
                .build();
        DetectionConfig fewerMembers = base.toBuilder()
                .ensemble(new EnsembleOptions(List.of(Algorithm.ZSCORE, Algorithm.IQR),
                        TieBreakPolicy.FAVOR_PRECISION))
                .build();
        DetectionConfig reseeded = base.toBuilder()
                .isolationForest(new IsolationForestOptions(100, 256, 7L))
                .build();
        DetectionConfig looserEsd = base.toBuilder()
                .seasonalEsd(new SeasonalEsdOptions(0.1, 0.1))
                .build();

        assertThat(base.toBuilder().build()).isEqualTo(base).hasSameHashCodeAs(base);
        assertThat(recall).isNotEqualTo(base);
        assertThat(fewerMembers).isNotEqualTo(base);
        assertThat(reseeded).isNotEqualTo(base);
        assertThat(looserEsd).isNotEqualTo(base);
        assertThat(new EnsembleOptions(Algorithm.SINGLE, TieBreakPolicy.FAVOR_PRECISION))
                .isEqualTo(EnsembleOptions.defaults())
                .hasSameHashCodeAs(EnsembleOptions.defaults());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double thresholdFor(Sensitivity sensitivity) {
        return DetectionConfig.builder().sensitivity(sensitivity).build().getThreshold();
    }
}
