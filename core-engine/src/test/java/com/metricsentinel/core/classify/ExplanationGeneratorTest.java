package com.metricsentinel.core.classify;

import com.metricsentinel.core.model.Algorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExplanationGenerator}.
 */
class ExplanationGeneratorTest {

    @Test
    @DisplayName("Should name metric, direction, magnitude and algorithm")
    void shouldExplainPoint() {
        String text = ExplanationGenerator.explainPoint("cpu_usage", Algorithm.ZSCORE, false,
                95.0, 50.0, 12.31, 2.5);

        assertThat(text).isEqualTo(
                "cpu_usage reading 95.00 is 90.0% above the expected 50.00 (Z-Score score 12.31, threshold 2.50)");
    }

    @Test
    @DisplayName("Should mention the hour of day for contextual anomalies")
    void shouldMentionHourOfDay() {
        String text = ExplanationGenerator.explainPoint("api_latency_ms", Algorithm.IQR, true,
                40.0, 80.0, 3.0, 2.5);

        assertThat(text).contains("50.0% below the expected 80.00 for this hour of day")
                .contains("Interquartile Range");
    }

    @Test
    @DisplayName("Should describe the run length of collective anomalies")
    void shouldExplainCollective() {
        String text = ExplanationGenerator.explainCollective("memory_usage", Algorithm.ENSEMBLE, 7,
                88.0, 80.0, 0.8, 1.0);

        assertThat(text).startsWith("memory_usage stayed above the expected level for 7 consecutive points")
                .contains("peaking at 88.00");
    }

    @Test
    @DisplayName("Should fall back to the absolute difference when expected is zero")
    void shouldUseAbsoluteDifferenceNearZero() {
        assertThat(ExplanationGenerator.magnitude(3.0, 0.0)).isEqualTo("3.00");
        assertThat(ExplanationGenerator.magnitude(75.0, 50.0)).isEqualTo("50.0%");
    }
}
