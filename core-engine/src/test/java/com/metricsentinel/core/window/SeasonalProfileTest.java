package com.metricsentinel.core.window;

import com.metricsentinel.core.model.Sample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalProfile}.
 */
class SeasonalProfileTest {

    private static final Instant MIDNIGHT = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    @DisplayName("Should compute hour-of-day baselines and offsets")
    void shouldComputeCohortBaselines() {
        // hour 0 → 10, hour 1 → 30, three days each
        List<Sample> samples = new ArrayList<>();
        for (int day = 0; day < 3; day++) {
            Instant base = MIDNIGHT.plus(Duration.ofDays(day));
            samples.add(Sample.of(base, 10));
            samples.add(Sample.of(base.plus(Duration.ofHours(1)), 30));
        }

        SeasonalProfile profile = SeasonalProfile.of(samples);

        assertThat(profile.isUsable()).isTrue();
        assertThat(profile.overallMean()).isCloseTo(20.0, within(1e-12));
        assertThat(profile.baselineFor(MIDNIGHT).getAsDouble()).isCloseTo(10.0, within(1e-12));
        assertThat(profile.offsetFor(MIDNIGHT.plus(Duration.ofHours(1)))).isCloseTo(10.0, within(1e-12));
    }

    @Test
    @DisplayName("Should be unusable with fewer than two qualified cohorts")
    void shouldBeUnusableWithOneCohort() {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            samples.add(Sample.of(MIDNIGHT.plusSeconds(i * 60L), 5));
        }

        SeasonalProfile profile = SeasonalProfile.of(samples);

        assertThat(profile.isUsable()).isFalse();
        assertThat(profile.baselineFor(MIDNIGHT)).isEmpty();
        assertThat(profile.offsetFor(MIDNIGHT)).isZero();
    }

    @Test
    @DisplayName("Should report no baseline for an hour without enough history")
    void shouldReportNoBaselineForThinCohort() {
        List<Sample> samples = new ArrayList<>();
        for (int day = 0; day < 3; day++) {
            Instant base = MIDNIGHT.plus(Duration.ofDays(day));
            samples.add(Sample.of(base, 10));
            samples.add(Sample.of(base.plus(Duration.ofHours(1)), 30));
        }

        SeasonalProfile profile = SeasonalProfile.of(samples);

        assertThat(profile.baselineFor(MIDNIGHT.plus(Duration.ofHours(5)))).isEmpty();
    }
}
