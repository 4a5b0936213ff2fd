package com.metricsentinel.core.window;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RunningStatistics}.
 */
class RunningStatisticsTest {

    @Test
    @DisplayName("Should match the exact mean and population variance after adds")
    void shouldMatchExactMoments() {
        RunningStatistics stats = new RunningStatistics();
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
        for (double v : values) {
            stats.add(v);
        }

        assertThat(stats.getCount()).isEqualTo(8);
        assertThat(stats.getMean()).isCloseTo(5.0, within(1e-12));
        assertThat(stats.getVariance()).isCloseTo(4.0, within(1e-12));
        assertThat(stats.getStdDev()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should track a sliding window through add and remove")
    void shouldTrackSlidingWindow() {
        RunningStatistics stats = new RunningStatistics();
        Deque<Double> window = new ArrayDeque<>();
        for (int i = 0; i < 500; i++) {
            double v = 100 + 10 * Math.sin(i * 0.37) + (i % 7);
            window.addLast(v);
            stats.add(v);
            if (window.size() > 25) {
                stats.remove(window.pollFirst());
            }
        }

        double[] exact = window.stream().mapToDouble(Double::doubleValue).toArray();
        double mean = Stats.mean(exact);
        assertThat(stats.getCount()).isEqualTo(25);
        assertThat(stats.getMean()).isCloseTo(mean, within(1e-9));
        assertThat(stats.getStdDev()).isCloseTo(Stats.stdDev(exact, mean), within(1e-6));
    }

    @Test
    @DisplayName("Should re-anchor exactly on reset")
    void shouldResetExactly() {
        RunningStatistics stats = new RunningStatistics();
        stats.add(1_000_000);
        stats.reset(new double[] {1, 2, 3});

        assertThat(stats.getCount()).isEqualTo(3);
        assertThat(stats.getMean()).isEqualTo(2.0);
        assertThat(stats.getVariance()).isCloseTo(2.0 / 3.0, within(1e-12));
    }

    @Test
    @DisplayName("Should return to empty when the last value is removed")
    void shouldClearOnLastRemoval() {
        RunningStatistics stats = new RunningStatistics();
        stats.add(42);
        stats.remove(42);

        assertThat(stats.getCount()).isZero();
        assertThat(stats.getMean()).isZero();
        assertThat(stats.getVariance()).isZero();
    }

    @Test
    @DisplayName("Should reject removal from empty statistics")
    void shouldRejectRemovalFromEmpty() {
        assertThatThrownBy(() -> new RunningStatistics().remove(1))
                .isInstanceOf(IllegalStateException.class);
    }
}
