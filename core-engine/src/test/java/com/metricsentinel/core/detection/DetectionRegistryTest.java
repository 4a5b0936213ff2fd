package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.config.DetectorProfilesLoader;
import com.metricsentinel.core.config.InvalidConfigException;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Sample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.metricsentinel.core.detection.BatchDetectorTest.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionRegistry}.
 */
class DetectionRegistryTest {

    private final DetectionRegistry registry = new DetectionRegistry();

    private final DetectionConfig zscore = DetectionConfig.builder()
            .algorithm(Algorithm.ZSCORE)
            .windowSize(50)
            .minSamples(20)
            .build();

    @Test
    @DisplayName("Should replace the detector when a metric is registered twice")
    void shouldReplaceExistingDetector() {
        String first = registry.createStreamingDetector("cpu_usage", zscore);
        StreamingDetector old = registry.getDetector(first);

        String second = registry.createStreamingDetector("cpu_usage", DetectionConfig.streamingDefaults());

        assertThat(second).isNotEqualTo(first);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.contains(first)).isFalse();
        assertThat(old.getState()).isEqualTo(DetectorState.DISPOSED);
        assertThat(registry.detectorFor("cpu_usage")).get()
                .extracting(StreamingDetector::getId).isEqualTo(second);
        assertThatThrownBy(() -> registry.processStreamingPoint(first, at(0, 1)))
                .isInstanceOf(UnknownDetectorException.class)
                .hasMessageContaining(first);
    }

    @Test
    @DisplayName("Should throw for an unknown detector id")
    void shouldThrowForUnknownId() {
        assertThatThrownBy(() -> registry.processStreamingPoint("nope-1", at(0, 1)))
                .isInstanceOf(UnknownDetectorException.class)
                .extracting(e -> ((UnknownDetectorException) e).getDetectorId())
                .isEqualTo("nope-1");
        assertThatThrownBy(() -> registry.flush("nope-1")).isInstanceOf(UnknownDetectorException.class);
    }

    @Test
    @DisplayName("Should report a detector disposed after lookup as unknown")
    void shouldReportDisposedDetectorAsUnknown() {
        String id = registry.createStreamingDetector("cpu_usage", zscore);
        // same state another thread leaves behind when it replaces the detector mid-call
        registry.getDetector(id).dispose();

        assertThatThrownBy(() -> registry.processStreamingPoint(id, at(0, 1)))
                .isInstanceOf(UnknownDetectorException.class)
                .hasCauseInstanceOf(DetectorDisposedException.class);
        assertThatThrownBy(() -> registry.flush(id))
                .isInstanceOf(UnknownDetectorException.class);
    }

    @Test
    @DisplayName("Should only ever surface unknown-detector failures while a metric is being replaced")
    void shouldSurfaceOnlyUnknownDetectorDuringReplacement() throws Exception {
        registry.createStreamingDetector("cpu_usage", zscore);
        AtomicBoolean replacing = new AtomicBoolean(true);
        List<Throwable> unexpected = new CopyOnWriteArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> replacer = pool.submit(() -> {
                for (int i = 0; i < 2_000; i++) {
                    registry.createStreamingDetector("cpu_usage", zscore);
                }
                replacing.set(false);
            });
            Future<?> feeder = pool.submit(() -> {
                int minute = 0;
                while (replacing.get()) {
                    try {
                        String id = registry.detectorFor("cpu_usage").orElseThrow().getId();
                        registry.processStreamingPoint(id, at(minute++, 50));
                    } catch (UnknownDetectorException e) {
                        // replaced between lookup and processing
                    } catch (RuntimeException e) {
                        unexpected.add(e);
                    }
                }
            });
            replacer.get(60, TimeUnit.SECONDS);
            feeder.get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(unexpected).isEmpty();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should route metric points to the bound detector")
    void shouldRouteMetricPoints() {
        registry.createStreamingDetector("cpu_usage", zscore);

        registry.processMetricPoint("cpu_usage", at(0, 1));

        assertThat(registry.detectorFor("cpu_usage").orElseThrow().getProcessedCount()).isEqualTo(1);
        assertThatThrownBy(() -> registry.processMetricPoint("disk_usage", at(0, 1)))
                .isInstanceOf(UnknownDetectorException.class);
    }

    @Test
    @DisplayName("Should keep notifying listeners after one of them fails")
    void shouldIsolateListenerFailures() {
        String id = registry.createStreamingDetector("cpu_usage", zscore);
        List<Anomaly> received = new ArrayList<>();
        registry.addListener((detectorId, anomaly) -> {
            throw new IllegalStateException("boom");
        });
        registry.addListener((detectorId, anomaly) -> received.add(anomaly));

        Anomaly returned = null;
        for (Sample s : BatchDetectorTest.spikeSeries()) {
            Anomaly a = registry.processStreamingPoint(id, s);
            if (a != null) {
                returned = a;
            }
        }

        assertThat(returned).isNotNull();
        assertThat(received).containsExactly(returned);
    }

    @Test
    @DisplayName("Should dispose and unregister on remove")
    void shouldRemoveDetector() {
        String id = registry.createStreamingDetector("cpu_usage", zscore);
        StreamingDetector detector = registry.getDetector(id);

        assertThat(registry.removeStreamingDetector(id)).isTrue();
        assertThat(registry.removeStreamingDetector(id)).isFalse();
        assertThat(detector.getState()).isEqualTo(DetectorState.DISPOSED);
        assertThat(registry.detectorFor("cpu_usage")).isEmpty();
    }

    @Test
    @DisplayName("Should aggregate detector statistics")
    void shouldAggregateStats() {
        String cpu = registry.createStreamingDetector("cpu_usage", zscore);
        registry.createStreamingDetector("api_latency_ms", DetectionConfig.streamingDefaults());
        for (Sample s : BatchDetectorTest.spikeSeries()) {
            registry.processStreamingPoint(cpu, s);
        }

        RegistryStats stats = registry.getDetectorStats();

        assertThat(stats.getTotalDetectors()).isEqualTo(2);
        assertThat(stats.getActiveDetectors()).isEqualTo(1);
        assertThat(stats.count(DetectorState.CREATED)).isEqualTo(1);
        assertThat(stats.getAlgorithms()).containsExactlyInAnyOrder(Algorithm.ZSCORE, Algorithm.MODIFIED_ZSCORE);
        assertThat(stats.getPointsProcessed()).isEqualTo(100);
        assertThat(stats.getAnomaliesEmitted()).isEqualTo(1);
        assertThat(stats.getMetrics()).containsExactly("api_latency_ms", "cpu_usage");
    }

    @Test
    @DisplayName("Should create one detector per profile")
    void shouldCreateFromProfiles() {
        List<String> ids = registry.createAll(DetectorProfilesLoader.fromClasspath("test-detectors.yml"));

        assertThat(ids).hasSize(3);
        assertThat(registry.getDetectorStats().getMetrics())
                .containsExactly("cpu_usage", "disk_usage", "error_rate");
        assertThat(registry.detectorFor("cpu_usage").orElseThrow().getConfig().getAlgorithm())
                .isEqualTo(Algorithm.ZSCORE);
    }

    @Test
    @DisplayName("Should reject a blank metric name")
    void shouldRejectBlankMetric() {
        assertThatThrownBy(() -> registry.createStreamingDetector("", zscore))
                .isInstanceOf(InvalidConfigException.class);
    }
}
