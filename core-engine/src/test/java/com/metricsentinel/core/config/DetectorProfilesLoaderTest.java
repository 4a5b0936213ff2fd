package com.metricsentinel.core.config;

import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sensitivity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorProfilesLoader}.
 */
class DetectorProfilesLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should resolve classpath profiles keyed by metric in declaration order")
    void shouldLoadFromClasspath() {
        Map<String, DetectionConfig> configs = DetectorProfilesLoader.fromClasspath("test-detectors.yml");

        assertThat(configs).containsOnlyKeys("cpu_usage", "disk_usage", "error_rate");
        assertThat(configs.keySet()).containsExactly("cpu_usage", "disk_usage", "error_rate");
    }

    @Test
    @DisplayName("Should overlay each profile on the streaming defaults")
    void shouldResolveProfiles() {
        Map<String, DetectionConfig> configs = DetectorProfilesLoader.fromClasspath("test-detectors.yml");

        DetectionConfig cpu = configs.get("cpu_usage");
        assertThat(cpu.getAlgorithm()).isEqualTo(Algorithm.ZSCORE);
        assertThat(cpu.getSensitivity()).isEqualTo(Sensitivity.HIGH);
        assertThat(cpu.getWindowSize()).isEqualTo(30);
        assertThat(cpu.getMinSamples()).isEqualTo(10);
        assertThat(cpu.isEnableRealtime()).isTrue();

        DetectionConfig disk = configs.get("disk_usage");
        assertThat(disk.getAlgorithm()).isEqualTo(Algorithm.SEASONAL_ESD);
        assertThat(disk.isEnableContextual()).isTrue();
        assertThat(disk.getThreshold()).isEqualTo(3.0);

        assertThat(configs.get("error_rate")).isEqualTo(DetectionConfig.streamingDefaults());
    }

    @Test
    @DisplayName("Should return an unmodifiable map")
    void shouldReturnUnmodifiableMap() {
        Map<String, DetectionConfig> configs = DetectorProfilesLoader.fromClasspath("test-detectors.yml");

        assertThatThrownBy(() -> configs.remove("cpu_usage"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should load the bundled default profiles")
    void shouldLoadBundledDefaults() {
        Map<String, DetectionConfig> configs = DetectorProfilesLoader.bundled();

        assertThat(configs).containsKeys("cpu_usage", "memory_usage");
        assertThat(configs.values()).allMatch(DetectionConfig::isEnableRealtime);
    }

    @Test
    @DisplayName("Should report every invalid profile with its position and metric")
    void shouldReportAllInvalidProfiles() {
        assertThatThrownBy(() -> DetectorProfilesLoader.fromClasspath("invalid-detectors.yml"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Invalid detector profiles in invalid-detectors.yml")
                .hasMessageContaining("profile #1 'cpu_usage': Invalid DetectionConfig: "
                        + "'minSamples' (20) must be <= 'windowSize' (10)")
                .hasMessageContaining("profile #2 'memory_usage': Unknown algorithm: 'holt_winters'")
                .hasMessageContaining("profile #4 'disk_usage': duplicate metric, first declared by profile #3")
                .hasMessageNotContaining("profile #3 'disk_usage':");
    }

    @Test
    @DisplayName("Should report a profile without a metric by position")
    void shouldReportMissingMetric() {
        String yaml = "detectors:\n"
                + "  - metric: cpu_usage\n"
                + "  - algorithm: iqr\n"
                + "  -\n";

        assertThatThrownBy(() -> DetectorProfilesLoader.parse(yaml, "inline"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Invalid detector profiles in inline")
                .hasMessageContaining("profile #2: 'metric' is required")
                .hasMessageContaining("profile #3: empty entry");
    }

    @Test
    @DisplayName("Should resolve already-deserialized profiles")
    void shouldResolveProfilesObject() {
        DetectorProfiles profiles = new DetectorProfiles();
        profiles.setDetectors(Arrays.asList(profile("latency_ms", "iqr"), profile("latency_ms", "zscore")));

        assertThatThrownBy(() -> DetectorProfilesLoader.resolve(profiles))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("profile #2 'latency_ms': duplicate metric, first declared by profile #1");

        profiles.setDetectors(Arrays.asList(profile("latency_ms", "iqr")));
        assertThat(DetectorProfilesLoader.resolve(profiles).get("latency_ms").getAlgorithm())
                .isEqualTo(Algorithm.IQR);
    }

    @Test
    @DisplayName("Should return no configs for an empty document")
    void shouldHandleEmptyDocument() {
        assertThat(DetectorProfilesLoader.fromClasspath("empty-detectors.yml")).isEmpty();
    }

    @Test
    @DisplayName("Should load profiles from a file path")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("detectors.yml");
        Files.writeString(file, "detectors:\n  - metric: network_in\n    algorithm: iqr\n");

        Map<String, DetectionConfig> configs = DetectorProfilesLoader.fromFile(file);

        assertThat(configs).containsOnlyKeys("network_in");
        assertThat(configs.get("network_in").getAlgorithm()).isEqualTo(Algorithm.IQR);
        assertThat(DetectorProfilesLoader.fromFile(file.toString())).isEqualTo(configs);
    }

    @Test
    @DisplayName("Should reject malformed YAML")
    void shouldRejectMalformedYaml() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "detectors:\n  - metric: cpu\n    metric: memory\n");

        assertThatThrownBy(() -> DetectorProfilesLoader.fromFile(file))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Malformed detector profiles YAML in " + file);
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> DetectorProfilesLoader.fromFile(tempDir.resolve("nope.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> DetectorProfilesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DetectorProfile profile(String metric, String algorithm) {
        DetectorProfile profile = new DetectorProfile();
        profile.setMetric(metric);
        profile.setAlgorithm(algorithm);
        return profile;
    }
}
