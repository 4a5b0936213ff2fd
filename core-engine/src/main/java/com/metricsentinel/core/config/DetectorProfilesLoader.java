package com.metricsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads detector profiles from YAML and resolves them into one validated
 * {@link DetectionConfig} per metric.
 *
 * <p>
 * Profiles are only ever read from a source the caller names: a file, a
 * classpath resource or an in-memory document. Each entry is overlaid on
 * {@link DetectionConfig#streamingDefaults()}. Resolution checks every entry
 * before failing, so one {@link InvalidConfigException} lists all broken
 * profiles, each identified by its 1-based position and metric:
 * </p>
 *
 * <pre>
 * Invalid detector profiles in detectors.yml:
 *   - profile #1 'cpu_usage': Invalid DetectionConfig: 'minSamples' (20) must be &lt;= 'windowSize' (10)
 *   - profile #4 'disk_usage': duplicate metric, first declared by profile #3
 * </pre>
 *
 * @since 1.0.0
 */
public final class DetectorProfilesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorProfilesLoader.class);

    /** Profiles bundled with the engine. */
    public static final String BUNDLED_RESOURCE = "detectors.yml";

    private DetectorProfilesLoader() {
        // static utility
    }

    /**
     * @return configurations from {@value #BUNDLED_RESOURCE}, keyed by metric
     */
    public static Map<String, DetectionConfig> bundled() {
        return fromClasspath(BUNDLED_RESOURCE);
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @return configurations keyed by metric, in declaration order
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws InvalidConfigException   if the document or any profile is invalid
     */
    public static Map<String, DetectionConfig> fromFile(Path path) {
        Objects.requireNonNull(path, "Profiles file path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Detector profiles file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return resolve(read(reader, path.toString()), path.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detector profiles file: " + path, e);
        }
    }

    /** @see #fromFile(Path) */
    public static Map<String, DetectionConfig> fromFile(String path) {
        Objects.requireNonNull(path, "Profiles file path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return configurations keyed by metric, in declaration order
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     * @throws InvalidConfigException   if the document or any profile is invalid
     */
    public static Map<String, DetectionConfig> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectorProfilesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return resolve(read(reader, resource), resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Resolve an in-memory YAML document.
     *
     * @param yaml   document text; must not be {@code null}
     * @param source name used in log and error messages
     * @throws InvalidConfigException if the document or any profile is invalid
     */
    public static Map<String, DetectionConfig> parse(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        return resolve(read(new StringReader(yaml), source), source);
    }

    /**
     * Validate already-deserialized profiles.
     *
     * @return configurations keyed by metric, in declaration order
     * @throws InvalidConfigException listing every invalid or duplicate entry
     */
    public static Map<String, DetectionConfig> resolve(DetectorProfiles profiles) {
        return resolve(profiles, "profiles");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DetectorProfiles read(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorProfiles.class, options));
        try {
            DetectorProfiles profiles = yaml.load(reader);
            return profiles != null ? profiles : new DetectorProfiles();
        } catch (YAMLException e) {
            throw new InvalidConfigException(
                    "Malformed detector profiles YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, DetectionConfig> resolve(DetectorProfiles profiles, String source) {
        Objects.requireNonNull(profiles, "DetectorProfiles must not be null");
        List<DetectorProfile> entries = profiles.getDetectors();
        Map<String, DetectionConfig> configs = new LinkedHashMap<>();
        Map<String, Integer> declaredAt = new HashMap<>();
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < entries.size(); i++) {
            int position = i + 1;
            DetectorProfile profile = entries.get(i);
            if (profile == null) {
                errors.add("profile #" + position + ": empty entry");
                continue;
            }
            String metric = profile.getMetric();
            boolean named = metric != null && !metric.isBlank();
            String label = named ? "profile #" + position + " '" + metric + "'" : "profile #" + position;

            Integer first = named ? declaredAt.putIfAbsent(metric, position) : null;
            if (first != null) {
                errors.add(label + ": duplicate metric, first declared by profile #" + first);
                continue;
            }
            try {
                configs.put(metric, profile.toDetectionConfig());
            } catch (InvalidConfigException e) {
                errors.add(label + ": " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigException("Invalid detector profiles in " + source + ":\n  - "
                    + String.join("\n  - ", errors));
        }
        if (configs.isEmpty()) {
            LOG.warn("No detector profiles defined in {}", source);
        } else {
            LOG.info("Resolved {} detector profile(s) from {}: {}", configs.size(), source, configs.keySet());
        }
        return Collections.unmodifiableMap(configs);
    }
}
