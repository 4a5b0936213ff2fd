package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Document root of {@code detectors.yml}.
 *
 * <pre>
 * detectors:
 *   - metric: cpu_usage
 *     algorithm: modified_zscore
 *     sensitivity: high
 *     windowSize: 60
 *     minSamples: 15
 * </pre>
 *
 * <p>
 * Holds entries exactly as written; {@link DetectorProfilesLoader#resolve}
 * turns them into validated configurations.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorProfiles implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<DetectorProfile> detectors = new ArrayList<>();

    /**
     * @return unmodifiable list of entries; may contain {@code null} for an
     *         empty YAML list item
     */
    public List<DetectorProfile> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<DetectorProfile> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "DetectorProfiles{detectors=" + detectors + '}';
    }
}
