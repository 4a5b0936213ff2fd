package com.metricsentinel.core.detection;

/**
 * Thrown when a point reaches a {@link StreamingDetector} that has already been
 * disposed.
 */
public class DetectorDisposedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String detectorId;

    public DetectorDisposedException(String detectorId) {
        super("Detector '" + detectorId + "' has been disposed");
        this.detectorId = detectorId;
    }

    public String getDetectorId() {
        return detectorId;
    }
}
