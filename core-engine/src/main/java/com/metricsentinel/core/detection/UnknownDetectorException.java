package com.metricsentinel.core.detection;

/**
 * Thrown when a detector id is not registered, either because it never was or
 * because the detector was removed or replaced.
 */
public class UnknownDetectorException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String detectorId;

    public UnknownDetectorException(String detectorId) {
        super("Unknown detector: '" + detectorId + "'");
        this.detectorId = detectorId;
    }

    public UnknownDetectorException(String detectorId, Throwable cause) {
        super("Unknown detector: '" + detectorId + "'", cause);
        this.detectorId = detectorId;
    }

    public String getDetectorId() {
        return detectorId;
    }
}
