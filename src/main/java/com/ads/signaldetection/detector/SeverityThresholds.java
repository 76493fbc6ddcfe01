package com.ads.signaldetection.detector;

import com.ads.signaldetection.model.Severity;

/**
 * Monotonic step function from an anomaly score to a {@link Severity}.
 *
 * A score strictly above {@code critical} is CRITICAL, above {@code high} is HIGH, above
 * {@code medium} is MEDIUM, anything else LOW.
 */
public record SeverityThresholds(double medium, double high, double critical) {

    public static final SeverityThresholds DEFAULT = new SeverityThresholds(3.5, 4.0, 5.0);

    public Severity classify(double score) {
        if (score > critical) {
            return Severity.CRITICAL;
        }
        if (score > high) {
            return Severity.HIGH;
        }
        if (score > medium) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    void validate(String detectorId) {
        DetectorOptions.require(medium > 0 && medium <= high && high <= critical, detectorId,
                "severity thresholds must satisfy 0 < medium <= high <= critical, got "
                        + medium + "/" + high + "/" + critical);
    }
}
