package com.ads.signaldetection.detector;

import com.ads.signaldetection.config.ConfigurationException;
import lombok.Builder;

import java.util.List;

/**
 * Enumerated options of one detector instance.
 *
 * {@code windowSize} and {@code emaAlpha} describe the shared per-(source, metric) window the
 * detector reads; they must agree with the window store.
 */
@Builder(toBuilder = true)
public record DetectorOptions(
        int windowSize,
        double stdDevThreshold,
        boolean useIqr,
        double iqrMultiplier,
        boolean useMad,
        double madThreshold,
        double emaAlpha,
        int minSamples,
        List<String> metrics,
        SeverityThresholds severityThresholds,
        double confidenceScale
) {

    public static DetectorOptions defaults() {
        return DetectorOptions.builder()
                .windowSize(100)
                .stdDevThreshold(3.0)
                .useIqr(false)
                .iqrMultiplier(1.5)
                .useMad(false)
                .madThreshold(3.0)
                .emaAlpha(0.1)
                .minSamples(10)
                .metrics(List.of())
                .severityThresholds(SeverityThresholds.DEFAULT)
                .confidenceScale(5.0)
                .build();
    }

    /**
     * @throws ConfigurationException if any option is out of range
     */
    public DetectorOptions validate(String detectorId) {
        require(windowSize > 0, detectorId, "window_size must be > 0, got " + windowSize);
        require(stdDevThreshold > 0, detectorId, "std_dev_threshold must be > 0, got " + stdDevThreshold);
        require(iqrMultiplier > 0, detectorId, "iqr_multiplier must be > 0, got " + iqrMultiplier);
        require(madThreshold > 0, detectorId, "mad_threshold must be > 0, got " + madThreshold);
        require(emaAlpha > 0 && emaAlpha <= 1, detectorId, "ema_alpha must be in (0, 1], got " + emaAlpha);
        require(minSamples >= 1 && minSamples <= windowSize, detectorId,
                "min_samples must be in [1, window_size], got " + minSamples);
        require(confidenceScale > 0, detectorId, "confidence_scale must be > 0, got " + confidenceScale);
        require(metrics != null, detectorId, "metrics must not be null");
        require(severityThresholds != null, detectorId, "severity thresholds must not be null");
        severityThresholds.validate(detectorId);
        return this;
    }

    /**
     * Metrics this detector subscribes to; empty means every metric.
     */
    public List<String> subscriptions() {
        return metrics == null || metrics.isEmpty() ? List.of(DetectorRegistry.ALL_METRICS) : metrics;
    }

    static void require(boolean condition, String detectorId, String message) {
        if (!condition) {
            throw new ConfigurationException("Invalid options for detector " + detectorId + ": " + message);
        }
    }
}
