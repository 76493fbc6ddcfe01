package com.ads.signaldetection.config;

import com.ads.signaldetection.detector.DetectorOptions;
import com.ads.signaldetection.detector.SeverityThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Structured pipeline configuration: which detectors run on which metrics, and which sources feed
 * the pipeline. Scalar tuning knobs live next to the components that use them.
 */
@Validated
@ConfigurationProperties(prefix = "signal")
public record SignalDetectionProperties(
        @Valid @NotNull @DefaultValue List<DetectorProperties> detectors,
        @Valid @NotNull @DefaultValue List<SourceProperties> sources,
        // consecutive evaluation errors before a detector is deactivated
        @Positive @DefaultValue("5") int detectorFailureLimit
) {

    public record DetectorProperties(
            @NotBlank String id,
            @NotBlank @DefaultValue("statistical") String type,
            @NotNull @DefaultValue("*") List<String> metrics,
            // must match signal.window.size when set
            @Positive Integer windowSize,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("3.0") double stdDevThreshold,
            @DefaultValue("false") boolean useIqr,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.5") double iqrMultiplier,
            @DefaultValue("false") boolean useMad,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("3.0") double madThreshold,
            // must match signal.window.ema-alpha when set
            @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") Double emaAlpha,
            @Positive Integer minSamples,
            @DefaultValue("3.5") double severityMedium,
            @DefaultValue("4.0") double severityHigh,
            @DefaultValue("5.0") double severityCritical,
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("5.0") double confidenceScale
    ) {

        /**
         * Resolve options against the shared window settings.
         *
         * @throws ConfigurationException if a window setting disagrees with the window store
         */
        public DetectorOptions toOptions(int storeWindowSize, double storeEmaAlpha, int storeMinSamples) {
            if (windowSize != null && windowSize != storeWindowSize) {
                throw new ConfigurationException("Detector " + id + " window_size=" + windowSize
                        + " differs from the shared window size " + storeWindowSize);
            }
            if (emaAlpha != null && Double.compare(emaAlpha, storeEmaAlpha) != 0) {
                throw new ConfigurationException("Detector " + id + " ema_alpha=" + emaAlpha
                        + " differs from the shared ema alpha " + storeEmaAlpha);
            }
            return DetectorOptions.builder()
                    .windowSize(storeWindowSize)
                    .stdDevThreshold(stdDevThreshold)
                    .useIqr(useIqr)
                    .iqrMultiplier(iqrMultiplier)
                    .useMad(useMad)
                    .madThreshold(madThreshold)
                    .emaAlpha(storeEmaAlpha)
                    .minSamples(minSamples != null ? minSamples : storeMinSamples)
                    .metrics(metrics)
                    .severityThresholds(new SeverityThresholds(severityMedium, severityHigh, severityCritical))
                    .confidenceScale(confidenceScale)
                    .build()
                    .validate(id);
        }
    }

    public record SourceProperties(
            @NotBlank String id,
            @NotBlank String type,
            @DefaultValue("true") boolean enabled,
            Map<String, String> connection,
            @NotNull @DefaultValue("5s") Duration pollInterval,
            @Positive @DefaultValue("5") int connectAttempts,
            @NotNull @DefaultValue("500ms") Duration backoffBase,
            @NotNull @DefaultValue("30s") Duration backoffMax
    ) {

        public Map<String, String> connectionOrEmpty() {
            return connection == null ? Map.of() : connection;
        }

        public String connection(String key, String defaultValue) {
            return connectionOrEmpty().getOrDefault(key, defaultValue);
        }
    }
}
