package com.ads.signaldetection.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Per-detector counters as exposed by health reporting.
 *
 * @param lastDetection when the detector last raised an event, null if it never has
 */
public record DetectorMetrics(
        @JsonProperty("samples_processed") long samplesProcessed,
        @JsonProperty("anomalies_detected") long anomaliesDetected,
        @JsonProperty("errors") long errors,
        @JsonProperty("avg_latency_ms") double averageLatencyMillis,
        @JsonProperty("last_detection") Instant lastDetection
) {
}
