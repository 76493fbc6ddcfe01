package com.ads.signaldetection.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable snapshot of pipeline metrics exposed to operational tooling.
 *
 * This is a READ MODEL:
 * - No logic
 * - Nulls indicate "not yet initialized"
 */
public record MetricsSnapshot(

        /* -------- Counters -------- */
        @JsonProperty("samples_processed_total") long samplesProcessed,
        @JsonProperty("anomalies_detected_total") long anomaliesDetected,
        @JsonProperty("samples_dropped_total") long samplesDropped,
        @JsonProperty("spillover_writes_total") long spilloverWrites,
        @JsonProperty("spillover_replays_total") long spilloverReplays,
        @JsonProperty("delivery_failures_total") long deliveryFailures,
        @JsonProperty("batches_delivered_total") long batchesDelivered,
        @JsonProperty("detector_errors_total") long detectorErrors,

        /* -------- Detection latency -------- */
        @JsonProperty("detection_latency") LatencySummary detectionLatency,

        /* -------- Health -------- */
        @JsonProperty("last_updated_at") Instant lastUpdatedAt
) {

    public record LatencySummary(
            @JsonProperty("count") long count,
            @JsonProperty("mean_ms") double meanMillis,
            @JsonProperty("max_ms") double maxMillis
    ) {
        public static final LatencySummary EMPTY = new LatencySummary(0, 0.0, 0.0);
    }
}
