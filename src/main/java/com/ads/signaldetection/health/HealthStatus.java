package com.ads.signaldetection.health;

import com.ads.signaldetection.metrics.DetectorMetrics;
import com.ads.signaldetection.metrics.StreamMetrics;
import com.ads.signaldetection.source.SourceState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time health of the pipeline.
 *
 * @param detectorMetrics counters per detector id, for detectors that have seen a sample
 * @param sourceMetrics counters per source id, for sources that have produced a sample
 * @param reasons why the pipeline is degraded, empty when healthy
 */
public record HealthStatus(
        @JsonProperty("status") HealthState status,
        @JsonProperty("detectors") Map<String, Boolean> detectors,
        @JsonProperty("sources") Map<String, SourceState> sources,
        @JsonProperty("detector_metrics") Map<String, DetectorMetrics> detectorMetrics,
        @JsonProperty("source_metrics") Map<String, StreamMetrics> sourceMetrics,
        @JsonProperty("queue_depth") int queueDepth,
        @JsonProperty("queue_capacity") int queueCapacity,
        @JsonProperty("overflow_depth") long overflowDepth,
        @JsonProperty("dead_letters") long deadLetters,
        @JsonProperty("uptime_seconds") long uptimeSeconds,
        @JsonProperty("reasons") List<String> reasons
) {

    public boolean isHealthy() {
        return status == HealthState.HEALTHY;
    }
}
