package com.ads.signaldetection.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A confirmed anomaly produced by a detector.
 *
 * Immutable once created. Owned by the event sink from creation until it is either
 * delivered or dead-lettered.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnomalyEvent {

    @JsonProperty("event_id")
    String eventId;

    @JsonProperty("detector_id")
    String detectorId;

    @JsonProperty("source_id")
    String sourceId;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
    Instant timestamp;

    @JsonProperty("severity")
    Severity severity;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("anomaly_type")
    String anomalyType;

    @JsonProperty("affected_metrics")
    Set<String> affectedMetrics;

    // getZScores() would otherwise surface as a second "zscores" property
    @JsonProperty("z_scores")
    @Getter(onMethod_ = @JsonProperty("z_scores"))
    Map<String, Double> zScores;

    @JsonProperty("raw_values")
    Map<String, Double> rawValues;

    @JsonProperty("predicted_values")
    Map<String, Double> predictedValues;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    /**
     * Identity used by downstream consumers to drop duplicates caused by at-least-once delivery:
     * detector_id + timestamp + affected_metrics (scoped by source).
     */
    @JsonIgnore
    public String deduplicationKey() {
        return deduplicationKey(detectorId, sourceId, timestamp, affectedMetrics);
    }

    public static String deduplicationKey(String detectorId, String sourceId, Instant timestamp, Set<String> affectedMetrics) {
        return detectorId + "|" + sourceId + "|" + timestamp + "|" + String.join(",", affectedMetrics);
    }

    /**
     * Event ids are derived from the deduplication key so that a re-detected or re-delivered
     * anomaly always carries the same id.
     */
    public static String eventIdFor(String detectorId, String sourceId, Instant timestamp, Set<String> affectedMetrics) {
        String key = deduplicationKey(detectorId, sourceId, timestamp, affectedMetrics);
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
