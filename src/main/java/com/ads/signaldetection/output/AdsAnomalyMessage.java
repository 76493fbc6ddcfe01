package com.ads.signaldetection.output;

import com.ads.signaldetection.model.AnomalyEvent;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire shape of an anomaly on the memory channel: a data point whose values are the raw
 * readings, with the detection details in its metadata.
 */
public record AdsAnomalyMessage(
        @JsonProperty("timestamp")
        @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
        Instant timestamp,
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("values") Map<String, Double> values,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    public static AdsAnomalyMessage from(AnomalyEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event_id", event.getEventId());
        metadata.put("detector_id", event.getDetectorId());
        metadata.put("confidence", event.getConfidence());
        metadata.put("severity", event.getSeverity());
        metadata.put("anomaly_type", event.getAnomalyType());
        metadata.put("affected_metrics", event.getAffectedMetrics());
        metadata.put("z_scores", event.getZScores());
        metadata.put("predicted_values", event.getPredictedValues());
        if (event.getMetadata() != null) {
            event.getMetadata().forEach(metadata::putIfAbsent);
        }
        return new AdsAnomalyMessage(event.getTimestamp(), event.getSourceId(), event.getRawValues(), metadata);
    }
}
