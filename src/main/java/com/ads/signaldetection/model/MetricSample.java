package com.ads.signaldetection.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A single observation of one metric from one source.
 *
 * Immutable once built. Ordering is only meaningful between samples of the same source.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MetricSample {

    @JsonProperty("source_id")
    String sourceId;

    @JsonProperty("metric_name")
    String metricName;

    @JsonProperty("value")
    double value;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
    Instant timestamp;

    public WindowKey key() {
        return new WindowKey(sourceId, metricName);
    }
}
