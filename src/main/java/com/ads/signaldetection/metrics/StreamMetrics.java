package com.ads.signaldetection.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Per-source counters as exposed by health reporting.
 * <p>
 * Spilled counts samples once their batch is on disk, so a sample staged for spillover is
 * received but not yet spilled.
 */
public record StreamMetrics(
        @JsonProperty("messages_received") long messagesReceived,
        @JsonProperty("messages_enqueued") long messagesEnqueued,
        @JsonProperty("messages_spilled") long messagesSpilled,
        @JsonProperty("messages_dropped") long messagesDropped,
        @JsonProperty("messages_processed") long messagesProcessed,
        @JsonProperty("last_message") Instant lastMessage
) {
}
