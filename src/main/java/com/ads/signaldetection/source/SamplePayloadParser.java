package com.ads.signaldetection.source;

import com.ads.signaldetection.model.MetricSample;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns a JSON payload into samples.
 * <p>
 * Two shapes are accepted:
 * <pre>
 * {"metric_name": "cpu_usage", "value": 93.1, "timestamp": "2024-01-01T00:00:00Z"}
 * {"timestamp": 1704067200.5, "cpu_usage": 93.1, "memory_usage": 71.0}
 * </pre>
 * In the second, every numeric field becomes a sample carrying the document timestamp.
 * Timestamps are ISO-8601 strings or epoch seconds; a missing timestamp is left for the
 * adapter to stamp.
 */
@RequiredArgsConstructor
public class SamplePayloadParser {

    private static final String SOURCE_ID = "source_id";
    private static final String METRIC_NAME = "metric_name";
    private static final String VALUE = "value";
    private static final String TIMESTAMP = "timestamp";

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the payload is not a JSON object or holds no metric
     */
    public List<MetricSample> parse(String payload, String defaultSourceId) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Payload is not a JSON object");
        }

        String sourceId = root.hasNonNull(SOURCE_ID) ? root.get(SOURCE_ID).asText() : defaultSourceId;
        Instant timestamp = parseTimestamp(root.get(TIMESTAMP));

        if (root.hasNonNull(METRIC_NAME)) {
            JsonNode value = root.get(VALUE);
            if (value == null || !value.isNumber()) {
                throw new IllegalArgumentException("Sample " + root.get(METRIC_NAME).asText() + " has no numeric value");
            }
            return List.of(sample(sourceId, root.get(METRIC_NAME).asText(), value.asDouble(), timestamp));
        }

        List<MetricSample> samples = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (TIMESTAMP.equals(name) || SOURCE_ID.equals(name) || !field.getValue().isNumber()) {
                continue;
            }
            samples.add(sample(sourceId, name, field.getValue().asDouble(), timestamp));
        }
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Payload holds no numeric metrics");
        }
        return samples;
    }

    private static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            BigDecimal seconds = node.decimalValue();
            long whole = seconds.longValue();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        }
        return Instant.parse(node.asText());
    }

    private static MetricSample sample(String sourceId, String metric, double value, Instant timestamp) {
        return MetricSample.builder()
                .sourceId(sourceId)
                .metricName(metric)
                .value(value)
                .timestamp(timestamp)
                .build();
    }
}
