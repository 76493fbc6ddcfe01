package com.ads.signaldetection.model;

/**
 * Identifies one metric stream: the pair (source_id, metric_name).
 */
public record WindowKey(String sourceId, String metricName) {

    @Override
    public String toString() {
        return sourceId + "/" + metricName;
    }
}
