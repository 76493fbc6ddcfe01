package com.ads.signaldetection.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Lightweight metrics API passed explicitly to every pipeline component.
 */
public interface Metrics {

    /* -------- Ingestion -------- */

    void onSampleReceived(String sourceId);

    void onSampleEnqueued(String sourceId);

    void onSampleDropped(long count);

    void onSampleDropped(String sourceId, int count);

    void onSpilloverWrite(String sourceId, int samples);

    void onSpilloverReplay(int samples);

    /* -------- Detection -------- */

    void onSampleProcessed(String sourceId, Duration latency);

    void onDetectorEvaluated(String detectorId, Duration latency);

    void onAnomalyDetected(String detectorId);

    void onDetectorError(String detectorId);

    /* -------- Delivery -------- */

    void onBatchDelivered(int events);

    void onDeliveryFailure();

    MetricsSnapshot snapshot();

    Map<String, DetectorMetrics> detectorMetrics();

    Map<String, StreamMetrics> streamMetrics();
}
