package com.ads.signaldetection.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide metrics. Every counter is kept twice: an atomic for the snapshot read model and
 * a Micrometer meter for whatever registry the process exports.
 * <p>
 * Per-detector meters carry a {@code detector} tag and per-source meters a {@code source} tag.
 * They are registered the first time a detector or source reports.
 */
@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong samplesProcessed = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();
    private final AtomicLong samplesDropped = new AtomicLong();
    private final AtomicLong spilloverWrites = new AtomicLong();
    private final AtomicLong spilloverReplays = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();
    private final AtomicLong batchesDelivered = new AtomicLong();
    private final AtomicLong detectorErrors = new AtomicLong();

    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());

    private final MeterRegistry meterRegistry;
    private final Counter samplesProcessedCounter;
    private final Counter anomaliesDetectedCounter;
    private final Counter samplesDroppedCounter;
    private final Counter spilloverWritesCounter;
    private final Counter spilloverReplaysCounter;
    private final Counter deliveryFailuresCounter;
    private final Counter batchesDeliveredCounter;
    private final Timer detectionLatency;

    private final Map<String, DetectorStats> detectors = new ConcurrentHashMap<>();
    private final Map<String, SourceStats> sources = new ConcurrentHashMap<>();

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.samplesProcessedCounter = meterRegistry.counter("samples_processed_total");
        this.anomaliesDetectedCounter = meterRegistry.counter("anomalies_detected_total");
        this.samplesDroppedCounter = meterRegistry.counter("samples_dropped_total");
        this.spilloverWritesCounter = meterRegistry.counter("spillover_writes_total");
        this.spilloverReplaysCounter = meterRegistry.counter("spillover_replays_total");
        this.deliveryFailuresCounter = meterRegistry.counter("delivery_failures_total");
        this.batchesDeliveredCounter = meterRegistry.counter("batches_delivered_total");
        this.detectionLatency = Timer.builder("detection_latency")
                .description("Time from window update to detector fan-out completion per sample")
                .publishPercentileHistogram()
                .register(meterRegistry);
    }

    @Override
    public void onSampleReceived(String sourceId) {
        SourceStats stats = source(sourceId);
        stats.received.incrementAndGet();
        stats.receivedCounter.increment();
        stats.lastMessage.set(Instant.now());
    }

    @Override
    public void onSampleEnqueued(String sourceId) {
        SourceStats stats = source(sourceId);
        stats.enqueued.incrementAndGet();
        stats.enqueuedCounter.increment();
    }

    @Override
    public void onSampleDropped(String sourceId, int count) {
        if (count <= 0) {
            return;
        }
        SourceStats stats = source(sourceId);
        stats.dropped.addAndGet(count);
        stats.droppedCounter.increment(count);
        onSampleDropped(count);
    }

    @Override
    public void onSampleDropped(long count) {
        if (count <= 0) {
            return;
        }
        samplesDropped.addAndGet(count);
        samplesDroppedCounter.increment(count);
        touch();
    }

    @Override
    public void onSpilloverWrite(String sourceId, int samples) {
        if (samples <= 0) {
            return;
        }
        SourceStats stats = source(sourceId);
        stats.spilled.addAndGet(samples);
        stats.spilledCounter.increment(samples);
        spilloverWrites.addAndGet(samples);
        spilloverWritesCounter.increment(samples);
        touch();
    }

    @Override
    public void onSpilloverReplay(int samples) {
        if (samples <= 0) {
            return;
        }
        spilloverReplays.addAndGet(samples);
        spilloverReplaysCounter.increment(samples);
        touch();
    }

    @Override
    public void onSampleProcessed(String sourceId, Duration latency) {
        SourceStats stats = source(sourceId);
        stats.processed.incrementAndGet();
        stats.processedCounter.increment();
        samplesProcessed.incrementAndGet();
        samplesProcessedCounter.increment();
        detectionLatency.record(latency);
        touch();
    }

    @Override
    public void onDetectorEvaluated(String detectorId, Duration latency) {
        DetectorStats stats = detector(detectorId);
        stats.processed.incrementAndGet();
        stats.latency.record(latency);
    }

    @Override
    public void onAnomalyDetected(String detectorId) {
        DetectorStats stats = detector(detectorId);
        stats.anomalies.incrementAndGet();
        stats.anomaliesCounter.increment();
        stats.lastDetection.set(Instant.now());
        anomaliesDetected.incrementAndGet();
        anomaliesDetectedCounter.increment();
        touch();
    }

    @Override
    public void onDetectorError(String detectorId) {
        DetectorStats stats = detector(detectorId);
        stats.errors.incrementAndGet();
        stats.errorsCounter.increment();
        detectorErrors.incrementAndGet();
        touch();
    }

    @Override
    public void onBatchDelivered(int events) {
        batchesDelivered.incrementAndGet();
        batchesDeliveredCounter.increment();
        touch();
    }

    @Override
    public void onDeliveryFailure() {
        deliveryFailures.incrementAndGet();
        deliveryFailuresCounter.increment();
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                samplesProcessed.get(),
                anomaliesDetected.get(),
                samplesDropped.get(),
                spilloverWrites.get(),
                spilloverReplays.get(),
                deliveryFailures.get(),
                batchesDelivered.get(),
                detectorErrors.get(),
                latencySummary(),
                lastUpdatedAt.get()
        );
    }

    @Override
    public Map<String, DetectorMetrics> detectorMetrics() {
        Map<String, DetectorMetrics> view = new TreeMap<>();
        detectors.forEach((id, stats) -> view.put(id, stats.toMetrics()));
        return Collections.unmodifiableMap(view);
    }

    @Override
    public Map<String, StreamMetrics> streamMetrics() {
        Map<String, StreamMetrics> view = new TreeMap<>();
        sources.forEach((id, stats) -> view.put(id, stats.toMetrics()));
        return Collections.unmodifiableMap(view);
    }

    private DetectorStats detector(String detectorId) {
        return detectors.computeIfAbsent(detectorId, id -> new DetectorStats(meterRegistry, id));
    }

    private SourceStats source(String sourceId) {
        return sources.computeIfAbsent(sourceId, id -> new SourceStats(meterRegistry, id));
    }

    private MetricsSnapshot.LatencySummary latencySummary() {
        long count = detectionLatency.count();
        if (count == 0) {
            return MetricsSnapshot.LatencySummary.EMPTY;
        }
        return new MetricsSnapshot.LatencySummary(
                count,
                detectionLatency.mean(TimeUnit.MILLISECONDS),
                detectionLatency.max(TimeUnit.MILLISECONDS)
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }

    private static final class DetectorStats {

        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong anomalies = new AtomicLong();
        private final AtomicLong errors = new AtomicLong();
        private final AtomicReference<Instant> lastDetection = new AtomicReference<>();

        private final Counter anomaliesCounter;
        private final Counter errorsCounter;
        private final Timer latency;

        DetectorStats(MeterRegistry meterRegistry, String detectorId) {
            this.anomaliesCounter = meterRegistry.counter("detector_anomalies_total", "detector", detectorId);
            this.errorsCounter = meterRegistry.counter("detector_errors_total", "detector", detectorId);
            this.latency = Timer.builder("detector_latency")
                    .description("Time spent in one detector evaluation")
                    .tag("detector", detectorId)
                    .register(meterRegistry);
        }

        DetectorMetrics toMetrics() {
            double averageMillis = latency.count() == 0 ? 0.0 : latency.mean(TimeUnit.MILLISECONDS);
            return new DetectorMetrics(processed.get(), anomalies.get(), errors.get(), averageMillis, lastDetection.get());
        }
    }

    private static final class SourceStats {

        private final AtomicLong received = new AtomicLong();
        private final AtomicLong enqueued = new AtomicLong();
        private final AtomicLong spilled = new AtomicLong();
        private final AtomicLong dropped = new AtomicLong();
        private final AtomicLong processed = new AtomicLong();
        private final AtomicReference<Instant> lastMessage = new AtomicReference<>();

        private final Counter receivedCounter;
        private final Counter enqueuedCounter;
        private final Counter spilledCounter;
        private final Counter droppedCounter;
        private final Counter processedCounter;

        SourceStats(MeterRegistry meterRegistry, String sourceId) {
            this.receivedCounter = meterRegistry.counter("source_samples_received_total", "source", sourceId);
            this.enqueuedCounter = meterRegistry.counter("source_samples_enqueued_total", "source", sourceId);
            this.spilledCounter = meterRegistry.counter("source_samples_spilled_total", "source", sourceId);
            this.droppedCounter = meterRegistry.counter("source_samples_dropped_total", "source", sourceId);
            this.processedCounter = meterRegistry.counter("source_samples_processed_total", "source", sourceId);
        }

        StreamMetrics toMetrics() {
            return new StreamMetrics(received.get(), enqueued.get(), spilled.get(), dropped.get(),
                    processed.get(), lastMessage.get());
        }
    }
}
