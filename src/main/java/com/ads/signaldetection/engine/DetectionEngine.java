package com.ads.signaldetection.engine;

import com.ads.signaldetection.detector.CorrelatedEvents;
import com.ads.signaldetection.detector.Detector;
import com.ads.signaldetection.detector.DetectorRegistry;
import com.ads.signaldetection.metrics.Metrics;
import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.output.EventSink;
import com.ads.signaldetection.state.WindowSnapshot;
import com.ads.signaldetection.state.WindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one evaluation pass: samples of one source sharing a timestamp.
 * <p>
 * Every sample updates its window and is offered to the active detectors subscribed to its
 * metric. Events a detector raises within one pass are merged into a single event before they
 * reach the sink. A detector that throws is isolated: the error is counted and the remaining
 * detectors still run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectionEngine {

    private final WindowStore windowStore;
    private final DetectorRegistry registry;
    private final EventSink eventSink;
    private final Metrics metrics;

    /**
     * @param pass samples of a single source with a single timestamp
     * @return events handed to the sink
     */
    public List<AnomalyEvent> process(List<MetricSample> pass) {
        Map<Detector, List<AnomalyEvent>> raised = new LinkedHashMap<>();

        for (MetricSample sample : pass) {
            long start = System.nanoTime();
            WindowSnapshot snapshot = windowStore.update(sample);

            for (Detector detector : registry.detectorsFor(sample.getMetricName())) {
                long evaluationStart = System.nanoTime();
                try {
                    Optional<AnomalyEvent> event = detector.evaluate(sample, snapshot);
                    metrics.onDetectorEvaluated(detector.detectorId(), Duration.ofNanos(System.nanoTime() - evaluationStart));
                    registry.recordSuccess(detector.detectorId());
                    event.ifPresent(e -> raised.computeIfAbsent(detector, d -> new ArrayList<>()).add(e));
                } catch (RuntimeException e) {
                    metrics.onDetectorError(detector.detectorId());
                    registry.recordFailure(detector.detectorId());
                    log.error("Detector {} failed on {} at {}", detector.detectorId(), sample.key(), sample.getTimestamp(), e);
                }
            }
            metrics.onSampleProcessed(sample.getSourceId(), Duration.ofNanos(System.nanoTime() - start));
        }

        List<AnomalyEvent> emitted = new ArrayList<>();
        raised.forEach((detector, events) -> {
            AnomalyEvent event = merge(detector, events);
            eventSink.publish(event);
            metrics.onAnomalyDetected(detector.detectorId());
            emitted.add(event);
            log.info("Anomaly {} by {} on {} {} (severity={}, confidence={})",
                    event.getEventId(), event.getDetectorId(), event.getSourceId(), event.getAffectedMetrics(),
                    event.getSeverity(), String.format("%.2f", event.getConfidence()));
        });
        return emitted;
    }

    private AnomalyEvent merge(Detector detector, List<AnomalyEvent> events) {
        if (events.size() == 1) {
            return events.get(0);
        }
        try {
            return detector.merge(events);
        } catch (RuntimeException e) {
            metrics.onDetectorError(detector.detectorId());
            log.error("Detector {} failed to merge {} events, using default merge", detector.detectorId(), events.size(), e);
            return CorrelatedEvents.merge(events);
        }
    }
}
