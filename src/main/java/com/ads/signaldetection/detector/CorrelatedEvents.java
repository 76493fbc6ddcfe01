package com.ads.signaldetection.detector;

import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.Severity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Default multi-metric merge: one event per (detector, source, pass).
 */
public final class CorrelatedEvents {

    private CorrelatedEvents() {
    }

    /**
     * Union of affected metrics (sorted), highest severity, highest confidence and merged
     * per-metric maps. Metadata of later events overrides earlier keys, except
     * {@code detection_methods} which is unioned.
     *
     * @throws IllegalArgumentException if {@code events} is empty
     */
    public static AnomalyEvent merge(List<AnomalyEvent> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        if (events.size() == 1) {
            return events.get(0);
        }

        AnomalyEvent first = events.get(0);
        Set<String> metrics = new TreeSet<>();
        Map<String, Double> zScores = new TreeMap<>();
        Map<String, Double> rawValues = new TreeMap<>();
        Map<String, Double> predictedValues = new TreeMap<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        Set<String> methods = new TreeSet<>();
        Severity severity = first.getSeverity();
        double confidence = first.getConfidence();

        for (AnomalyEvent event : events) {
            metrics.addAll(event.getAffectedMetrics());
            zScores.putAll(event.getZScores());
            rawValues.putAll(event.getRawValues());
            predictedValues.putAll(event.getPredictedValues());
            metadata.putAll(event.getMetadata());
            Object eventMethods = event.getMetadata().get(AbstractDetector.DETECTION_METHODS);
            if (eventMethods instanceof Iterable<?> iterable) {
                iterable.forEach(method -> methods.add(String.valueOf(method)));
            }
            severity = severity.max(event.getSeverity());
            confidence = Math.max(confidence, event.getConfidence());
        }
        if (!methods.isEmpty()) {
            metadata.put(AbstractDetector.DETECTION_METHODS, List.copyOf(methods));
        }
        metadata.put("correlated", true);

        return first.toBuilder()
                .eventId(AnomalyEvent.eventIdFor(first.getDetectorId(), first.getSourceId(), first.getTimestamp(), metrics))
                .severity(severity)
                .confidence(confidence)
                .affectedMetrics(metrics)
                .zScores(zScores)
                .rawValues(rawValues)
                .predictedValues(predictedValues)
                .metadata(metadata)
                .build();
    }
}
