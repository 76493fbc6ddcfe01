package com.ads.signaldetection.detector;

import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.state.WindowSnapshot;
import com.ads.signaldetection.state.WindowStatistics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared plumbing for window-based detectors: option handling, the cold-start guard and event
 * construction with the configured severity/confidence mapping.
 */
public abstract class AbstractDetector implements Detector {

    static final String DETECTION_METHODS = "detection_methods";
    static final String RULE_SCORES = "rule_scores";

    protected static final double EPSILON = 1e-9;

    private final String detectorId;
    private volatile DetectorOptions options = DetectorOptions.defaults();

    protected AbstractDetector(String detectorId) {
        if (detectorId == null || detectorId.isBlank()) {
            throw new IllegalArgumentException("detectorId is required");
        }
        this.detectorId = detectorId;
    }

    @Override
    public String detectorId() {
        return detectorId;
    }

    @Override
    public void configure(DetectorOptions options) {
        this.options = options.validate(detectorId);
    }

    @Override
    public DetectorOptions options() {
        return options;
    }

    @Override
    public final Optional<AnomalyEvent> evaluate(MetricSample sample, WindowSnapshot snapshot) {
        if (!snapshot.sufficientHistory()
                || snapshot.length() < options.minSamples()
                || snapshot.baseline().isEmpty()) {
            return Optional.empty();
        }
        return score(sample, snapshot.baseline());
    }

    /**
     * Score a sample against the window as it was before the sample was admitted.
     */
    protected abstract Optional<AnomalyEvent> score(MetricSample sample, WindowStatistics baseline);

    protected AnomalyEvent buildEvent(
            MetricSample sample,
            String anomalyType,
            double worstScore,
            double zScore,
            double predicted,
            Map<String, Double> ruleScores,
            List<String> firedMethods,
            WindowStatistics baseline
    ) {
        DetectorOptions current = options;
        Set<String> metrics = new TreeSet<>(Set.of(sample.getMetricName()));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(DETECTION_METHODS, List.copyOf(firedMethods));
        metadata.put(RULE_SCORES, Map.copyOf(ruleScores));
        metadata.put("detector_version", version());
        metadata.put("window_size", current.windowSize());
        metadata.put("min_samples", current.minSamples());
        metadata.put("baseline_count", baseline.count());

        return AnomalyEvent.builder()
                .eventId(AnomalyEvent.eventIdFor(detectorId, sample.getSourceId(), sample.getTimestamp(), metrics))
                .detectorId(detectorId)
                .sourceId(sample.getSourceId())
                .timestamp(sample.getTimestamp())
                .severity(current.severityThresholds().classify(worstScore))
                .confidence(confidence(worstScore))
                .anomalyType(anomalyType)
                .affectedMetrics(metrics)
                .zScores(Map.of(sample.getMetricName(), zScore))
                .rawValues(Map.of(sample.getMetricName(), sample.getValue()))
                .predictedValues(Map.of(sample.getMetricName(), predicted))
                .metadata(metadata)
                .build();
    }

    /**
     * Saturating, monotonic in the score: {@code min(1, score / confidence_scale)}.
     */
    protected double confidence(double score) {
        return Math.min(1.0, Math.max(0.0, score / options.confidenceScale()));
    }
}
