package com.ads.signaldetection.detector;

import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.state.WindowSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * A pluggable anomaly-detection algorithm.
 * <p>
 * Implementations read the snapshot handed to them and never mutate window state. Given the same
 * options, sample and snapshot, {@link #evaluate} must return the same result.
 */
public interface Detector {

    String detectorId();

    String version();

    /**
     * Apply options. Called once at startup before the first evaluation.
     *
     * @throws com.ads.signaldetection.config.ConfigurationException on invalid options
     */
    void configure(DetectorOptions options);

    DetectorOptions options();

    /**
     * @return at most one event for this sample
     */
    Optional<AnomalyEvent> evaluate(MetricSample sample, WindowSnapshot snapshot);

    /**
     * Merge events this detector raised for several metrics of one source in the same
     * evaluation pass into a single event. Default policy: {@link CorrelatedEvents#merge}.
     */
    default AnomalyEvent merge(List<AnomalyEvent> events) {
        return CorrelatedEvents.merge(events);
    }
}
