package com.ads.signaldetection.detector;

import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.state.WindowStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags values that stray from the exponential moving average by more than
 * {@code std_dev_threshold} window standard deviations.
 */
@Slf4j
public class EmaDeviationDetector extends AbstractDetector {

    public static final String TYPE = "ema_deviation";

    static final String EMA = "ema";

    public EmaDeviationDetector(String detectorId) {
        super(detectorId);
    }

    @Override
    public String version() {
        return "1.0.0";
    }

    @Override
    protected Optional<AnomalyEvent> score(MetricSample sample, WindowStatistics baseline) {
        if (baseline.stdDev() <= EPSILON) {
            return Optional.empty();
        }
        double deviation = (sample.getValue() - baseline.ema()) / baseline.stdDev();
        double score = Math.abs(deviation);
        if (score <= options().stdDevThreshold()) {
            return Optional.empty();
        }

        log.debug("Detector {} flagged {} value={} ema={} score={}",
                detectorId(), sample.key(), sample.getValue(), baseline.ema(), score);
        return Optional.of(buildEvent(sample, "ema_deviation", score, deviation, baseline.ema(),
                Map.of(EMA, score), List.of(EMA), baseline));
    }
}
