package com.ads.signaldetection.detector;

import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.state.WindowStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Z-score detector with optional IQR and MAD rules, OR-combined.
 * <ul>
 *   <li>z-score: {@code |x - mean| / std > std_dev_threshold}, skipped when std is ~0</li>
 *   <li>IQR: {@code x} outside {@code [Q1 - k*IQR, Q3 + k*IQR]}, scored as {@code |x - median| / IQR}</li>
 *   <li>MAD: {@code |x - median| / MAD > mad_threshold}</li>
 * </ul>
 * Severity and confidence follow the worst firing score.
 */
@Slf4j
public class StatisticalDetector extends AbstractDetector {

    public static final String TYPE = "statistical";

    static final String ZSCORE = "zscore";
    static final String IQR = "iqr";
    static final String MAD = "mad";

    public StatisticalDetector(String detectorId) {
        super(detectorId);
    }

    @Override
    public String version() {
        return "1.0.0";
    }

    @Override
    protected Optional<AnomalyEvent> score(MetricSample sample, WindowStatistics baseline) {
        DetectorOptions options = options();
        double x = sample.getValue();

        Map<String, Double> scores = new LinkedHashMap<>();
        List<String> fired = new ArrayList<>();
        double worst = 0.0;

        double z = 0.0;
        if (baseline.stdDev() > EPSILON) {
            z = (x - baseline.mean()) / baseline.stdDev();
            double absZ = Math.abs(z);
            scores.put(ZSCORE, absZ);
            if (absZ > options.stdDevThreshold()) {
                fired.add(ZSCORE);
                worst = Math.max(worst, absZ);
            }
        }

        if (options.useIqr() && baseline.count() >= 4 && baseline.iqr() > EPSILON) {
            double iqr = baseline.iqr();
            double lower = baseline.q1() - options.iqrMultiplier() * iqr;
            double upper = baseline.q3() + options.iqrMultiplier() * iqr;
            double iqrScore = Math.abs(x - baseline.median()) / iqr;
            scores.put(IQR, iqrScore);
            if (x < lower || x > upper) {
                fired.add(IQR);
                worst = Math.max(worst, iqrScore);
            }
        }

        if (options.useMad() && baseline.count() >= 3 && baseline.mad() > EPSILON) {
            double madScore = Math.abs(x - baseline.median()) / baseline.mad();
            scores.put(MAD, madScore);
            if (madScore > options.madThreshold()) {
                fired.add(MAD);
                worst = Math.max(worst, madScore);
            }
        }

        if (fired.isEmpty()) {
            return Optional.empty();
        }

        log.debug("Detector {} flagged {} value={} methods={} scores={}",
                detectorId(), sample.key(), x, fired, scores);
        return Optional.of(buildEvent(sample, "statistical_outlier", worst, z, baseline.mean(),
                scores, fired, baseline));
    }
}
