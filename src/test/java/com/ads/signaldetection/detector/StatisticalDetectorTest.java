package com.ads.signaldetection.detector;

import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.model.Severity;
import com.ads.signaldetection.state.WindowSnapshot;
import com.ads.signaldetection.state.WindowStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.sample;
import static com.ads.signaldetection.testutil.TestFactory.statistical;
import static com.ads.signaldetection.testutil.TestFactory.windowStore;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class StatisticalDetectorTest {

    private int second;

    private Optional<AnomalyEvent> feed(WindowStore store, Detector detector, double value) {
        MetricSample s = sample("host-1", "cpu", value, BASE.plusSeconds(second++));
        WindowSnapshot snapshot = store.update(s);
        return detector.evaluate(s, snapshot);
    }

    private void warmUp(WindowStore store, Detector detector, int count) {
        for (int i = 0; i < count; i++) {
            assertThat(feed(store, detector, i % 2 == 0 ? 35 : 45)).isEmpty();
        }
    }

    @Test
    public void testZScoreSpikeIsCritical() {
        WindowStore store = windowStore(100, 10);
        Detector detector = statistical("stat", DetectorOptions.defaults());
        warmUp(store, detector, 100);

        AnomalyEvent event = feed(store, detector, 95).orElseThrow();

        // baseline mean 40, std 5
        assertThat(event.getZScores().get("cpu")).isCloseTo(11.0, within(1e-9));
        assertThat(event.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(event.getConfidence()).isEqualTo(1.0);
        assertThat(event.getAnomalyType()).isEqualTo("statistical_outlier");
        assertThat(event.getPredictedValues().get("cpu")).isCloseTo(40.0, within(1e-9));
        assertThat(event.getRawValues().get("cpu")).isEqualTo(95.0);
        assertThat(event.getMetadata().get("detection_methods")).isEqualTo(List.of("zscore"));
    }

    @Test
    public void testValueInsideThresholdIsIgnored() {
        WindowStore store = windowStore(100, 10);
        Detector detector = statistical("stat", DetectorOptions.defaults());
        warmUp(store, detector, 50);

        // z = 2.8
        assertThat(feed(store, detector, 54)).isEmpty();
    }

    @Test
    public void testConstantWindowSkipsZScore() {
        WindowStore store = windowStore(100, 10);
        Detector detector = statistical("stat", DetectorOptions.defaults());
        for (int i = 0; i < 20; i++) {
            feed(store, detector, 50);
        }
        assertThat(feed(store, detector, 1_000)).isEmpty();
    }

    @Test
    public void testNoEventsBeforeMinSamples() {
        WindowStore store = windowStore(100, 10);
        Detector detector = statistical("stat", DetectorOptions.defaults().toBuilder().minSamples(20).build());
        for (int i = 0; i < 15; i++) {
            feed(store, detector, i % 2 == 0 ? 35 : 45);
        }
        assertThat(feed(store, detector, 10_000)).isEmpty();
    }

    @Test
    public void testMadRuleFires() {
        WindowStore store = windowStore(100, 10);
        Detector detector = statistical("stat", DetectorOptions.defaults().toBuilder()
                .stdDevThreshold(100)
                .useMad(true)
                .madThreshold(3.0)
                .build());
        for (int i = 0; i < 30; i++) {
            feed(store, detector, 10 + (i % 3));
        }

        // median 11, MAD 1
        AnomalyEvent event = feed(store, detector, 15).orElseThrow();
        assertThat(event.getMetadata().get("detection_methods")).isEqualTo(List.of("mad"));
        assertThat(event.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(event.getConfidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    public void testEventIdIsDeterministic() {
        WindowStore first = windowStore(100, 10);
        WindowStore replay = windowStore(100, 10);
        Detector a = statistical("stat", DetectorOptions.defaults());
        Detector b = statistical("stat", DetectorOptions.defaults());

        this.second = 0;
        warmUp(first, a, 30);
        AnomalyEvent one = feed(first, a, 200).orElseThrow();
        this.second = 0;
        warmUp(replay, b, 30);
        AnomalyEvent two = feed(replay, b, 200).orElseThrow();

        assertThat(one.getEventId()).isEqualTo(two.getEventId());
        assertThat(one).isEqualTo(two);
    }
}
