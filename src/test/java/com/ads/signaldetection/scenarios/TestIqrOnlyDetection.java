package com.ads.signaldetection.scenarios;

import com.ads.signaldetection.detector.DetectorOptions;
import com.ads.signaldetection.detector.DetectorRegistry;
import com.ads.signaldetection.engine.DetectionEngine;
import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.model.Severity;
import com.ads.signaldetection.output.InMemoryEventSink;
import com.ads.signaldetection.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * A value the z-score rule tolerates (heavy tails inflate the std) but the IQR rule rejects.
 */
public class TestIqrOnlyDetection {

    private List<MetricSample> history() {
        List<Double> values = new ArrayList<>(List.of(20.0, 80.0, 20.0, 80.0));
        for (int i = 0; i < 12; i++) {
            values.add(49.0);
            values.add(50.0);
            values.add(51.0);
        }
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            samples.add(sample("host-1", "latency_ms", values.get(i), BASE.plusSeconds(i)));
        }
        return samples;
    }

    private InMemoryEventSink run(boolean useIqr) {
        DetectorRegistry registry = new DetectorRegistry(5);
        registry.register(TestFactory.statistical("statistical_detector",
                DetectorOptions.defaults().toBuilder().useIqr(useIqr).build()), List.of("*"));
        InMemoryEventSink sink = new InMemoryEventSink();
        DetectionEngine engine = TestFactory.createEngine(TestFactory.windowStore(100, 10), registry, sink);

        for (MetricSample s : history()) {
            engine.process(List.of(s));
        }
        engine.process(List.of(sample("host-1", "latency_ms", 58, BASE.plusSeconds(40))));
        return sink;
    }

    @Test
    void testIqrRuleFlagsValueInsideZScoreBand() {
        InMemoryEventSink sink = run(true);

        // mean 50, std ~9.52, z ~0.84; Q1 49, Q3 51, fences [46, 54]
        assertThat(sink.records()).hasSize(1);
        AnomalyEvent event = sink.records().get(0);
        assertThat(event.getMetadata().get("detection_methods")).isEqualTo(List.of("iqr"));
        assertThat(event.getZScores().get("latency_ms")).isCloseTo(0.84, within(0.01));
        assertThat(event.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(event.getConfidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void testZScoreAloneStaysQuiet() {
        assertThat(run(false).records()).isEmpty();
    }
}
