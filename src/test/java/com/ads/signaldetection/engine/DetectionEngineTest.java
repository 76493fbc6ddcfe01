package com.ads.signaldetection.engine;

import com.ads.signaldetection.detector.Detector;
import com.ads.signaldetection.detector.DetectorOptions;
import com.ads.signaldetection.detector.DetectorRegistry;
import com.ads.signaldetection.metrics.MetricsRegistry;
import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.model.Severity;
import com.ads.signaldetection.output.InMemoryEventSink;
import com.ads.signaldetection.state.WindowSnapshot;
import com.ads.signaldetection.state.WindowStore;
import com.ads.signaldetection.testutil.TestFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;

public class DetectionEngineTest {

    /**
     * Throws on every evaluation.
     */
    private static final class BrokenDetector implements Detector {
        private final String id;

        private BrokenDetector(String id) {
            this.id = id;
        }

        @Override
        public String detectorId() {
            return id;
        }

        @Override
        public String version() {
            return "0.0.1";
        }

        @Override
        public void configure(DetectorOptions options) {
            // no options
        }

        @Override
        public DetectorOptions options() {
            return DetectorOptions.defaults();
        }

        @Override
        public Optional<AnomalyEvent> evaluate(MetricSample sample, WindowSnapshot snapshot) {
            throw new IllegalStateException("boom");
        }
    }

    private List<MetricSample> pass(Instant t, double cpu, double memory) {
        return List.of(sample("host-1", "cpu", cpu, t), sample("host-1", "memory", memory, t));
    }

    private void warmUp(DetectionEngine engine, int count) {
        for (int i = 0; i < count; i++) {
            double v = i % 2 == 0 ? 35 : 45;
            engine.process(pass(BASE.plusSeconds(i), v, v));
        }
    }

    @Test
    public void testMetricsOfOnePassAreMergedPerDetector() {
        WindowStore store = TestFactory.windowStore(100, 10);
        DetectorRegistry registry = new DetectorRegistry(5);
        registry.register(TestFactory.statistical("stat", DetectorOptions.defaults()), List.of("*"));
        InMemoryEventSink sink = new InMemoryEventSink();
        DetectionEngine engine = TestFactory.createEngine(store, registry, sink);

        warmUp(engine, 100);
        assertThat(sink.records()).isEmpty();

        // cpu z = 11, memory z = 4.2
        List<AnomalyEvent> emitted = engine.process(pass(BASE.plusSeconds(100), 95, 61));

        assertThat(emitted).hasSize(1);
        AnomalyEvent event = sink.records().get(0);
        assertThat(event.getAffectedMetrics()).containsExactly("cpu", "memory");
        assertThat(event.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(event.getZScores()).containsOnlyKeys("cpu", "memory");
        assertThat(event.getMetadata()).containsEntry("correlated", true);
    }

    @Test
    public void testFailingDetectorIsIsolatedAndDeactivated() {
        WindowStore store = TestFactory.windowStore(100, 10);
        DetectorRegistry registry = new DetectorRegistry(3);
        registry.register(new BrokenDetector("broken"), List.of("cpu"));
        registry.register(TestFactory.statistical("stat", DetectorOptions.defaults()), List.of("cpu"));
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
        InMemoryEventSink sink = new InMemoryEventSink();
        DetectionEngine engine = TestFactory.createEngine(store, registry, sink, metrics);

        List<AnomalyEvent> emitted = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            emitted.addAll(engine.process(List.of(sample("host-1", "cpu", i % 2 == 0 ? 35 : 45, BASE.plusSeconds(i)))));
        }
        emitted.addAll(engine.process(List.of(sample("host-1", "cpu", 95, BASE.plusSeconds(50)))));

        assertThat(registry.isActive("broken")).isFalse();
        assertThat(registry.isActive("stat")).isTrue();
        assertThat(metrics.snapshot().detectorErrors()).isEqualTo(3);
        assertThat(emitted).extracting(AnomalyEvent::getDetectorId).containsExactly("stat");
        assertThat(metrics.snapshot().samplesProcessed()).isEqualTo(51);
        assertThat(metrics.snapshot().anomaliesDetected()).isEqualTo(1);
    }
}
