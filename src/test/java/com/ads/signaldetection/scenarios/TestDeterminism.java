package com.ads.signaldetection.scenarios;

import com.ads.signaldetection.detector.DetectorOptions;
import com.ads.signaldetection.detector.DetectorRegistry;
import com.ads.signaldetection.detector.EmaDeviationDetector;
import com.ads.signaldetection.engine.DetectionEngine;
import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.output.InMemoryEventSink;
import com.ads.signaldetection.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;

public class TestDeterminism {

    private List<AnomalyEvent> replay() {
        DetectorRegistry registry = new DetectorRegistry(5);
        registry.register(TestFactory.statistical("statistical_detector", DetectorOptions.defaults().toBuilder()
                .useIqr(true).useMad(true).build()), List.of("*"));
        EmaDeviationDetector ema = new EmaDeviationDetector("ema_detector");
        ema.configure(DetectorOptions.defaults());
        registry.register(ema, List.of("cpu_usage"));
        InMemoryEventSink sink = new InMemoryEventSink();
        DetectionEngine engine = TestFactory.createEngine(TestFactory.windowStore(50, 10), registry, sink);

        Random random = new Random(7);
        for (int i = 0; i < 500; i++) {
            double cpu = 40 + random.nextGaussian() * 5 + (i % 97 == 0 ? 60 : 0);
            double memory = 70 + random.nextGaussian() * 2 + (i % 131 == 0 ? -30 : 0);
            engine.process(List.of(
                    sample("host-1", "cpu_usage", cpu, BASE.plusSeconds(i)),
                    sample("host-1", "memory_usage", memory, BASE.plusSeconds(i))));
        }
        return List.copyOf(sink.records());
    }

    @Test
    void testSameInputSameEvents() {
        List<AnomalyEvent> first = replay();
        List<AnomalyEvent> second = replay();

        assertThat(first).isNotEmpty();
        assertThat(second).isEqualTo(first);
        assertThat(second).extracting(AnomalyEvent::getEventId)
                .containsExactlyElementsOf(first.stream().map(AnomalyEvent::getEventId).toList());
    }
}
