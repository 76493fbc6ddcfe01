package com.ads.signaldetection.scenarios;

import com.ads.signaldetection.detector.DetectorOptions;
import com.ads.signaldetection.detector.DetectorRegistry;
import com.ads.signaldetection.engine.DetectionEngine;
import com.ads.signaldetection.output.InMemoryEventSink;
import com.ads.signaldetection.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;

public class TestColdStart {

    @Test
    void testNoEventsBeforeMinSamples() {
        DetectorRegistry registry = new DetectorRegistry(5);
        registry.register(TestFactory.statistical("statistical_detector", DetectorOptions.defaults().toBuilder()
                .useIqr(true).useMad(true).build()), List.of("*"));
        InMemoryEventSink sink = new InMemoryEventSink();
        DetectionEngine engine = TestFactory.createEngine(TestFactory.windowStore(100, 10), registry, sink);

        // wildly varying values, any of which would be an outlier against a warm window
        double[] values = {1, 1_000, 2, 5_000, 3, 90_000, 4, 1, 250_000};
        for (int i = 0; i < values.length; i++) {
            assertThat(engine.process(List.of(sample("host-1", "cpu_usage", values[i], BASE.plusSeconds(i)))))
                    .isEmpty();
        }
        assertThat(sink.records()).isEmpty();
    }

    @Test
    void testEachStreamWarmsUpSeparately() {
        DetectorRegistry registry = new DetectorRegistry(5);
        registry.register(TestFactory.statistical("statistical_detector", DetectorOptions.defaults()), List.of("*"));
        InMemoryEventSink sink = new InMemoryEventSink();
        DetectionEngine engine = TestFactory.createEngine(TestFactory.windowStore(100, 10), registry, sink);

        for (int i = 0; i < 30; i++) {
            engine.process(List.of(sample("host-1", "cpu_usage", i % 2 == 0 ? 35 : 45, BASE.plusSeconds(i))));
        }
        // a new host has no history of its own
        for (int i = 0; i < 9; i++) {
            engine.process(List.of(sample("host-2", "cpu_usage", i == 8 ? 500 : 40 + i, BASE.plusSeconds(i))));
        }
        assertThat(sink.records()).isEmpty();
    }
}
