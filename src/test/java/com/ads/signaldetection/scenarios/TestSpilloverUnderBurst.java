package com.ads.signaldetection.scenarios;

import com.ads.signaldetection.ingestion.IngestionStage;
import com.ads.signaldetection.ingestion.OverflowStore;
import com.ads.signaldetection.ingestion.SubmitResult;
import com.ads.signaldetection.metrics.MetricsRegistry;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.model.WindowKey;
import com.ads.signaldetection.state.WindowStore;
import com.ads.signaldetection.testutil.TestFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;

public class TestSpilloverUnderBurst {

    @TempDir
    Path tempDir;

    @Test
    void testBurstSpillsInsteadOfDropping() throws Exception {
        OverflowStore overflow = TestFactory.overflowStore(tempDir, 1_000);
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
        IngestionStage ingestion = new IngestionStage(overflow, metrics, 10, Duration.ZERO, 1, 10);
        ingestion.initialize();

        // no consumer while the burst arrives
        List<SubmitResult> results = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            results.add(ingestion.submit(sample("burst", "cpu_usage", i, BASE.plusSeconds(i))));
            assertThat(ingestion.depth()).isLessThanOrEqualTo(10);
        }

        assertThat(results).doesNotContain(SubmitResult.DROPPED);
        assertThat(metrics.snapshot().spilloverWrites()).isGreaterThanOrEqualTo(5);
        assertThat(metrics.snapshot().samplesDropped()).isZero();
        assertThat(ingestion.overflowDepth()).isEqualTo(5);

        // drain, sweep, drain: every sample comes out once, in order
        List<MetricSample> received = new ArrayList<>();
        MetricSample next;
        while ((next = ingestion.take(Duration.ofMillis(10))) != null) {
            received.add(next);
        }
        ingestion.recoverySweep();
        while ((next = ingestion.take(Duration.ofMillis(10))) != null) {
            received.add(next);
        }

        assertThat(received).extracting(MetricSample::getValue)
                .containsExactly(0.0, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0, 11.0, 12.0, 13.0, 14.0);
        assertThat(ingestion.overflowDepth()).isZero();
        overflow.close();
    }

    @Test
    void testReplayedSamplesBuildSameWindowsAsDirectAdmission() throws Exception {
        List<MetricSample> samples = new ArrayList<>();
        List<WindowKey> keys = new ArrayList<>();
        for (String source : List.of("host-1", "host-2", "host-3")) {
            for (String metric : List.of("cpu_usage", "memory_usage")) {
                keys.add(new WindowKey(source, metric));
            }
        }
        for (int round = 0; round < 40; round++) {
            for (WindowKey key : keys) {
                double value = (round * 37 + key.hashCode() % 11) % 17 + 0.25 * round;
                samples.add(sample(key.sourceId(), key.metricName(), value, BASE.plusSeconds(round)));
            }
        }

        WindowStore direct = TestFactory.windowStore(20, 5);
        samples.forEach(direct::update);

        OverflowStore overflow = TestFactory.overflowStore(tempDir, 10_000);
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
        IngestionStage ingestion = new IngestionStage(overflow, metrics, 8, Duration.ZERO, 3, 10);
        ingestion.initialize();
        WindowStore viaOverflow = TestFactory.windowStore(20, 5);

        // the consumer falls behind: two samples taken for every ten submitted
        for (int i = 0; i < samples.size(); i++) {
            ingestion.submit(samples.get(i));
            if (i % 10 == 9) {
                for (int t = 0; t < 2; t++) {
                    MetricSample next = ingestion.take(Duration.ofMillis(10));
                    if (next != null) {
                        viaOverflow.update(next);
                    }
                }
            }
        }
        while (ingestion.depth() > 0 || ingestion.overflowDepth() > 0) {
            ingestion.recoverySweep();
            MetricSample next;
            while ((next = ingestion.take(Duration.ofMillis(10))) != null) {
                viaOverflow.update(next);
            }
        }

        assertThat(metrics.snapshot().spilloverWrites()).isGreaterThan(0);
        assertThat(metrics.snapshot().samplesDropped()).isZero();
        for (WindowKey key : keys) {
            assertThat(viaOverflow.length(key)).as("length of %s", key).isEqualTo(direct.length(key));
            assertThat(viaOverflow.statistics(key)).as("statistics of %s", key).isEqualTo(direct.statistics(key));
        }
        overflow.close();
    }
}
