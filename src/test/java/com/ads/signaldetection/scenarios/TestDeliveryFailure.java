package com.ads.signaldetection.scenarios;

import com.ads.signaldetection.metrics.MetricsRegistry;
import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.DeadLetter;
import com.ads.signaldetection.output.DeadLetterStore;
import com.ads.signaldetection.output.EventSink;
import com.ads.signaldetection.output.InMemoryMemoryInterface;
import com.ads.signaldetection.retry.ExponentialBackoff;
import com.ads.signaldetection.testutil.TestFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.anomaly;
import static org.assertj.core.api.Assertions.assertThat;

public class TestDeliveryFailure {

    @TempDir
    Path tempDir;

    @Test
    void testExhaustedRetriesDeadLetterTheBatch() throws Exception {
        DeadLetterStore deadLetters = TestFactory.deadLetterStore(tempDir);
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
        InMemoryMemoryInterface memory = new InMemoryMemoryInterface().failNext(3);
        EventSink sink = new EventSink(memory, deadLetters, metrics, 1, Duration.ofSeconds(1),
                Duration.ofSeconds(1), 3, ExponentialBackoff.ofMillis(1, 10), Clock.systemUTC());

        AnomalyEvent event = anomaly("statistical_detector", "host-1", "cpu_usage", BASE);
        sink.publish(event);
        sink.flush();

        assertThat(memory.calls()).isEqualTo(3);
        assertThat(memory.events()).isEmpty();
        assertThat(deadLetters.count()).isEqualTo(1);
        assertThat(metrics.snapshot().deliveryFailures()).isEqualTo(1);

        List<DeadLetter> letters = deadLetters.list(10);
        assertThat(letters.get(0).events()).containsExactly(event);
        assertThat(letters.get(0).attempts()).isEqualTo(3);

        // the memory system is back: the next batch goes straight through
        AnomalyEvent later = anomaly("statistical_detector", "host-1", "cpu_usage", BASE.plusSeconds(1));
        sink.publish(later);
        sink.flush();
        assertThat(memory.events()).containsExactly(later);
        assertThat(metrics.snapshot().deliveryFailures()).isEqualTo(1);

        sink.close();
        deadLetters.close();
    }
}
