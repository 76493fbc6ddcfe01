package com.ads.signaldetection.output;

import com.ads.signaldetection.detector.CorrelatedEvents;
import com.ads.signaldetection.metrics.MetricsRegistry;
import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.DeadLetter;
import com.ads.signaldetection.retry.ExponentialBackoff;
import com.ads.signaldetection.testutil.MutableClock;
import com.ads.signaldetection.testutil.TestFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.anomaly;
import static org.assertj.core.api.Assertions.assertThat;

public class EventSinkTest {

    @TempDir
    Path tempDir;

    private DeadLetterStore deadLetters;
    private MetricsRegistry metrics;
    private MutableClock clock;
    private EventSink sink;

    @BeforeEach
    void setUp() throws Exception {
        deadLetters = TestFactory.deadLetterStore(tempDir);
        metrics = new MetricsRegistry(new SimpleMeterRegistry());
        clock = new MutableClock(BASE);
    }

    @AfterEach
    void tearDown() {
        if (sink != null) {
            sink.close();
        }
        deadLetters.close();
    }

    private EventSink newSink(MemoryInterface memory, int batchSize, Duration deliveryTimeout, int maxAttempts) {
        sink = new EventSink(memory, deadLetters, metrics, batchSize, Duration.ofSeconds(1), deliveryTimeout,
                maxAttempts, ExponentialBackoff.ofMillis(1, 5), clock);
        return sink;
    }

    private AnomalyEvent event(int second) {
        return anomaly("stat", "host-1", "cpu", BASE.plusSeconds(second));
    }

    @Test
    public void testBatchIsCutAtBatchSize() {
        InMemoryMemoryInterface memory = new InMemoryMemoryInterface();
        EventSink sink = newSink(memory, 3, Duration.ofSeconds(1), 3);

        for (int i = 0; i < 7; i++) {
            sink.publish(event(i));
        }
        sink.flush();

        assertThat(memory.batches()).extracting(List::size).containsExactly(3, 3, 1);
        assertThat(memory.events()).extracting(AnomalyEvent::getTimestamp)
                .containsExactly(BASE, BASE.plusSeconds(1), BASE.plusSeconds(2), BASE.plusSeconds(3),
                        BASE.plusSeconds(4), BASE.plusSeconds(5), BASE.plusSeconds(6));
        assertThat(metrics.snapshot().batchesDelivered()).isEqualTo(3);
        assertThat(sink.pendingCount()).isZero();
    }

    @Test
    public void testFlushTickWaitsForInterval() {
        InMemoryMemoryInterface memory = new InMemoryMemoryInterface();
        EventSink sink = newSink(memory, 100, Duration.ofSeconds(1), 3);

        sink.publish(event(0));
        sink.flushTick();
        assertThat(sink.pendingCount()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(1));
        sink.flushTick();
        sink.flush();
        assertThat(memory.batches()).hasSize(1);
    }

    @Test
    public void testTransientFailureIsRetried() {
        InMemoryMemoryInterface memory = new InMemoryMemoryInterface().failNext(2);
        EventSink sink = newSink(memory, 1, Duration.ofSeconds(1), 3);

        sink.publish(event(0));
        sink.flush();

        assertThat(memory.calls()).isEqualTo(3);
        assertThat(memory.events()).hasSize(1);
        assertThat(deadLetters.count()).isZero();
        assertThat(metrics.snapshot().deliveryFailures()).isZero();
    }

    @Test
    public void testExceptionCountsAsFailedAttempt() {
        MemoryInterface throwing = batch -> {
            throw new IllegalStateException("memory offline");
        };
        EventSink sink = newSink(throwing, 1, Duration.ofSeconds(1), 2);

        sink.publish(event(0));
        sink.flush();

        DeadLetter letter = deadLetters.list(10).get(0);
        assertThat(letter.attempts()).isEqualTo(2);
        assertThat(letter.reason()).contains("memory offline");
    }

    @Test
    public void testSlowDeliveryTimesOut() {
        MemoryInterface slow = batch -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return IngestStatus.SUCCESS;
        };
        EventSink sink = newSink(slow, 1, Duration.ofMillis(50), 1);

        sink.publish(event(0));
        sink.flush();

        assertThat(deadLetters.count()).isEqualTo(1);
        assertThat(deadLetters.list(1).get(0).reason()).contains("timed out");
        assertThat(metrics.snapshot().deliveryFailures()).isEqualTo(1);
    }

    @Test
    public void testDeadLettersAreReplayed() {
        InMemoryMemoryInterface memory = new InMemoryMemoryInterface().failNext(2);
        EventSink sink = newSink(memory, 1, Duration.ofSeconds(1), 2);

        sink.publish(event(0));
        sink.flush();
        assertThat(sink.deadLetterCount()).isEqualTo(1);

        assertThat(sink.replayDeadLetters()).isEqualTo(1);
        assertThat(sink.deadLetterCount()).isZero();
        assertThat(memory.events()).containsExactly(event(0));
        assertThat(memory.events().get(0).getZScores()).containsEntry("cpu", 4.5);
    }

    @Test
    public void testReplayKeepsMergedEventIntact() {
        InMemoryMemoryInterface memory = new InMemoryMemoryInterface().failNext(1);
        EventSink sink = newSink(memory, 1, Duration.ofSeconds(1), 1);
        AnomalyEvent merged = CorrelatedEvents.merge(List.of(
                anomaly("stat", "host-1", "cpu", BASE), anomaly("stat", "host-1", "memory", BASE)));

        sink.publish(merged);
        sink.flush();
        assertThat(sink.replayDeadLetters()).isEqualTo(1);

        AnomalyEvent replayed = memory.events().get(0);
        assertThat(replayed).isEqualTo(merged);
        assertThat(replayed.deduplicationKey()).isEqualTo(merged.deduplicationKey());
    }

    @Test
    public void testStuckAttemptsDoNotGrowThePool() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        MemoryInterface stuck = batch -> {
            boolean released = false;
            while (!released) {
                try {
                    release.await();
                    released = true;
                } catch (InterruptedException e) {
                    // keep waiting, like a client that ignores cancellation
                }
            }
            return IngestStatus.SUCCESS;
        };
        EventSink sink = newSink(stuck, 1, Duration.ofMillis(20), 1);
        try {
            for (int i = 0; i < EventSink.MAX_ATTEMPT_THREADS + 2; i++) {
                sink.publish(event(i));
            }
            sink.flush();

            assertThat(sink.attemptThreadCount()).isEqualTo(EventSink.MAX_ATTEMPT_THREADS);
            assertThat(deadLetters.count()).isEqualTo(EventSink.MAX_ATTEMPT_THREADS + 2);
            assertThat(deadLetters.list(10)).extracting(DeadLetter::reason)
                    .filteredOn(reason -> reason.startsWith("no delivery thread available"))
                    .hasSize(2);
        } finally {
            release.countDown();
        }
    }

    @Test
    public void testRecordingSinkStartsNoThreads() {
        InMemoryEventSink recording = new InMemoryEventSink();
        recording.publish(event(0));
        recording.flush();
        recording.close();

        assertThat(recording.records()).hasSize(1);
        assertThat(recording.attemptThreadCount()).isZero();
    }
}
