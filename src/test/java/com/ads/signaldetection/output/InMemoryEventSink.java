package com.ads.signaldetection.output;

import com.ads.signaldetection.metrics.NoOpMetrics;
import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.retry.ExponentialBackoff;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that records published events instead of batching and delivering them. Its delivery
 * threads are never started.
 */
public class InMemoryEventSink extends EventSink {

    private final List<AnomalyEvent> events = new CopyOnWriteArrayList<>();

    public InMemoryEventSink() {
        super(batch -> IngestStatus.SUCCESS, null, new NoOpMetrics(), 1, Duration.ofSeconds(1),
                Duration.ofSeconds(1), 1, ExponentialBackoff.ofMillis(0, 0), Clock.systemUTC());
    }

    @Override
    public void publish(AnomalyEvent event) {
        events.add(event);
    }

    @Override
    public void flush() {
        // nothing buffered
    }

    @Override
    public long deadLetterCount() {
        return 0;
    }

    public List<AnomalyEvent> records() {
        return events;
    }
}
