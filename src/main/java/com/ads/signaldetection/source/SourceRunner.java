package com.ads.signaldetection.source;

import com.ads.signaldetection.ingestion.IngestionStage;
import com.ads.signaldetection.ingestion.SubmitResult;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.retry.ExponentialBackoff;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one source adapter on its own thread: connect, stream samples into the ingestion
 * stage, and reconnect with backoff whenever the source becomes unavailable. A failing source
 * never affects other runners.
 * <p>
 * A requested stop leaves the adapter connected: the owner resubmits what the adapter still
 * holds with {@link #resubmitPending()} and disconnects it with {@link #close()} once admitted
 * work has drained.
 */
@Slf4j
public class SourceRunner implements Runnable {

    private final SourceAdapter adapter;
    private final IngestionStage ingestion;
    private final ExponentialBackoff reconnectBackoff;

    private volatile SourceState state = SourceState.CONNECTING;
    private volatile boolean stopRequested;

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong spilled = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public SourceRunner(SourceAdapter adapter, IngestionStage ingestion, ExponentialBackoff reconnectBackoff) {
        this.adapter = adapter;
        this.ingestion = ingestion;
        this.reconnectBackoff = reconnectBackoff;
    }

    @Override
    public void run() {
        int failures = 0;
        try {
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                state = SourceState.CONNECTING;
                try {
                    adapter.connect();
                    state = SourceState.RUNNING;
                    failures = 0;
                    adapter.produceSamples().forEach(this::submit);
                    if (!stopRequested) {
                        log.warn("Source {} stream ended unexpectedly, reconnecting", adapter.sourceId());
                        adapter.disconnect();
                    }
                } catch (RuntimeException e) {
                    if (stopRequested) {
                        break;
                    }
                    state = SourceState.DEGRADED;
                    if (e instanceof SourceUnavailableException) {
                        log.warn("Source {} degraded: {}", adapter.sourceId(), e.getMessage());
                    } else {
                        log.error("Source {} failed, reconnecting", adapter.sourceId(), e);
                    }
                    adapter.disconnect();
                    reconnectBackoff.pause(failures++);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!stopRequested) {
                adapter.disconnect();
            }
            state = SourceState.STOPPED;
            log.info("Source {} runner stopped (enqueued={}, spilled={}, dropped={})",
                    adapter.sourceId(), enqueued.get(), spilled.get(), dropped.get());
        }
    }

    private void submit(MetricSample sample) {
        SubmitResult result = ingestion.submit(sample);
        switch (result) {
            case ENQUEUED -> enqueued.incrementAndGet();
            case SPILLED -> spilled.incrementAndGet();
            case DROPPED -> dropped.incrementAndGet();
        }
    }

    /**
     * Submit samples the adapter received but had not handed out when the runner stopped.
     *
     * @return number of samples submitted
     */
    public int resubmitPending() {
        List<MetricSample> pending = adapter.drainPending();
        pending.forEach(this::submit);
        if (!pending.isEmpty()) {
            log.info("Source {} resubmitted {} pending samples", adapter.sourceId(), pending.size());
        }
        return pending.size();
    }

    /**
     * Disconnect the adapter, discarding whatever it still holds.
     *
     * @return number of samples discarded, also counted as dropped by this runner
     */
    public int close() {
        List<MetricSample> discarded = new ArrayList<>(adapter.drainPending());
        adapter.disconnect();
        discarded.addAll(adapter.drainPending());
        if (!discarded.isEmpty()) {
            dropped.addAndGet(discarded.size());
            log.warn("Source {} closed with {} samples never admitted", adapter.sourceId(), discarded.size());
        }
        return discarded.size();
    }

    /**
     * Ask the runner to stop at the adapter's next poll boundary.
     */
    public void stop() {
        stopRequested = true;
        adapter.stop();
    }

    public String sourceId() {
        return adapter.sourceId();
    }

    public SourceState state() {
        return state;
    }

    public long enqueuedCount() {
        return enqueued.get();
    }

    public long spilledCount() {
        return spilled.get();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
