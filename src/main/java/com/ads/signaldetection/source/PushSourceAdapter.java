package com.ads.signaldetection.source;

import com.ads.signaldetection.metrics.Metrics;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.retry.ExponentialBackoff;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Push-style adapter: the feed calls back with samples, which go into a bounded hand-off
 * buffer that {@link #produceSamples()} reads from.
 * <p>
 * A callback blocks for up to {@code handoffTimeout} when the buffer is full, then drops
 * the sample and counts it.
 */
@Slf4j
public abstract class PushSourceAdapter extends AbstractSourceAdapter {

    private static final long POLL_BOUNDARY_MS = 200;

    private final BlockingQueue<MetricSample> handoff;
    private final Duration handoffTimeout;
    protected final Metrics metrics;

    protected PushSourceAdapter(String sourceId, int handoffCapacity, Duration handoffTimeout, Metrics metrics,
                                int connectAttempts, ExponentialBackoff backoff, Clock clock) {
        super(sourceId, connectAttempts, backoff, clock);
        this.handoff = new ArrayBlockingQueue<>(handoffCapacity);
        this.handoffTimeout = handoffTimeout;
        this.metrics = metrics;
    }

    /**
     * Called from the feed's callback thread.
     *
     * @return false if the sample was dropped
     */
    protected boolean deliver(MetricSample sample) {
        try {
            if (handoff.offer(sample, handoffTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        metrics.onSampleDropped(sourceId(), 1);
        log.warn("Source {} hand-off buffer full, dropped {} sample", sourceId(), sample.getMetricName());
        return false;
    }

    @Override
    protected MetricSample nextSample() {
        try {
            return handoff.poll(POLL_BOUNDARY_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    @Override
    public List<MetricSample> drainPending() {
        List<MetricSample> drained = new ArrayList<>();
        handoff.drainTo(drained);
        drained.replaceAll(this::stamp);
        return drained;
    }

    public int pendingCount() {
        return handoff.size();
    }
}
