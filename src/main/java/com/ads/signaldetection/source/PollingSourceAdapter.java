package com.ads.signaldetection.source;

import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.retry.ExponentialBackoff;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pull-style adapter: calls {@link #poll()} every {@code pollInterval} and hands the returned
 * samples out one by one. The wait between polls is the stop boundary.
 */
public abstract class PollingSourceAdapter extends AbstractSourceAdapter {

    private final Duration pollInterval;
    private final Deque<MetricSample> pending = new ArrayDeque<>();
    private boolean polledOnce;

    protected PollingSourceAdapter(String sourceId, Duration pollInterval, int connectAttempts,
                                   ExponentialBackoff backoff, Clock clock) {
        super(sourceId, connectAttempts, backoff, clock);
        if (pollInterval == null || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be >= 0");
        }
        this.pollInterval = pollInterval;
    }

    @Override
    protected MetricSample nextSample() {
        if (pending.isEmpty()) {
            if (polledOnce && awaitStop(pollInterval.toMillis())) {
                return null;
            }
            polledOnce = true;
            pending.addAll(poll());
        }
        return pending.poll();
    }

    @Override
    protected void doDisconnect() throws Exception {
        pending.clear();
        polledOnce = false;
    }

    @Override
    public List<MetricSample> drainPending() {
        List<MetricSample> drained = new ArrayList<>(pending.size());
        pending.forEach(sample -> drained.add(stamp(sample)));
        pending.clear();
        return drained;
    }

    /**
     * One round of readings. Samples of one round should share a timestamp so they are
     * evaluated together.
     *
     * @throws SourceUnavailableException if the feed cannot be read
     */
    protected abstract List<MetricSample> poll();
}
