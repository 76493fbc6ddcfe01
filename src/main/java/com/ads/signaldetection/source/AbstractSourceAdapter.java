package com.ads.signaldetection.source;

import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.retry.ExponentialBackoff;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Connect-with-backoff, stop signalling and timestamp stamping shared by all adapters.
 * Subclasses implement {@link #doConnect()}, {@link #nextSample()} and {@link #doDisconnect()}.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    private final String sourceId;
    private final int connectAttempts;
    private final ExponentialBackoff backoff;
    protected final Clock clock;

    private volatile boolean connected;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    protected AbstractSourceAdapter(String sourceId, int connectAttempts, ExponentialBackoff backoff, Clock clock) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId is required");
        }
        if (connectAttempts <= 0) {
            throw new IllegalArgumentException("connectAttempts must be > 0, got " + connectAttempts);
        }
        this.sourceId = sourceId;
        this.connectAttempts = connectAttempts;
        this.backoff = backoff;
        this.clock = clock;
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public void connect() {
        Exception lastFailure = null;
        for (int attempt = 0; attempt < connectAttempts; attempt++) {
            if (isStopRequested()) {
                throw new SourceUnavailableException(sourceId, "stopped while connecting", lastFailure);
            }
            try {
                doConnect();
                connected = true;
                log.info("Source {} connected (attempt {}/{})", sourceId, attempt + 1, connectAttempts);
                return;
            } catch (Exception e) {
                lastFailure = e;
                log.warn("Source {} connect attempt {}/{} failed: {}", sourceId, attempt + 1, connectAttempts, e.getMessage());
            }
            if (attempt + 1 < connectAttempts) {
                try {
                    backoff.pause(attempt);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SourceUnavailableException(sourceId, "interrupted while connecting", e);
                }
            }
        }
        throw new SourceUnavailableException(sourceId, "gave up after " + connectAttempts + " connect attempts", lastFailure);
    }

    @Override
    public Stream<MetricSample> produceSamples() {
        if (!connected) {
            throw new IllegalStateException("Source " + sourceId + " is not connected");
        }
        Spliterator<MetricSample> spliterator = new Spliterators.AbstractSpliterator<>(
                Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super MetricSample> action) {
                while (connected && !isStopRequested() && !Thread.currentThread().isInterrupted()) {
                    MetricSample sample = nextSample();
                    if (sample != null) {
                        action.accept(stamp(sample));
                        return true;
                    }
                }
                return false;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public void stop() {
        stopSignal.countDown();
    }

    @Override
    public void disconnect() {
        boolean wasConnected = connected;
        connected = false;
        try {
            doDisconnect();
        } catch (Exception e) {
            log.warn("Source {} disconnect failed: {}", sourceId, e.getMessage());
        }
        if (wasConnected) {
            log.info("Source {} disconnected", sourceId);
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    protected boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Wait for up to {@code millis}, returning early if a stop was requested.
     *
     * @return true if a stop was requested
     */
    protected boolean awaitStop(long millis) {
        try {
            return stopSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Samples without a timestamp get the adapter's clock time; missing source ids get ours.
     */
    protected MetricSample stamp(MetricSample sample) {
        if (sample.getTimestamp() != null && sample.getSourceId() != null) {
            return sample;
        }
        return sample.toBuilder()
                .sourceId(sample.getSourceId() != null ? sample.getSourceId() : sourceId)
                .timestamp(sample.getTimestamp() != null ? sample.getTimestamp() : clock.instant())
                .build();
    }

    /**
     * @throws Exception any failure, reported as a failed attempt
     */
    protected abstract void doConnect() throws Exception;

    /**
     * Next sample, or null if none is available at this poll boundary.
     *
     * @throws SourceUnavailableException if the feed broke
     */
    protected abstract MetricSample nextSample();

    protected abstract void doDisconnect() throws Exception;
}
