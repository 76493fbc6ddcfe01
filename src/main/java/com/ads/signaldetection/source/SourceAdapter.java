package com.ads.signaldetection.source;

import com.ads.signaldetection.model.MetricSample;

import java.util.List;
import java.util.stream.Stream;

/**
 * A pluggable telemetry feed.
 * <p>
 * Lifecycle: {@link #connect()}, then consume {@link #produceSamples()} until it ends, then
 * {@link #disconnect()}. An adapter may be connected again after a failure. After a
 * {@link #stop()} the adapter stays connected until its owner disconnects it.
 */
public interface SourceAdapter {

    String sourceId();

    /**
     * Connect to the external feed, retrying with exponential backoff.
     *
     * @throws SourceUnavailableException when every attempt failed
     */
    void connect();

    /**
     * Lazy, ordered, unbounded stream of samples. Ends when the adapter is disconnected or
     * stopped; a stop request is observed at the next poll boundary.
     *
     * @throws SourceUnavailableException from the stream if the feed breaks mid-stream
     */
    Stream<MetricSample> produceSamples();

    /**
     * Request a cooperative stop. Returns immediately.
     */
    void stop();

    void disconnect();

    boolean isConnected();

    /**
     * Remove samples received but not yet handed out by {@link #produceSamples()}, stamped
     * the same way.
     */
    default List<MetricSample> drainPending() {
        return List.of();
    }
}
