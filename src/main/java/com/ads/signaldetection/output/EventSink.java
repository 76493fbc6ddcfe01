package com.ads.signaldetection.output;

import com.ads.signaldetection.metrics.Metrics;
import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.DeadLetter;
import com.ads.signaldetection.retry.ExponentialBackoff;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batches anomaly events and delivers them to the {@link MemoryInterface} at least once.
 * <p>
 * A batch is cut when it reaches {@code batchSize} or when its oldest event has waited
 * {@code flushInterval}. Batches are delivered one at a time, in order, on a single delivery
 * thread. A failed attempt (FAILURE status, exception or timeout) is retried with exponential
 * backoff up to {@code maxAttempts} attempts in total; a batch that still fails is written to
 * the {@link DeadLetterStore} and counted once as a delivery failure.
 * <p>
 * Attempts run on a small bounded pool. An attempt that times out but ignores interruption keeps
 * its thread; once {@link #MAX_ATTEMPT_THREADS} are stuck that way, further attempts fail
 * immediately instead of starting new threads.
 */
@Slf4j
@Component
public class EventSink {

    static final int MAX_ATTEMPT_THREADS = 4;

    private final MemoryInterface memory;
    private final DeadLetterStore deadLetters;
    private final Metrics metrics;
    private final int batchSize;
    private final Duration flushInterval;
    private final Duration deliveryTimeout;
    private final int maxAttempts;
    private final ExponentialBackoff retryBackoff;
    private final Clock clock;

    // created on first use, guarded by executorLock
    private ExecutorService deliveryExecutor;
    private ThreadPoolExecutor attemptExecutor;
    private final Object executorLock = new Object();

    // guarded by this
    private List<AnomalyEvent> buffer = new ArrayList<>();
    private Instant oldestBufferedAt;

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    @Autowired
    public EventSink(
            MemoryInterface memory,
            DeadLetterStore deadLetters,
            Metrics metrics,
            @Value("${signal.sink.batch-size:50}") int batchSize,
            @Value("${signal.sink.flush-interval-ms:1000}") long flushIntervalMs,
            @Value("${signal.sink.delivery-timeout-ms:5000}") long deliveryTimeoutMs,
            @Value("${signal.sink.max-retry-attempts:3}") int maxAttempts,
            @Value("${signal.sink.retry-base-delay-ms:200}") long retryBaseMs,
            @Value("${signal.sink.retry-max-delay-ms:5000}") long retryMaxMs
    ) {
        this(memory, deadLetters, metrics, batchSize, Duration.ofMillis(flushIntervalMs),
                Duration.ofMillis(deliveryTimeoutMs), maxAttempts, ExponentialBackoff.ofMillis(retryBaseMs, retryMaxMs),
                Clock.systemUTC());
    }

    public EventSink(MemoryInterface memory, DeadLetterStore deadLetters, Metrics metrics, int batchSize,
                     Duration flushInterval, Duration deliveryTimeout, int maxAttempts,
                     ExponentialBackoff retryBackoff, Clock clock) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batch size must be > 0, got " + batchSize);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("max retry attempts must be > 0, got " + maxAttempts);
        }
        this.memory = memory;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.batchSize = batchSize;
        this.flushInterval = flushInterval;
        this.deliveryTimeout = deliveryTimeout;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
        this.clock = clock;
        log.info("Initialized EventSink (batchSize={}, flushInterval={}, deliveryTimeout={}, maxAttempts={})",
                batchSize, flushInterval, deliveryTimeout, maxAttempts);
    }

    /**
     * Buffer an event; cuts and schedules a batch once {@code batchSize} events are buffered.
     */
    public void publish(AnomalyEvent event) {
        List<AnomalyEvent> batch = null;
        synchronized (this) {
            if (buffer.isEmpty()) {
                oldestBufferedAt = clock.instant();
            }
            buffer.add(event);
            if (buffer.size() >= batchSize) {
                batch = cut();
            }
        }
        if (batch != null) {
            schedule(batch);
        }
    }

    /**
     * Cut a batch if the oldest buffered event has waited {@code flushInterval}.
     */
    @Scheduled(fixedDelayString = "${signal.sink.flush-tick-ms:100}")
    public void flushTick() {
        List<AnomalyEvent> batch = null;
        synchronized (this) {
            if (!buffer.isEmpty()
                    && !clock.instant().isBefore(oldestBufferedAt.plus(flushInterval))) {
                batch = cut();
            }
        }
        if (batch != null) {
            schedule(batch);
        }
    }

    /**
     * Deliver everything buffered and wait until every scheduled batch is either delivered or
     * dead-lettered.
     */
    public void flush() {
        List<AnomalyEvent> batch;
        synchronized (this) {
            batch = buffer.isEmpty() ? null : cut();
        }
        if (batch != null) {
            schedule(batch);
        }
        awaitDeliveryThread(() -> null);
    }

    /**
     * Re-deliver dead letters, oldest first, deleting each one that is acknowledged.
     * Stops at the first batch that still fails.
     *
     * @return number of dead letters delivered
     */
    public int replayDeadLetters() {
        Integer replayed = awaitDeliveryThread(() -> {
            int delivered = 0;
            for (DeadLetter letter : deadLetters.list(Integer.MAX_VALUE)) {
                String failure = attempt(letter.events());
                if (failure != null) {
                    log.warn("Dead letter {} still undeliverable: {}", letter.id(), failure);
                    break;
                }
                deadLetters.delete(letter.id());
                metrics.onBatchDelivered(letter.events().size());
                delivered++;
            }
            if (delivered > 0) {
                log.info("Replayed {} dead letters", delivered);
            }
            return delivered;
        });
        return replayed == null ? 0 : replayed;
    }

    // caller holds this
    private List<AnomalyEvent> cut() {
        List<AnomalyEvent> batch = buffer;
        buffer = new ArrayList<>();
        oldestBufferedAt = null;
        return batch;
    }

    private void schedule(List<AnomalyEvent> batch) {
        inFlight.addAndGet(batch.size());
        deliveryExecutor().execute(() -> {
            try {
                deliver(batch);
            } finally {
                inFlight.addAndGet(-batch.size());
            }
        });
    }

    void deliver(List<AnomalyEvent> batch) {
        String failure = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            failure = attempt(batch);
            if (failure == null) {
                metrics.onBatchDelivered(batch.size());
                log.debug("Delivered batch of {} events (attempt {}/{})", batch.size(), attempt + 1, maxAttempts);
                return;
            }
            log.warn("Delivery attempt {}/{} for batch of {} events failed: {}",
                    attempt + 1, maxAttempts, batch.size(), failure);
            if (attempt + 1 < maxAttempts) {
                try {
                    retryBackoff.pause(attempt);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failure = "interrupted during retry backoff";
                    break;
                }
            }
        }
        deadLetter(batch, failure);
    }

    /**
     * One bounded delivery attempt.
     *
     * @return null on success, otherwise the failure reason
     */
    private String attempt(List<AnomalyEvent> batch) {
        Future<IngestStatus> call;
        try {
            call = attemptExecutor().submit(() -> memory.ingest(List.copyOf(batch)));
        } catch (RejectedExecutionException e) {
            return "no delivery thread available, " + MAX_ATTEMPT_THREADS + " earlier attempts still running";
        }
        try {
            IngestStatus status = call.get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return status == IngestStatus.SUCCESS ? null : "memory interface returned " + status;
        } catch (TimeoutException e) {
            call.cancel(true);
            return "timed out after " + deliveryTimeout.toMillis() + " ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return cause.getClass().getSimpleName() + ": " + cause.getMessage();
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return "interrupted";
        }
    }

    private void deadLetter(List<AnomalyEvent> batch, String reason) {
        metrics.onDeliveryFailure();
        try {
            DeadLetter letter = deadLetters.store(batch, maxAttempts, reason);
            log.error("ALERT: batch of {} anomaly events dead-lettered as {} after {} attempts: {}",
                    batch.size(), letter.id(), maxAttempts, reason);
        } catch (DeliveryFailureException e) {
            log.error("ALERT: batch of {} anomaly events could not be dead-lettered, events {}",
                    batch.size(), batch.stream().map(AnomalyEvent::getEventId).toList(), e);
        }
    }

    private <T> T awaitDeliveryThread(Callable<T> task) {
        try {
            return deliveryExecutor().submit(task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            throw new DeliveryFailureException("Delivery thread task failed", e.getCause());
        }
    }

    /**
     * Events buffered or scheduled but not yet delivered or dead-lettered.
     */
    public int pendingCount() {
        synchronized (this) {
            return buffer.size() + inFlight.get();
        }
    }

    public long deadLetterCount() {
        return deadLetters.count();
    }

    /**
     * Attempt threads currently alive, busy or idle.
     */
    int attemptThreadCount() {
        synchronized (executorLock) {
            return attemptExecutor == null ? 0 : attemptExecutor.getPoolSize();
        }
    }

    private ExecutorService deliveryExecutor() {
        synchronized (executorLock) {
            if (deliveryExecutor == null) {
                deliveryExecutor = Executors.newSingleThreadExecutor(daemon("event-sink-delivery"));
            }
            return deliveryExecutor;
        }
    }

    private ExecutorService attemptExecutor() {
        synchronized (executorLock) {
            if (attemptExecutor == null) {
                attemptExecutor = new ThreadPoolExecutor(0, MAX_ATTEMPT_THREADS, 30, TimeUnit.SECONDS,
                        new SynchronousQueue<>(), daemon("event-sink-attempt"));
            }
            return attemptExecutor;
        }
    }

    @PreDestroy
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        flush();
        synchronized (executorLock) {
            if (deliveryExecutor != null) {
                deliveryExecutor.shutdown();
            }
            if (attemptExecutor != null) {
                attemptExecutor.shutdownNow();
            }
        }
        log.info("Event sink closed ({} dead letters stored)", deadLetterCount());
    }

    private static ThreadFactory daemon(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
