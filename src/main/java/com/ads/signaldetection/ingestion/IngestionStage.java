package com.ads.signaldetection.ingestion;

import com.ads.signaldetection.metrics.Metrics;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.model.OverflowRecord;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bounded admission queue between sources and detection, with disk spillover.
 * <p>
 * Admission never blocks longer than {@code offerTimeout}. When the queue is full the sample is
 * spilled to the {@link OverflowStore}; once a source has samples in overflow its later samples
 * are spilled behind them, so replay preserves per-source order. A periodic recovery sweep moves
 * whole records back into the queue, oldest first, when there is room for them. Each
 * {@link #take(Duration)} that frees a slot while overflow is pending also replays the oldest
 * record if it fits, so sources with spilled samples get a turn even while other sources keep
 * the queue full. Replay is paused while the pipeline is stopped and once the stage is
 * exhausted; spilled records then stay on disk.
 * <p>
 * Spill failures drop the affected samples. After {@code fatalAfter} consecutive spill failures
 * the stage is exhausted and the registered fatal handler is notified.
 */
@Slf4j
@Component
public class IngestionStage {

    private final BlockingQueue<MetricSample> queue;
    private final int capacity;
    private final OverflowStore overflowStore;
    private final Metrics metrics;
    private final int spillBatchSize;
    private final Duration offerTimeout;
    private final int fatalAfter;

    // guarded by lock
    private final Map<String, Integer> pendingBySource = new HashMap<>();
    private final Map<String, List<MetricSample>> staged = new HashMap<>();
    private int consecutiveSpillFailures;
    private final Object lock = new Object();

    private volatile boolean exhausted;
    private volatile boolean recoveryPaused;
    private volatile Consumer<IngestionExhaustedException> fatalHandler = e -> { };

    @Autowired
    public IngestionStage(
            OverflowStore overflowStore,
            Metrics metrics,
            @Value("${signal.ingestion.queue-capacity:10000}") int capacity,
            @Value("${signal.ingestion.offer-timeout-ms:0}") long offerTimeoutMs,
            @Value("${signal.ingestion.spillover.batch-size:1}") int spillBatchSize,
            @Value("${signal.ingestion.spillover.fatal-after:10}") int fatalAfter
    ) {
        this(overflowStore, metrics, capacity, Duration.ofMillis(offerTimeoutMs), spillBatchSize, fatalAfter);
    }

    public IngestionStage(OverflowStore overflowStore, Metrics metrics, int capacity,
                          Duration offerTimeout, int spillBatchSize, int fatalAfter) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("queue capacity must be > 0, got " + capacity);
        }
        if (spillBatchSize <= 0) {
            throw new IllegalArgumentException("spill batch size must be > 0, got " + spillBatchSize);
        }
        if (fatalAfter <= 0) {
            throw new IllegalArgumentException("fatal-after must be > 0, got " + fatalAfter);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.overflowStore = overflowStore;
        this.metrics = metrics;
        this.offerTimeout = offerTimeout;
        this.spillBatchSize = spillBatchSize;
        this.fatalAfter = fatalAfter;
    }

    /**
     * Restore per-source ordering state from records left over by a previous run.
     */
    @PostConstruct
    public void initialize() {
        synchronized (lock) {
            pendingBySource.putAll(overflowStore.pendingBySource());
        }
        log.info("Initialized IngestionStage (capacity={}, spillBatchSize={}, offerTimeout={}, pendingOverflow={})",
                capacity, spillBatchSize, offerTimeout, overflowStore.sampleCount());
    }

    public void onFatal(Consumer<IngestionExhaustedException> handler) {
        this.fatalHandler = handler;
    }

    /**
     * Admit one sample.
     *
     * @return ENQUEUED when the sample went straight into the queue, SPILLED when it was handed
     * to the overflow path, DROPPED when it could not be kept
     */
    public SubmitResult submit(MetricSample sample) {
        String sourceId = sample.getSourceId();
        metrics.onSampleReceived(sourceId);
        if (exhausted) {
            metrics.onSampleDropped(sourceId, 1);
            return SubmitResult.DROPPED;
        }
        synchronized (lock) {
            if (pendingBySource.getOrDefault(sourceId, 0) == 0 && offer(sample)) {
                metrics.onSampleEnqueued(sourceId);
                return SubmitResult.ENQUEUED;
            }
            return spill(sourceId, sample);
        }
    }

    private boolean offer(MetricSample sample) {
        if (offerTimeout.isZero() || offerTimeout.isNegative()) {
            return queue.offer(sample);
        }
        try {
            return queue.offer(sample, offerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // caller holds lock
    private SubmitResult spill(String sourceId, MetricSample sample) {
        List<MetricSample> batch = staged.computeIfAbsent(sourceId, k -> new ArrayList<>());
        batch.add(sample);
        pendingBySource.merge(sourceId, 1, Integer::sum);
        if (batch.size() < spillBatchSize) {
            return SubmitResult.SPILLED;
        }
        return writeStaged(sourceId) ? SubmitResult.SPILLED : SubmitResult.DROPPED;
    }

    // caller holds lock
    private boolean writeStaged(String sourceId) {
        List<MetricSample> batch = staged.remove(sourceId);
        if (batch == null || batch.isEmpty()) {
            return true;
        }
        try {
            overflowStore.append(sourceId, batch);
            consecutiveSpillFailures = 0;
            metrics.onSpilloverWrite(sourceId, batch.size());
            return true;
        } catch (SpilloverFailureException e) {
            int remaining = pendingBySource.merge(sourceId, -batch.size(), Integer::sum);
            if (remaining <= 0) {
                pendingBySource.remove(sourceId);
            }
            metrics.onSampleDropped(sourceId, batch.size());
            consecutiveSpillFailures++;
            log.warn("Dropped {} samples of {}: {} (consecutive spill failures: {})",
                    batch.size(), sourceId, e.getMessage(), consecutiveSpillFailures);
            if (consecutiveSpillFailures >= fatalAfter && !exhausted) {
                exhausted = true;
                IngestionExhaustedException fatal = new IngestionExhaustedException(
                        "Admission queue full and overflow store failed " + consecutiveSpillFailures + " times in a row", e);
                log.error("Ingestion exhausted, signalling shutdown", fatal);
                fatalHandler.accept(fatal);
            }
            return false;
        }
    }

    /**
     * Write every staged partial batch to the overflow store.
     */
    public void flushStaged() {
        synchronized (lock) {
            for (String sourceId : new ArrayList<>(staged.keySet())) {
                writeStaged(sourceId);
            }
        }
    }

    /**
     * Re-enqueue spilled records, oldest first, while the queue has room for a whole record.
     * Does nothing while recovery is paused or the stage is exhausted.
     *
     * @return number of samples moved back into the queue
     */
    @Scheduled(fixedDelayString = "${signal.ingestion.spillover.sweep-interval-ms:1000}")
    public int recoverySweep() {
        if (recoveryPaused || exhausted) {
            return 0;
        }
        int replayed;
        synchronized (lock) {
            flushStaged();
            replayed = replay(Integer.MAX_VALUE);
        }
        if (replayed > 0) {
            log.debug("Recovery sweep replayed {} samples ({} still in overflow)", replayed, overflowDepth());
        }
        return replayed;
    }

    // caller holds lock; all queue inserts happen under lock, so a checked free slot stays free
    private int replay(int maxRecords) {
        int replayed = 0;
        try {
            for (int records = 0; records < maxRecords; records++) {
                Optional<OverflowRecord> next = overflowStore.oldest();
                if (next.isEmpty() || queue.remainingCapacity() < next.get().size()) {
                    break;
                }
                OverflowRecord record = next.get();
                // a record is enqueued only once it is gone from disk, so it can never be replayed twice
                overflowStore.delete(record);
                for (MetricSample sample : record.samples()) {
                    queue.add(sample);
                }
                int remaining = pendingBySource.merge(record.sourceId(), -record.size(), Integer::sum);
                if (remaining <= 0) {
                    pendingBySource.remove(record.sourceId());
                }
                replayed += record.size();
            }
        } catch (SpilloverFailureException e) {
            log.warn("Overflow replay interrupted: {}", e.getMessage());
        }
        if (replayed > 0) {
            metrics.onSpilloverReplay(replayed);
        }
        return replayed;
    }

    /**
     * Next admitted sample, waiting up to {@code timeout}. When overflow is pending, the slot
     * this frees goes to the oldest spilled record if the record fits.
     *
     * @return the sample, or null on timeout
     */
    public MetricSample take(Duration timeout) throws InterruptedException {
        MetricSample sample = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (sample != null && !recoveryPaused && !exhausted) {
            synchronized (lock) {
                if (!pendingBySource.isEmpty()) {
                    replay(1);
                }
            }
        }
        return sample;
    }

    /**
     * Stop moving spilled records back into the queue. Admission is unaffected.
     */
    public void pauseRecovery() {
        recoveryPaused = true;
    }

    public void resumeRecovery() {
        recoveryPaused = false;
    }

    /**
     * Remove every sample still waiting in the queue.
     *
     * @return number of samples removed
     */
    public int discardQueued() {
        List<MetricSample> discarded = new ArrayList<>();
        queue.drainTo(discarded);
        return discarded.size();
    }

    public int depth() {
        return queue.size();
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Samples waiting in the overflow path, staged or on disk.
     */
    public long overflowDepth() {
        synchronized (lock) {
            long total = 0;
            for (int pending : pendingBySource.values()) {
                total += pending;
            }
            return total;
        }
    }

    public boolean isExhausted() {
        return exhausted;
    }
}
