package com.ads.signaldetection.engine;

import com.ads.signaldetection.ingestion.IngestionStage;
import com.ads.signaldetection.model.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Moves samples from the ingestion queue to the detection engine.
 * <p>
 * A dispatcher thread routes each sample to one of {@code workerCount} shards by source id, so
 * every window has a single writer and per-source order is kept. Each shard thread groups
 * consecutive samples with the same source and timestamp into one evaluation pass. A full
 * shard blocks only the dispatcher, which lets the ingestion queue (and then spillover)
 * absorb the backlog.
 * <p>
 * A drain that misses its deadline abandons the remaining work: samples still queued, routed
 * or in an unfinished pass are returned as a count so the caller can record them as drops.
 */
@Slf4j
@Component
public class DetectionWorkers {

    private static final Duration POLL = Duration.ofMillis(200);

    private final IngestionStage ingestion;
    private final DetectionEngine engine;
    private final int workerCount;
    private final int shardCapacity;
    private final Duration passLinger;

    private final List<Shard> shards = new ArrayList<>();
    private Thread dispatcher;

    private volatile boolean running;
    private volatile boolean draining;
    private volatile boolean dispatcherDone;
    private volatile boolean abandoned;
    private volatile MetricSample handing;

    @Autowired
    public DetectionWorkers(
            IngestionStage ingestion,
            DetectionEngine engine,
            @Value("${signal.workers.count:4}") int workerCount,
            @Value("${signal.workers.shard-capacity:1000}") int shardCapacity,
            @Value("${signal.workers.pass-linger-ms:2}") long passLingerMs
    ) {
        this(ingestion, engine, workerCount, shardCapacity, Duration.ofMillis(passLingerMs));
    }

    public DetectionWorkers(IngestionStage ingestion, DetectionEngine engine, int workerCount,
                            int shardCapacity, Duration passLinger) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("worker count must be > 0, got " + workerCount);
        }
        if (shardCapacity <= 0) {
            throw new IllegalArgumentException("shard capacity must be > 0, got " + shardCapacity);
        }
        this.ingestion = ingestion;
        this.engine = engine;
        this.workerCount = workerCount;
        this.shardCapacity = shardCapacity;
        this.passLinger = passLinger;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        draining = false;
        dispatcherDone = false;
        abandoned = false;
        handing = null;
        shards.clear();
        for (int i = 0; i < workerCount; i++) {
            Shard shard = new Shard(i, new ArrayBlockingQueue<>(shardCapacity));
            shard.thread = new Thread(shard::run, "detection-worker-" + i);
            shard.thread.setDaemon(true);
            shards.add(shard);
            shard.thread.start();
        }
        dispatcher = new Thread(this::dispatch, "detection-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("Started {} detection workers (shardCapacity={})", workerCount, shardCapacity);
    }

    private void dispatch() {
        try {
            while (running && !abandoned) {
                MetricSample sample = ingestion.take(POLL);
                if (sample == null) {
                    if (draining) {
                        break;
                    }
                    continue;
                }
                handing = sample;
                shardFor(sample.getSourceId()).queue.put(sample);
                handing = null;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            dispatcherDone = true;
        }
    }

    Shard shardFor(String sourceId) {
        return shards.get(Math.floorMod(Objects.hashCode(sourceId), shards.size()));
    }

    /**
     * Process everything already admitted, then stop the threads.
     *
     * @return number of admitted samples abandoned because the drain missed {@code timeout},
     * zero after a clean drain
     */
    public long drainAndStop(Duration timeout) {
        Thread dispatcherThread;
        List<Shard> current;
        synchronized (this) {
            if (!running) {
                return 0;
            }
            draining = true;
            dispatcherThread = dispatcher;
            current = List.copyOf(shards);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean clean = join(dispatcherThread, deadline);
        for (Shard shard : current) {
            clean &= join(shard.thread, deadline);
        }
        synchronized (this) {
            running = false;
        }
        if (clean) {
            log.info("Detection workers drained and stopped");
            return 0;
        }
        long lost = abandon(dispatcherThread, current);
        log.warn("Detection workers did not drain within {}, abandoned {} samples", timeout, lost);
        return lost;
    }

    private long abandon(Thread dispatcherThread, List<Shard> current) {
        abandoned = true;
        dispatcherThread.interrupt();
        current.forEach(shard -> shard.thread.interrupt());

        // threads blocked on a queue exit at once, a thread inside a detector gets one poll interval
        long settleDeadline = System.nanoTime() + POLL.toNanos();
        join(dispatcherThread, settleDeadline);
        for (Shard shard : current) {
            join(shard.thread, settleDeadline);
        }

        long lost = ingestion.discardQueued();
        if (handing != null) {
            lost++;
            handing = null;
        }
        for (Shard shard : current) {
            lost += shard.discard();
        }
        return lost;
    }

    private static boolean join(Thread thread, long deadlineNanos) {
        long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        try {
            thread.join(Math.max(1, remainingMillis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    /**
     * Samples routed to shards but not yet evaluated.
     */
    public int backlog() {
        int total = 0;
        for (Shard shard : List.copyOf(shards)) {
            total += shard.queue.size();
        }
        return total;
    }

    public boolean isRunning() {
        return running;
    }

    final class Shard {
        private final int index;
        private final BlockingQueue<MetricSample> queue;
        private Thread thread;
        private volatile MetricSample carry;
        private volatile List<MetricSample> inFlight;

        private Shard(int index, BlockingQueue<MetricSample> queue) {
            this.index = index;
            this.queue = queue;
        }

        private void run() {
            try {
                while (!abandoned) {
                    MetricSample first = carry != null ? carry : queue.poll(POLL.toMillis(), TimeUnit.MILLISECONDS);
                    if (first == null) {
                        if (dispatcherDone && queue.isEmpty()) {
                            break;
                        }
                        continue;
                    }
                    List<MetricSample> pass = collectPass(first);
                    try {
                        engine.process(pass);
                    } catch (RuntimeException e) {
                        log.error("Shard {} failed to process pass of {} samples from {}",
                                index, pass.size(), first.getSourceId(), e);
                    } finally {
                        inFlight = null;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private List<MetricSample> collectPass(MetricSample first) throws InterruptedException {
            List<MetricSample> pass = new ArrayList<>();
            pass.add(first);
            inFlight = pass;
            carry = null;
            while (true) {
                MetricSample next = passLinger.isZero()
                        ? queue.poll()
                        : queue.poll(passLinger.toMillis(), TimeUnit.MILLISECONDS);
                if (next == null) {
                    return pass;
                }
                if (!samePass(first, next)) {
                    carry = next;
                    return pass;
                }
                pass.add(next);
            }
        }

        // an unfinished pass counts as lost even if its detectors return later
        private int discard() {
            List<MetricSample> rest = new ArrayList<>();
            queue.drainTo(rest);
            int lost = rest.size();
            if (carry != null) {
                lost++;
                carry = null;
            }
            List<MetricSample> pass = inFlight;
            if (pass != null) {
                lost += pass.size();
                inFlight = null;
            }
            return lost;
        }
    }

    static boolean samePass(MetricSample a, MetricSample b) {
        return Objects.equals(a.getSourceId(), b.getSourceId())
                && Objects.equals(a.getTimestamp(), b.getTimestamp());
    }
}
