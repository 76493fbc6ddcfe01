package com.ads.signaldetection.engine;

import com.ads.signaldetection.config.SignalDetectionProperties;
import com.ads.signaldetection.config.SignalDetectionProperties.SourceProperties;
import com.ads.signaldetection.ingestion.IngestionExhaustedException;
import com.ads.signaldetection.ingestion.IngestionStage;
import com.ads.signaldetection.metrics.Metrics;
import com.ads.signaldetection.output.EventSink;
import com.ads.signaldetection.retry.ExponentialBackoff;
import com.ads.signaldetection.source.SourceAdapter;
import com.ads.signaldetection.source.SourceFactory;
import com.ads.signaldetection.source.SourceRunner;
import com.ads.signaldetection.source.SourceState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifecycle of the whole pipeline: one runner thread per configured source feeding the
 * ingestion stage, the detection workers, and the event sink.
 * <p>
 * Shutdown is cooperative and keeps every admitted sample accounted for:
 * <ol>
 *   <li>overflow replay is paused, so spilled samples stay on disk for the next start;</li>
 *   <li>sources stop at their next poll boundary and resubmit what their adapters still hold,
 *   and runners that do not stop within {@code shutdownGrace} are torn down with their
 *   undelivered samples counted as drops;</li>
 *   <li>admitted samples are evaluated, and whatever the workers abandon at the deadline is
 *   counted as dropped;</li>
 *   <li>the remaining adapters are disconnected;</li>
 *   <li>staged spill batches are written and the sink is flushed.</li>
 * </ol>
 */
@Slf4j
@Component
public class DetectionPipeline {

    private final List<SourceProperties> sourceConfigs;
    private final SourceFactory sourceFactory;
    private final IngestionStage ingestion;
    private final DetectionWorkers workers;
    private final EventSink eventSink;
    private final Metrics metrics;
    private final Duration shutdownGrace;
    private final ExponentialBackoff reconnectBackoff;

    private final List<SourceRunner> runners = new CopyOnWriteArrayList<>();
    private ExecutorService sourceExecutor;

    private volatile boolean running;
    private volatile IngestionExhaustedException fatalError;

    @Autowired
    public DetectionPipeline(
            SignalDetectionProperties properties,
            SourceFactory sourceFactory,
            IngestionStage ingestion,
            DetectionWorkers workers,
            EventSink eventSink,
            Metrics metrics,
            @Value("${signal.pipeline.shutdown-grace-ms:10000}") long shutdownGraceMs,
            @Value("${signal.pipeline.reconnect-base-delay-ms:1000}") long reconnectBaseMs,
            @Value("${signal.pipeline.reconnect-max-delay-ms:60000}") long reconnectMaxMs
    ) {
        this(properties.sources(), sourceFactory, ingestion, workers, eventSink, metrics,
                Duration.ofMillis(shutdownGraceMs), ExponentialBackoff.ofMillis(reconnectBaseMs, reconnectMaxMs));
    }

    public DetectionPipeline(List<SourceProperties> sourceConfigs, SourceFactory sourceFactory,
                             IngestionStage ingestion, DetectionWorkers workers, EventSink eventSink,
                             Metrics metrics, Duration shutdownGrace, ExponentialBackoff reconnectBackoff) {
        this.sourceConfigs = List.copyOf(sourceConfigs);
        this.sourceFactory = sourceFactory;
        this.ingestion = ingestion;
        this.workers = workers;
        this.eventSink = eventSink;
        this.metrics = metrics;
        this.shutdownGrace = shutdownGrace;
        this.reconnectBackoff = reconnectBackoff;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    /**
     * @throws com.ads.signaldetection.config.ConfigurationException if a source cannot be built
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        List<SourceRunner> created = new ArrayList<>();
        for (SourceProperties config : sourceConfigs) {
            if (!config.enabled()) {
                log.info("Source {} disabled, skipping", config.id());
                continue;
            }
            SourceAdapter adapter = sourceFactory.create(config);
            created.add(new SourceRunner(adapter, ingestion, reconnectBackoff));
        }

        ingestion.onFatal(this::onIngestionExhausted);
        ingestion.resumeRecovery();
        workers.start();

        runners.clear();
        runners.addAll(created);
        AtomicInteger threadIndex = new AtomicInteger();
        sourceExecutor = Executors.newFixedThreadPool(Math.max(1, runners.size()), runnable -> {
            Thread thread = new Thread(runnable, "source-runner-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        runners.forEach(sourceExecutor::execute);
        running = true;
        log.info("Detection pipeline started with {} sources", runners.size());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping detection pipeline");

        ingestion.pauseRecovery();
        runners.forEach(SourceRunner::stop);
        sourceExecutor.shutdown();
        awaitSources();

        List<SourceRunner> stopped = new ArrayList<>();
        for (SourceRunner runner : runners) {
            if (runner.state() == SourceState.STOPPED) {
                runner.resubmitPending();
                stopped.add(runner);
            } else {
                log.warn("Source {} did not stop within {}, tearing it down", runner.sourceId(), shutdownGrace);
                close(runner);
            }
        }

        long abandoned = workers.drainAndStop(shutdownGrace);
        if (abandoned > 0) {
            metrics.onSampleDropped(abandoned);
        }
        stopped.forEach(this::close);

        ingestion.flushStaged();
        eventSink.flush();
        log.info("Detection pipeline stopped (queue depth={}, overflow depth={})",
                ingestion.depth(), ingestion.overflowDepth());
    }

    private void close(SourceRunner runner) {
        int discarded = runner.close();
        if (discarded > 0) {
            metrics.onSampleDropped(runner.sourceId(), discarded);
        }
    }

    private void awaitSources() {
        try {
            if (!sourceExecutor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                sourceExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sourceExecutor.shutdownNow();
        }
    }

    private void onIngestionExhausted(IngestionExhaustedException e) {
        fatalError = e;
        Thread shutdown = new Thread(this::stop, "pipeline-fatal-shutdown");
        shutdown.setDaemon(true);
        shutdown.start();
    }

    /**
     * Source id to runner state, in configuration order.
     */
    public Map<String, SourceState> sourceStates() {
        Map<String, SourceState> states = new LinkedHashMap<>();
        runners.forEach(runner -> states.put(runner.sourceId(), runner.state()));
        return states;
    }

    public boolean isRunning() {
        return running;
    }

    public IngestionExhaustedException fatalError() {
        return fatalError;
    }
}
