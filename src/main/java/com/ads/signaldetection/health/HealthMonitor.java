package com.ads.signaldetection.health;

import com.ads.signaldetection.detector.DetectorRegistry;
import com.ads.signaldetection.engine.DetectionPipeline;
import com.ads.signaldetection.ingestion.IngestionStage;
import com.ads.signaldetection.metrics.Metrics;
import com.ads.signaldetection.output.DeadLetterStore;
import com.ads.signaldetection.source.SourceState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Aggregates component state into a {@link HealthStatus} and exports queue depth, overflow
 * depth and uptime as Micrometer gauges. Per-detector and per-source counters come from
 * {@link Metrics}.
 * <p>
 * The pipeline is DEGRADED when a source is not running, a detector is inactive, samples are
 * waiting in overflow, the ingestion queue is full or ingestion is exhausted.
 */
@Slf4j
@Component
public class HealthMonitor {

    private final DetectorRegistry registry;
    private final IngestionStage ingestion;
    private final DeadLetterStore deadLetters;
    private final Metrics metrics;
    private final Supplier<Map<String, SourceState>> sources;
    private final BooleanSupplier pipelineFailed;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Instant startedAt;

    @Autowired
    public HealthMonitor(DetectorRegistry registry, IngestionStage ingestion, DeadLetterStore deadLetters,
                         Metrics metrics, DetectionPipeline pipeline, MeterRegistry meterRegistry) {
        this(registry, ingestion, deadLetters, metrics, pipeline::sourceStates, () -> pipeline.fatalError() != null,
                meterRegistry, Clock.systemUTC());
    }

    public HealthMonitor(DetectorRegistry registry, IngestionStage ingestion, DeadLetterStore deadLetters,
                         Metrics metrics, Supplier<Map<String, SourceState>> sources, BooleanSupplier pipelineFailed,
                         MeterRegistry meterRegistry, Clock clock) {
        this.registry = registry;
        this.ingestion = ingestion;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.sources = sources;
        this.pipelineFailed = pipelineFailed;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("signal.queue.depth", ingestion, IngestionStage::depth)
                .description("Samples waiting in the ingestion queue")
                .register(meterRegistry);

        Gauge.builder("signal.overflow.depth", ingestion, IngestionStage::overflowDepth)
                .description("Samples waiting in the overflow store")
                .register(meterRegistry);

        Gauge.builder("signal.uptime.seconds", this, monitor -> monitor.uptime().toSeconds())
                .description("Pipeline uptime in seconds")
                .register(meterRegistry);

        log.info("Health gauges registered");
    }

    public HealthStatus health() {
        Map<String, Boolean> detectors = registry.status();
        Map<String, SourceState> sourceStates = sources.get();
        int queueDepth = ingestion.depth();
        long overflowDepth = ingestion.overflowDepth();

        List<String> reasons = new ArrayList<>();
        sourceStates.forEach((id, state) -> {
            if (state != SourceState.RUNNING) {
                reasons.add("source " + id + " is " + state.wireName());
            }
        });
        detectors.forEach((id, active) -> {
            if (!active) {
                reasons.add("detector " + id + " is inactive");
            }
        });
        if (overflowDepth > 0) {
            reasons.add(overflowDepth + " samples in overflow");
        }
        if (ingestion.remainingCapacity() == 0) {
            reasons.add("ingestion queue is full");
        }
        if (ingestion.isExhausted() || pipelineFailed.getAsBoolean()) {
            reasons.add("ingestion exhausted");
        }

        return new HealthStatus(
                reasons.isEmpty() ? HealthState.HEALTHY : HealthState.DEGRADED,
                detectors,
                sourceStates,
                metrics.detectorMetrics(),
                metrics.streamMetrics(),
                queueDepth,
                ingestion.capacity(),
                overflowDepth,
                deadLetters.count(),
                uptime().toSeconds(),
                List.copyOf(reasons)
        );
    }

    @Scheduled(fixedRateString = "${signal.health.report-interval-ms:30000}")
    public void reportHealth() {
        HealthStatus status = health();
        if (status.isHealthy()) {
            log.debug("Pipeline healthy (queue={}/{}, detectors={}, sources={})",
                    status.queueDepth(), status.queueCapacity(), status.detectors().size(), status.sources().size());
        } else {
            log.warn("Pipeline degraded: {} (queue={}/{}, overflow={}, deadLetters={})",
                    status.reasons(), status.queueDepth(), status.queueCapacity(),
                    status.overflowDepth(), status.deadLetters());
        }
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }
}
