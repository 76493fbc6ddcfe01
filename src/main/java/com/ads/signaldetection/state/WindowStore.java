package com.ads.signaldetection.state;

import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.model.WindowKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the rolling window of every (source, metric) stream.
 * <p>
 * {@link #update(MetricSample)} is the only mutator. Updates of the same key are serialized
 * through {@link ConcurrentMap#compute}, independent keys update in parallel.
 * Idle windows are evicted so the key space stays bounded.
 */
@Slf4j
@Component
public class WindowStore {

    private final int windowSize;
    private final double emaAlpha;
    private final int minSamples;
    private final Duration idleTtl;
    private final Clock clock;

    private final ConcurrentMap<WindowKey, WindowState> windows = new ConcurrentHashMap<>();

    @Autowired
    public WindowStore(
            @Value("${signal.window.size:100}") int windowSize,
            @Value("${signal.window.ema-alpha:0.1}") double emaAlpha,
            @Value("${signal.window.min-samples:10}") int minSamples,
            @Value("${signal.window.idle-ttl-minutes:60}") int idleTtlMinutes
    ) {
        this(windowSize, emaAlpha, minSamples, Duration.ofMinutes(idleTtlMinutes), Clock.systemUTC());
    }

    public WindowStore(int windowSize, double emaAlpha, int minSamples, Duration idleTtl, Clock clock) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("window size must be > 0, got " + windowSize);
        }
        if (emaAlpha <= 0.0 || emaAlpha > 1.0) {
            throw new IllegalArgumentException("ema alpha must be in (0, 1], got " + emaAlpha);
        }
        if (minSamples < 1 || minSamples > windowSize) {
            throw new IllegalArgumentException(
                    "min samples must be in [1, " + windowSize + "], got " + minSamples);
        }
        this.windowSize = windowSize;
        this.emaAlpha = emaAlpha;
        this.minSamples = minSamples;
        this.idleTtl = idleTtl;
        this.clock = clock;
        log.info("Initialized WindowStore (windowSize={}, emaAlpha={}, minSamples={}, idleTtl={})",
                windowSize, emaAlpha, minSamples, idleTtl);
    }

    /**
     * Admit a sample into its window and return the statistics before and after admission.
     *
     * @param sample accepted sample
     * @return snapshot reflecting the window after the value was admitted
     */
    public WindowSnapshot update(MetricSample sample) {
        WindowKey key = sample.key();
        WindowSnapshot[] result = new WindowSnapshot[1];
        Instant now = clock.instant();

        windows.compute(key, (k, state) -> {
            if (state == null) {
                state = new WindowState(windowSize, emaAlpha);
            }
            WindowStatistics baseline = state.statistics();
            state.admit(sample.getValue(), now);
            WindowStatistics current = state.statistics();
            result[0] = new WindowSnapshot(
                    k,
                    sample.getValue(),
                    current,
                    baseline,
                    windowSize,
                    current.count() >= minSamples
            );
            return state;
        });

        log.debug("Updated window {} (length={})", key, result[0].length());
        return result[0];
    }

    /**
     * Current statistics of a window, if it exists.
     */
    public Optional<WindowStatistics> statistics(WindowKey key) {
        WindowStatistics[] result = new WindowStatistics[1];
        windows.computeIfPresent(key, (k, state) -> {
            result[0] = state.statistics();
            return state;
        });
        return Optional.ofNullable(result[0]);
    }

    /**
     * Current window length of a key, 0 if the key is unknown.
     */
    public int length(WindowKey key) {
        int[] result = new int[1];
        windows.computeIfPresent(key, (k, state) -> {
            result[0] = state.size();
            return state;
        });
        return result[0];
    }

    /**
     * Remove windows that have not been updated within the idle TTL.
     *
     * @return number of windows evicted
     */
    @Scheduled(fixedRateString = "${signal.window.eviction-interval-ms:60000}")
    public int evictIdleWindows() {
        Instant cutoff = clock.instant().minus(idleTtl);
        int before = windows.size();
        windows.entrySet().removeIf(entry -> {
            Instant lastUpdated = entry.getValue().lastUpdatedAt();
            return lastUpdated != null && lastUpdated.isBefore(cutoff);
        });
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle windows", evicted);
        }
        return evicted;
    }

    public int size() {
        return windows.size();
    }

    public int windowSize() {
        return windowSize;
    }

    public double emaAlpha() {
        return emaAlpha;
    }

    public int minSamples() {
        return minSamples;
    }
}
