package com.ads.signaldetection.detector;

import com.ads.signaldetection.config.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metric name to subscribed detectors, in registration order.
 * <p>
 * Populated at startup; lookups are lock-free afterwards. A detector that fails
 * {@code failureLimit} evaluations in a row is deactivated and no longer returned by
 * {@link #detectorsFor(String)}.
 */
@Slf4j
public class DetectorRegistry {

    /** Subscribes a detector to every metric. */
    public static final String ALL_METRICS = "*";

    private final int failureLimit;

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<String, Registration> byId = new ConcurrentHashMap<>();

    public DetectorRegistry(int failureLimit) {
        if (failureLimit <= 0) {
            throw new ConfigurationException("detector failure limit must be > 0, got " + failureLimit);
        }
        this.failureLimit = failureLimit;
    }

    /**
     * @param metrics metric names, or {@link #ALL_METRICS}
     * @throws ConfigurationException if the detector id is already registered or no metric is given
     */
    public synchronized void register(Detector detector, Collection<String> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            throw new ConfigurationException("Detector " + detector.detectorId() + " subscribes to no metrics");
        }
        Registration registration = new Registration(detector, Set.copyOf(new LinkedHashSet<>(metrics)));
        Registration previous = byId.putIfAbsent(detector.detectorId(), registration);
        if (previous != null) {
            throw new ConfigurationException("Duplicate detector registered for id=" + detector.detectorId());
        }
        registrations.add(registration);
        log.info("Registered detector {} (version={}) for metrics {}",
                detector.detectorId(), detector.version(), registration.metrics);
    }

    /**
     * Active detectors subscribed to {@code metricName}, in registration order.
     */
    public List<Detector> detectorsFor(String metricName) {
        List<Detector> result = new ArrayList<>();
        for (Registration registration : registrations) {
            if (registration.active.get() && registration.subscribes(metricName)) {
                result.add(registration.detector);
            }
        }
        return result;
    }

    /**
     * Record a failed evaluation.
     *
     * @return true if this failure deactivated the detector
     */
    public boolean recordFailure(String detectorId) {
        Registration registration = byId.get(detectorId);
        if (registration == null) {
            return false;
        }
        int failures = registration.consecutiveFailures.incrementAndGet();
        if (failures >= failureLimit && registration.active.compareAndSet(true, false)) {
            log.error("Deactivated detector {} after {} consecutive failures", detectorId, failures);
            return true;
        }
        return false;
    }

    public void recordSuccess(String detectorId) {
        Registration registration = byId.get(detectorId);
        if (registration != null) {
            registration.consecutiveFailures.set(0);
        }
    }

    /**
     * Re-enable a deactivated detector.
     */
    public void activate(String detectorId) {
        Registration registration = byId.get(detectorId);
        if (registration != null) {
            registration.consecutiveFailures.set(0);
            if (registration.active.compareAndSet(false, true)) {
                log.info("Re-activated detector {}", detectorId);
            }
        }
    }

    public boolean isActive(String detectorId) {
        Registration registration = byId.get(detectorId);
        return registration != null && registration.active.get();
    }

    /**
     * Detector id to active flag, in registration order.
     */
    public Map<String, Boolean> status() {
        Map<String, Boolean> status = new LinkedHashMap<>();
        for (Registration registration : registrations) {
            status.put(registration.detector.detectorId(), registration.active.get());
        }
        return status;
    }

    public List<Detector> detectors() {
        List<Detector> result = new ArrayList<>();
        registrations.forEach(registration -> result.add(registration.detector));
        return result;
    }

    public int size() {
        return registrations.size();
    }

    private static final class Registration {
        private final Detector detector;
        private final Set<String> metrics;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final AtomicInteger consecutiveFailures = new AtomicInteger();

        private Registration(Detector detector, Set<String> metrics) {
            this.detector = detector;
            this.metrics = metrics;
        }

        private boolean subscribes(String metricName) {
            return metrics.contains(ALL_METRICS) || metrics.contains(metricName);
        }
    }
}
