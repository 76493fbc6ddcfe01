package com.ads.signaldetection.source;

import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.retry.ExponentialBackoff;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Host metrics of the running JVM: {@code cpu_usage} and {@code memory_usage} in percent and
 * {@code system_load_average}. Readings the platform cannot provide are skipped.
 */
@Slf4j
public class SystemMetricsSource extends PollingSourceAdapter {

    public static final String TYPE = "system";

    public static final String CPU_USAGE = "cpu_usage";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String LOAD_AVERAGE = "system_load_average";

    private OperatingSystemMXBean os;

    public SystemMetricsSource(String sourceId, Duration pollInterval, int connectAttempts,
                               ExponentialBackoff backoff, Clock clock) {
        super(sourceId, pollInterval, connectAttempts, backoff, clock);
    }

    @Override
    protected void doConnect() {
        os = ManagementFactory.getOperatingSystemMXBean();
    }

    @Override
    protected List<MetricSample> poll() {
        Instant now = clock.instant();
        List<MetricSample> samples = new ArrayList<>(3);

        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            double cpu = extended.getCpuLoad();
            if (cpu >= 0) {
                samples.add(sample(CPU_USAGE, cpu * 100.0, now));
            }
        }

        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        samples.add(sample(MEMORY_USAGE, used * 100.0 / runtime.maxMemory(), now));

        double load = os.getSystemLoadAverage();
        if (load >= 0) {
            samples.add(sample(LOAD_AVERAGE, load, now));
        }
        log.debug("Source {} polled {} system metrics", sourceId(), samples.size());
        return samples;
    }

    private MetricSample sample(String metric, double value, Instant timestamp) {
        return MetricSample.builder()
                .sourceId(sourceId())
                .metricName(metric)
                .value(value)
                .timestamp(timestamp)
                .build();
    }

    @Override
    protected void doDisconnect() throws Exception {
        super.doDisconnect();
        os = null;
    }
}
