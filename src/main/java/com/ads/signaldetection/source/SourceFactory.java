package com.ads.signaldetection.source;

import com.ads.signaldetection.config.ConfigurationException;
import com.ads.signaldetection.config.SignalDetectionProperties.SourceProperties;
import com.ads.signaldetection.metrics.Metrics;
import com.ads.signaldetection.retry.ExponentialBackoff;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps a source type name to an adapter constructor. Built once at startup.
 */
@Slf4j
@Component
public class SourceFactory {

    private final Map<String, Function<SourceProperties, SourceAdapter>> constructors = new HashMap<>();

    @Autowired
    public SourceFactory(
            ObjectProvider<ConsumerFactory<String, String>> consumerFactory,
            ObjectMapper objectMapper,
            Metrics metrics,
            @Value("${signal.sources.handoff-capacity:1000}") int handoffCapacity,
            @Value("${signal.sources.handoff-timeout-ms:1000}") long handoffTimeoutMs,
            @Value("${kafka.consumer.group-id:signal-detection}") String defaultGroupId
    ) {
        SamplePayloadParser parser = new SamplePayloadParser(objectMapper);
        register(SystemMetricsSource.TYPE, props -> new SystemMetricsSource(
                props.id(), props.pollInterval(), props.connectAttempts(), backoff(props), Clock.systemUTC()));
        register(KafkaMetricSource.TYPE, props -> {
            ConsumerFactory<String, String> factory = consumerFactory.getIfAvailable();
            if (factory == null) {
                throw new ConfigurationException("Source " + props.id() + " needs a Kafka consumer factory");
            }
            String topic = props.connection("topic", null);
            if (topic == null || topic.isBlank()) {
                throw new ConfigurationException("Source " + props.id() + " needs connection.topic");
            }
            return new KafkaMetricSource(props.id(), topic, props.connection("group-id", defaultGroupId),
                    factory, parser, metrics, handoffCapacity, Duration.ofMillis(handoffTimeoutMs),
                    props.connectAttempts(), backoff(props), Clock.systemUTC());
        });
    }

    /**
     * A factory with no types registered.
     */
    public SourceFactory() {
    }

    /**
     * Register a constructor for a source type. Startup only.
     *
     * @throws ConfigurationException if the type is already registered
     */
    public void register(String type, Function<SourceProperties, SourceAdapter> constructor) {
        if (constructors.putIfAbsent(normalize(type), constructor) != null) {
            throw new ConfigurationException("Duplicate source type registered: " + type);
        }
    }

    /**
     * @throws ConfigurationException for an unknown type or invalid connection settings
     */
    public SourceAdapter create(SourceProperties props) {
        Function<SourceProperties, SourceAdapter> constructor = constructors.get(normalize(props.type()));
        if (constructor == null) {
            throw new ConfigurationException(
                    "Unknown source type '" + props.type() + "' for source " + props.id() + ", known types: " + types());
        }
        SourceAdapter adapter = constructor.apply(props);
        log.info("Created source {} (type={})", props.id(), props.type());
        return adapter;
    }

    public Set<String> types() {
        return Set.copyOf(constructors.keySet());
    }

    static ExponentialBackoff backoff(SourceProperties props) {
        return new ExponentialBackoff(props.backoffBase(), props.backoffMax());
    }

    private static String normalize(String type) {
        if (type == null || type.isBlank()) {
            throw new ConfigurationException("Source type is required");
        }
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
