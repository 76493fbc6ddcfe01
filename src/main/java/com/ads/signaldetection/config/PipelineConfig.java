package com.ads.signaldetection.config;

import com.ads.signaldetection.config.SignalDetectionProperties.DetectorProperties;
import com.ads.signaldetection.detector.Detector;
import com.ads.signaldetection.detector.DetectorFactory;
import com.ads.signaldetection.detector.DetectorOptions;
import com.ads.signaldetection.detector.DetectorRegistry;
import com.ads.signaldetection.output.DirectMemoryInterface;
import com.ads.signaldetection.output.KafkaChannelMemoryInterface;
import com.ads.signaldetection.output.LoggingMemoryIngestionService;
import com.ads.signaldetection.output.MemoryIngestionService;
import com.ads.signaldetection.output.MemoryInterface;
import com.ads.signaldetection.state.WindowStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Locale;

/**
 * Wires the startup-built detector registry and the memory interface selected by
 * {@code signal.memory.mode}.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(SignalDetectionProperties.class)
public class PipelineConfig {

    /**
     * @throws ConfigurationException on a duplicate id, an unknown type or invalid options
     */
    @Bean
    public DetectorRegistry detectorRegistry(SignalDetectionProperties properties, DetectorFactory factory,
                                             WindowStore windowStore) {
        DetectorRegistry registry = new DetectorRegistry(properties.detectorFailureLimit());
        for (DetectorProperties config : properties.detectors()) {
            DetectorOptions options = config.toOptions(
                    windowStore.windowSize(), windowStore.emaAlpha(), windowStore.minSamples());
            Detector detector = factory.create(config.type(), config.id(), options);
            registry.register(detector, options.subscriptions());
        }
        if (registry.size() == 0) {
            log.warn("No detectors configured, samples will only update windows");
        }
        return registry;
    }

    @Bean
    public MemoryInterface memoryInterface(
            @Value("${signal.memory.mode:direct}") String mode,
            @Value("${signal.memory.channel:anomaly_events}") String channel,
            ObjectProvider<MemoryIngestionService> ingestionService,
            ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate,
            ObjectMapper objectMapper
    ) {
        switch (mode.trim().toLowerCase(Locale.ROOT)) {
            case "direct" -> {
                MemoryIngestionService service = ingestionService.getIfAvailable(() -> {
                    log.warn("No memory ingestion service available, anomalies will only be logged");
                    return new LoggingMemoryIngestionService();
                });
                log.info("Memory interface: direct ({})", service.getClass().getSimpleName());
                return new DirectMemoryInterface(service);
            }
            case "channel" -> {
                KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
                if (template == null) {
                    throw new ConfigurationException("signal.memory.mode=channel needs a KafkaTemplate");
                }
                log.info("Memory interface: channel {}", channel);
                return new KafkaChannelMemoryInterface(template, objectMapper, channel);
            }
            default -> throw new ConfigurationException(
                    "Unknown signal.memory.mode '" + mode + "', expected direct or channel");
        }
    }
}
