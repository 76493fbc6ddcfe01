package com.ads.signaldetection.source;

import com.ads.signaldetection.metrics.Metrics;
import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.retry.ExponentialBackoff;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.PartitionInfo;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Subscribes to a Kafka topic of JSON metric payloads.
 * <p>
 * One listener thread preserves record order. Records that cannot be parsed are logged and
 * counted as drops.
 */
@Slf4j
public class KafkaMetricSource extends PushSourceAdapter {

    public static final String TYPE = "kafka";

    private static final Duration METADATA_TIMEOUT = Duration.ofSeconds(5);

    private final ConsumerFactory<String, String> consumerFactory;
    private final SamplePayloadParser parser;
    private final String topic;
    private final String groupId;

    private volatile ConcurrentMessageListenerContainer<String, String> container;

    public KafkaMetricSource(String sourceId, String topic, String groupId,
                             ConsumerFactory<String, String> consumerFactory, SamplePayloadParser parser,
                             Metrics metrics, int handoffCapacity, Duration handoffTimeout,
                             int connectAttempts, ExponentialBackoff backoff, Clock clock) {
        super(sourceId, handoffCapacity, handoffTimeout, metrics, connectAttempts, backoff, clock);
        this.consumerFactory = consumerFactory;
        this.parser = parser;
        this.topic = topic;
        this.groupId = groupId;
    }

    @Override
    protected void doConnect() {
        try (Consumer<String, String> metadataConsumer = consumerFactory.createConsumer(groupId, sourceId())) {
            List<PartitionInfo> partitions = metadataConsumer.partitionsFor(topic, METADATA_TIMEOUT);
            if (partitions == null || partitions.isEmpty()) {
                throw new IllegalStateException("Topic " + topic + " has no partitions");
            }
        }

        ContainerProperties containerProperties = new ContainerProperties(topic);
        containerProperties.setGroupId(groupId);
        containerProperties.setMissingTopicsFatal(false);
        containerProperties.setMessageListener((MessageListener<String, String>) this::onRecord);

        container = new ConcurrentMessageListenerContainer<>(consumerFactory, containerProperties);
        container.setConcurrency(1);
        container.setBeanName("source-" + sourceId());
        container.start();
        log.info("Source {} subscribed to topic {} (group={})", sourceId(), topic, groupId);
    }

    void onRecord(ConsumerRecord<String, String> record) {
        List<MetricSample> samples;
        try {
            samples = parser.parse(record.value(), sourceId());
        } catch (RuntimeException e) {
            metrics.onSampleDropped(sourceId(), 1);
            log.warn("Source {} dropped unparseable record at partition {} offset {}: {}",
                    sourceId(), record.partition(), record.offset(), e.getMessage());
            return;
        }
        for (MetricSample sample : samples) {
            deliver(sample);
        }
    }

    /**
     * Pauses consumption; the container keeps its assignment until {@link #disconnect()}.
     */
    @Override
    public void stop() {
        super.stop();
        ConcurrentMessageListenerContainer<String, String> current = container;
        if (current != null) {
            current.pause();
        }
    }

    @Override
    protected void doDisconnect() {
        if (container != null) {
            container.stop();
            container = null;
        }
    }

    public String topic() {
        return topic;
    }
}
