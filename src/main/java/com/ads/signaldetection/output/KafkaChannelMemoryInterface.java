package com.ads.signaldetection.output;

import com.ads.signaldetection.model.AnomalyEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Publishes each event of a batch to a channel topic, keyed by event id, and acknowledges the
 * batch once the broker has acknowledged every record.
 */
@Slf4j
public class KafkaChannelMemoryInterface implements MemoryInterface {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;

    public KafkaChannelMemoryInterface(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                                       String channel) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.channel = channel;
    }

    @Override
    public IngestStatus ingest(List<AnomalyEvent> batch) {
        List<CompletableFuture<?>> sends = new ArrayList<>(batch.size());
        try {
            for (AnomalyEvent event : batch) {
                String payload = objectMapper.writeValueAsString(AdsAnomalyMessage.from(event));
                sends.add(kafkaTemplate.send(channel, event.getEventId(), payload));
            }
            CompletableFuture.allOf(sends.toArray(new CompletableFuture[0])).get();
            log.debug("Published {} events to channel {}", batch.size(), channel);
            return IngestStatus.SUCCESS;
        } catch (JsonProcessingException e) {
            throw new DeliveryFailureException("Failed to serialize batch for channel " + channel, e);
        } catch (ExecutionException e) {
            log.warn("Channel {} rejected batch of {}: {}", channel, batch.size(), e.getCause().getMessage());
            return IngestStatus.FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryFailureException("Interrupted while publishing to channel " + channel, e);
        }
    }

    public String channel() {
        return channel;
    }
}
