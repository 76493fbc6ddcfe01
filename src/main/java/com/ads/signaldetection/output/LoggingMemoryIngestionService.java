package com.ads.signaldetection.output;

import com.ads.signaldetection.model.AnomalyEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stand-in used when no memory system runs in the same process: logs every event and
 * acknowledges it.
 */
@Slf4j
public class LoggingMemoryIngestionService implements MemoryIngestionService {

    private final AtomicLong ingested = new AtomicLong();

    @Override
    public boolean ingestAnomalies(List<AnomalyEvent> events) {
        for (AnomalyEvent event : events) {
            log.info("Anomaly {} from {} on {} severity={} confidence={}",
                    event.getEventId(), event.getSourceId(), event.getAffectedMetrics(),
                    event.getSeverity(), String.format("%.2f", event.getConfidence()));
        }
        ingested.addAndGet(events.size());
        return true;
    }

    public long ingestedCount() {
        return ingested.get();
    }
}
