package com.ads.signaldetection.output;

import com.ads.signaldetection.model.AnomalyEvent;

import java.util.List;

/**
 * In-process ingestion API of the memory system, called by {@link DirectMemoryInterface}.
 */
public interface MemoryIngestionService {

    /**
     * @return true if every event was stored
     */
    boolean ingestAnomalies(List<AnomalyEvent> events);
}
