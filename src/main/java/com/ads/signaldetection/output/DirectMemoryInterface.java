package com.ads.signaldetection.output;

import com.ads.signaldetection.model.AnomalyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Delivers batches by calling the memory system's ingestion service in-process.
 */
@Slf4j
@RequiredArgsConstructor
public class DirectMemoryInterface implements MemoryInterface {

    private final MemoryIngestionService service;

    @Override
    public IngestStatus ingest(List<AnomalyEvent> batch) {
        boolean stored = service.ingestAnomalies(batch);
        log.debug("Direct ingest of {} events: {}", batch.size(), stored ? "stored" : "rejected");
        return stored ? IngestStatus.SUCCESS : IngestStatus.FAILURE;
    }
}
