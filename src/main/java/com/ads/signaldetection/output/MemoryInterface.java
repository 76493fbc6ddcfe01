package com.ads.signaldetection.output;

import com.ads.signaldetection.model.AnomalyEvent;

import java.util.List;

/**
 * Downstream memory system that stores confirmed anomalies.
 * <p>
 * A batch is either acknowledged as a whole or not at all. Callers retry unacknowledged
 * batches, so implementations must tolerate receiving the same events more than once.
 */
public interface MemoryInterface {

    /**
     * @return {@link IngestStatus#SUCCESS} if the whole batch was stored
     */
    IngestStatus ingest(List<AnomalyEvent> batch);
}
