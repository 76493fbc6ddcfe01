package com.ads.signaldetection.ingestion;

/**
 * Outcome of {@link IngestionStage#submit}.
 */
public enum SubmitResult {
    ENQUEUED,
    SPILLED,
    DROPPED
}
