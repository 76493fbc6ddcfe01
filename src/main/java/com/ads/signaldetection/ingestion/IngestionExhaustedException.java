package com.ads.signaldetection.ingestion;

/**
 * Both the admission queue and the overflow store are unavailable. Fatal for the pipeline.
 */
public class IngestionExhaustedException extends RuntimeException {

    public IngestionExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
