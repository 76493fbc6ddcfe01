package com.ads.signaldetection.output;

/**
 * Acknowledgement of a {@link MemoryInterface#ingest} call.
 */
public enum IngestStatus {
    SUCCESS,
    FAILURE
}
