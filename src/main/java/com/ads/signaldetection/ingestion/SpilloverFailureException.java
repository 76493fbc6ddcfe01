package com.ads.signaldetection.ingestion;

/**
 * The overflow store could not accept a spilled batch (disk unavailable or quota exceeded).
 */
public class SpilloverFailureException extends RuntimeException {

    public SpilloverFailureException(String message) {
        super(message);
    }

    public SpilloverFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
