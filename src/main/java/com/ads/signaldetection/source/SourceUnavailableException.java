package com.ads.signaldetection.source;

/**
 * A source adapter could not connect (or reconnect) to its external feed after all attempts.
 *
 * The pipeline keeps running with the remaining sources; the failing source is reported
 * as degraded until it reconnects.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String sourceId;

    public SourceUnavailableException(String sourceId, String message, Throwable cause) {
        super("Source " + sourceId + " unavailable: " + message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
