package com.ads.signaldetection.config;

/**
 * Invalid detector or source options. Raised at startup; the pipeline refuses to start
 * with the offending component.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
