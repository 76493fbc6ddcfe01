package com.ads.signaldetection.source;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceState {
    CONNECTING,
    RUNNING,
    DEGRADED,
    STOPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
