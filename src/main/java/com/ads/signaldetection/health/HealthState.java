package com.ads.signaldetection.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthState {
    HEALTHY,
    DEGRADED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
