package com.ads.signaldetection.model;

import java.time.Instant;
import java.util.List;

/**
 * A batch of anomaly events that could not be delivered after all retry attempts.
 */
public record DeadLetter(
        long id,
        Instant failedAt,
        int attempts,
        String reason,
        List<AnomalyEvent> events
) {}
