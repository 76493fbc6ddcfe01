package com.ads.signaldetection.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ExponentialBackoffTest {

    @Test
    public void testDelayDoublesUntilCap() {
        ExponentialBackoff backoff = ExponentialBackoff.ofMillis(100, 1_000);
        assertThat(backoff.delayFor(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.delayFor(3)).isEqualTo(Duration.ofMillis(800));
        assertThat(backoff.delayFor(4)).isEqualTo(Duration.ofMillis(1_000));
        assertThat(backoff.delayFor(500)).isEqualTo(Duration.ofMillis(1_000));
    }

    @Test
    public void testMaxBelowBaseIsRejected() {
        assertThatThrownBy(() -> ExponentialBackoff.ofMillis(500, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
