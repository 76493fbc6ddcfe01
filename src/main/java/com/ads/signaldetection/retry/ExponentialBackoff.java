package com.ads.signaldetection.retry;

import java.time.Duration;

/**
 * Exponential backoff schedule: {@code baseDelay * 2^attempt}, capped at {@code maxDelay}.
 *
 * Attempts are zero based, so the first retry waits {@code baseDelay}.
 */
public record ExponentialBackoff(Duration baseDelay, Duration maxDelay) {

    public ExponentialBackoff {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    public static ExponentialBackoff ofMillis(long baseMillis, long maxMillis) {
        return new ExponentialBackoff(Duration.ofMillis(baseMillis), Duration.ofMillis(maxMillis));
    }

    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return baseDelay;
        }
        // 2^62 already overflows any sane millisecond delay
        int shift = Math.min(attempt, 62);
        long base = baseDelay.toMillis();
        long multiplier = 1L << shift;
        if (base != 0 && multiplier > maxDelay.toMillis() / base) {
            return maxDelay;
        }
        long delay = base * multiplier;
        return delay >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(delay);
    }

    /**
     * Sleep for the delay of the given attempt.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void pause(int attempt) throws InterruptedException {
        long millis = delayFor(attempt).toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
