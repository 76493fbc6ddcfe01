package com.ads.signaldetection.state;

import java.time.Instant;
import java.util.Arrays;

/**
 * Bounded rolling history of one metric stream.
 * <p>
 * Ring buffer of the last {@code capacity} values with incrementally maintained moments
 * (Welford update on admit, the reverse update on evict), an exponential moving average, and
 * robust statistics recomputed from the full buffer on demand.
 * <p>
 * Not thread-safe: the owning {@link WindowStore} serializes access per key.
 */
final class WindowState {

    private final double[] buffer;
    private final double emaAlpha;

    private int start;
    private int size;

    private double mean;
    private double m2;
    private double ema;
    private boolean emaSeeded;

    private int evictionsSinceResync;
    private Instant lastUpdatedAt;

    WindowState(int capacity, double emaAlpha) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.buffer = new double[capacity];
        this.emaAlpha = emaAlpha;
    }

    /**
     * Admit a value, evicting the oldest one first when the window is full.
     */
    void admit(double value, Instant now) {
        if (size == buffer.length) {
            double evicted = buffer[start];
            start = (start + 1) % buffer.length;
            size--;
            removeMoment(evicted);
            evictionsSinceResync++;
        }

        buffer[(start + size) % buffer.length] = value;
        size++;
        addMoment(value);

        if (emaSeeded) {
            ema = emaAlpha * value + (1 - emaAlpha) * ema;
        } else {
            ema = value;
            emaSeeded = true;
        }

        // reverse Welford accumulates rounding error; re-derive once per full turn of the ring
        if (evictionsSinceResync >= buffer.length) {
            resync();
        }
        lastUpdatedAt = now;
    }

    WindowStatistics statistics() {
        if (size == 0) {
            return WindowStatistics.EMPTY;
        }
        double variance = Math.max(0.0, m2 / size);

        double[] sorted = values();
        Arrays.sort(sorted);
        double median = percentile(sorted, 0.5);
        double q1 = percentile(sorted, 0.25);
        double q3 = percentile(sorted, 0.75);

        double[] deviations = new double[size];
        for (int i = 0; i < size; i++) {
            deviations[i] = Math.abs(sorted[i] - median);
        }
        Arrays.sort(deviations);
        double mad = percentile(deviations, 0.5);

        return new WindowStatistics(size, mean, variance, Math.sqrt(variance), ema, median, q1, q3, mad);
    }

    /**
     * Values in arrival order, oldest first.
     */
    double[] values() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = buffer[(start + i) % buffer.length];
        }
        return out;
    }

    int size() {
        return size;
    }

    int capacity() {
        return buffer.length;
    }

    Instant lastUpdatedAt() {
        return lastUpdatedAt;
    }

    private void addMoment(double value) {
        double delta = value - mean;
        mean += delta / size;
        m2 += delta * (value - mean);
    }

    private void removeMoment(double value) {
        // size has already been decremented
        if (size == 0) {
            mean = 0.0;
            m2 = 0.0;
            return;
        }
        double previousMean = mean;
        mean = (previousMean * (size + 1) - value) / size;
        m2 -= (value - previousMean) * (value - mean);
        if (m2 < 0.0) {
            m2 = 0.0;
        }
    }

    private void resync() {
        double newMean = 0.0;
        double newM2 = 0.0;
        int n = 0;
        for (double value : values()) {
            n++;
            double delta = value - newMean;
            newMean += delta / n;
            newM2 += delta * (value - newMean);
        }
        mean = newMean;
        m2 = newM2;
        evictionsSinceResync = 0;
    }

    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0.0;
        }
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
