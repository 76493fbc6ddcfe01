package com.ads.signaldetection.state;

/**
 * Rolling statistics of one window at a point in time.
 *
 * Variance is the population variance of the retained values. Quantiles use linear
 * interpolation between closest ranks.
 */
public record WindowStatistics(
        int count,
        double mean,
        double variance,
        double stdDev,
        double ema,
        double median,
        double q1,
        double q3,
        double mad
) {

    public static final WindowStatistics EMPTY =
            new WindowStatistics(0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);

    public double iqr() {
        return q3 - q1;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
