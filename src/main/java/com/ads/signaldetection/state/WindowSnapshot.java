package com.ads.signaldetection.state;

import com.ads.signaldetection.model.WindowKey;

/**
 * Result of admitting one value into a window.
 *
 * @param key               the (source, metric) stream
 * @param value             the value just admitted
 * @param current           statistics after admitting {@code value}
 * @param baseline          statistics of the window as it was before {@code value} arrived;
 *                          detectors score the new value against this distribution
 * @param windowSize        configured capacity of the window
 * @param sufficientHistory false while the window holds fewer than {@code min_samples} values;
 *                          detectors must not alarm on such snapshots
 */
public record WindowSnapshot(
        WindowKey key,
        double value,
        WindowStatistics current,
        WindowStatistics baseline,
        int windowSize,
        boolean sufficientHistory
) {

    public int length() {
        return current.count();
    }
}
