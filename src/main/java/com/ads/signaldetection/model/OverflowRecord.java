package com.ads.signaldetection.model;

import java.time.Instant;
import java.util.List;

/**
 * A batch of samples of one source that was spilled to disk because the admission queue was full.
 *
 * @param id        monotonically increasing store id, gives FIFO order of spill time
 * @param sourceId  source all samples belong to
 * @param spilledAt when the batch was written
 * @param samples   samples in arrival order
 */
public record OverflowRecord(
        long id,
        String sourceId,
        Instant spilledAt,
        List<MetricSample> samples
) {
    public int size() {
        return samples.size();
    }
}
