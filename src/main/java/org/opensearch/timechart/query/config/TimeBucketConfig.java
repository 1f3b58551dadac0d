/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.config;

import org.opensearch.common.Nullable;
import org.opensearch.timechart.query.bucket.TimeBuckets;

/**
 * Fully resolved time bucketing of a timechart query.
 *
 * @param startTime inclusive start of the query range in epoch millis
 * @param endTime end of the query range in epoch millis
 * @param intervalMillis bucket width in milliseconds
 * @param timechart split-by configuration, null for a plain time histogram
 */
public record TimeBucketConfig(long startTime, long endTime, long intervalMillis, @Nullable TimechartConfig timechart) {

    public TimeBucketConfig {
        if (startTime > endTime) {
            throw new IllegalArgumentException("Start time [" + startTime + "] must not be after end time [" + endTime + "]");
        }
    }

    /**
     * Bind this configuration to a query time range.
     *
     * @param newStartTime range start
     * @param newEndTime range end
     * @return a copy with the given range
     */
    public TimeBucketConfig withTimeRange(long newStartTime, long newEndTime) {
        return new TimeBucketConfig(newStartTime, newEndTime, intervalMillis, timechart);
    }

    /**
     * Bucket start timestamps covering this configuration's range.
     *
     * @return ordered bucket starts
     */
    public long[] generateBuckets() {
        return TimeBuckets.generate(startTime, endTime, intervalMillis);
    }

    @Nullable
    public LimitConfig limit() {
        return timechart == null ? null : timechart.limit();
    }
}
