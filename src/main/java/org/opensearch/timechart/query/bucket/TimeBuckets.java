/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.bucket;

/**
 * Builds timechart bucket boundaries and maps timestamps to their bucket.
 *
 * <p>Buckets are aligned to the query start time. The last bucket may be a partial interval that
 * extends past the query end when the range is not a multiple of the interval.</p>
 */
public final class TimeBuckets {

    /**
     * Largest number of buckets a single range may produce.
     */
    public static final int MAX_BUCKETS = Integer.MAX_VALUE - 8;

    private TimeBuckets() {
        // Prevent instantiation
    }

    /**
     * Generate bucket start timestamps {@code start, start + interval, ...}.
     * A bucket is appended while its start is before {@code end}; generation stops once the next
     * boundary would be past {@code end}.
     *
     * <p>The whole {@code long} range is supported. At most {@link #MAX_BUCKETS} buckets are generated.</p>
     *
     * @param start range start (inclusive)
     * @param end range end
     * @param intervalMillis bucket width, must be positive
     * @return ordered bucket starts, empty when {@code start >= end}
     * @throws IllegalArgumentException if the interval is not positive or the range needs more than
     *         {@link #MAX_BUCKETS} buckets
     */
    public static long[] generate(long start, long end, long intervalMillis) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("Interval must be positive, got: " + intervalMillis);
        }
        if (start >= end) {
            return new long[0];
        }

        // end > start, so the difference read as unsigned is exact even when it overflows a long
        long bucketCount = Long.divideUnsigned(end - start - 1, intervalMillis) + 1;
        if (bucketCount <= 0 || bucketCount > MAX_BUCKETS) {
            throw new IllegalArgumentException(
                "Range [" + start + ", " + end + ") with interval [" + intervalMillis + "] needs more than " + MAX_BUCKETS + " buckets"
            );
        }

        long[] buckets = new long[(int) bucketCount];
        long current = start;
        buckets[0] = current;
        for (int i = 1; i < buckets.length; i++) {
            current += intervalMillis;
            buckets[i] = current;
        }
        return buckets;
    }

    /**
     * Map a timestamp to the start of its enclosing bucket.
     *
     * @param buckets bucket starts produced by {@link #generate}
     * @param timestamp the timestamp to map
     * @param intervalMillis bucket width used to generate {@code buckets}
     * @return the bucket start {@code b} with {@code b <= timestamp < b + intervalMillis}
     * @throws IllegalArgumentException if the timestamp is outside the buckets
     */
    public static long locate(long[] buckets, long timestamp, long intervalMillis) {
        if (buckets.length == 0) {
            throw new IllegalArgumentException("Cannot locate timestamp [" + timestamp + "] in empty buckets");
        }
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("Interval must be positive, got: " + intervalMillis);
        }
        if (timestamp < buckets[0]) {
            throw new IllegalArgumentException("Timestamp [" + timestamp + "] is before the first bucket [" + buckets[0] + "]");
        }
        long index = Long.divideUnsigned(timestamp - buckets[0], intervalMillis);
        if (Long.compareUnsigned(index, buckets.length) >= 0) {
            throw new IllegalArgumentException(
                "Timestamp [" + timestamp + "] is after the last bucket [" + buckets[buckets.length - 1] + "]"
            );
        }
        return buckets[(int) index];
    }

    /**
     * Whether {@link #locate} would find a bucket for the timestamp.
     *
     * @param buckets bucket starts
     * @param timestamp the timestamp to check
     * @param intervalMillis bucket width
     * @return true if the timestamp falls in one of the buckets
     */
    public static boolean contains(long[] buckets, long timestamp, long intervalMillis) {
        if (buckets.length == 0 || intervalMillis <= 0 || timestamp < buckets[0]) {
            return false;
        }
        return Long.compareUnsigned(Long.divideUnsigned(timestamp - buckets[0], intervalMillis), buckets.length) < 0;
    }
}
