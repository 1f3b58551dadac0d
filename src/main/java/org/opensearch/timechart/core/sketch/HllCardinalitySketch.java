/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.core.sketch;

import org.opensearch.common.hash.MurmurHash3;
import org.opensearch.common.util.BigArrays;
import org.opensearch.search.aggregations.metrics.HyperLogLogPlusPlus;

import java.nio.charset.StandardCharsets;

/**
 * {@link CardinalitySketch} backed by a single-bucket HyperLogLog++ sketch.
 *
 * <p>Values are hashed with MurmurHash3 the same way the cardinality aggregation hashes terms, so
 * sketches built here are comparable with each other as long as they share a precision.</p>
 */
public class HllCardinalitySketch implements CardinalitySketch {

    private static final long BUCKET = 0L;

    private final int precision;
    private final HyperLogLogPlusPlus sketch;
    private final MurmurHash3.Hash128 hash = new MurmurHash3.Hash128();

    /**
     * Create an empty sketch.
     *
     * @param precision HyperLogLog++ precision, between 4 and 18
     */
    public HllCardinalitySketch(int precision) {
        this(precision, BigArrays.NON_RECYCLING_INSTANCE);
    }

    /**
     * Create an empty sketch allocating from the given arrays.
     *
     * @param precision HyperLogLog++ precision, between 4 and 18
     * @param bigArrays arrays to allocate registers from
     */
    public HllCardinalitySketch(int precision, BigArrays bigArrays) {
        this.precision = precision;
        this.sketch = new HyperLogLogPlusPlus(precision, bigArrays, 1);
    }

    @Override
    public void offer(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        sketch.collect(BUCKET, MurmurHash3.hash128(bytes, 0, bytes.length, 0, hash).h1);
    }

    @Override
    public void merge(CardinalitySketch other) {
        if (other instanceof HllCardinalitySketch otherHll) {
            if (otherHll.precision != precision) {
                throw new IllegalArgumentException(
                    "Cannot merge sketches with different precisions [" + precision + "] and [" + otherHll.precision + "]"
                );
            }
            sketch.merge(BUCKET, otherHll.sketch, BUCKET);
            return;
        }
        throw new IllegalArgumentException("Cannot merge HllCardinalitySketch with " + other.getClass().getSimpleName());
    }

    @Override
    public long estimate() {
        return sketch.cardinality(BUCKET);
    }

    public int getPrecision() {
        return precision;
    }

    @Override
    public void close() {
        sketch.close();
    }
}
