/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.core.sketch;

import org.opensearch.common.lease.Releasable;

/**
 * Probabilistic distinct-value counter. Sketches cannot be merged by adding their estimates; they
 * merge by union.
 */
public interface CardinalitySketch extends Releasable {

    /**
     * Record a value.
     *
     * @param value the value to count
     */
    void offer(String value);

    /**
     * Union another sketch into this one. The other sketch is left unchanged.
     *
     * @param other the sketch to merge
     * @throws IllegalArgumentException if the sketches are not compatible
     */
    void merge(CardinalitySketch other);

    /**
     * Estimated number of distinct values offered to this sketch or to sketches merged into it.
     *
     * @return the estimate
     */
    long estimate();
}
