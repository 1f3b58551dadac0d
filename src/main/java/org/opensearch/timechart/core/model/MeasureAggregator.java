/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.core.model;

import java.util.Objects;

/**
 * One measure of a timechart: an aggregate function applied to a column.
 *
 * @param measureColumn the aggregated column
 * @param function the aggregate function
 * @param stringEncoded whether the column values are string encoded
 */
public record MeasureAggregator(String measureColumn, AggregateFunction function, boolean stringEncoded) {

    public MeasureAggregator {
        Objects.requireNonNull(measureColumn, "measureColumn cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
    }

    public MeasureAggregator(String measureColumn, AggregateFunction function) {
        this(measureColumn, function, false);
    }

    /**
     * Same column and encoding with another function.
     *
     * @param newFunction the function of the copy
     * @return the rewritten aggregator
     */
    public MeasureAggregator withFunction(AggregateFunction newFunction) {
        return new MeasureAggregator(measureColumn, newFunction, stringEncoded);
    }
}
