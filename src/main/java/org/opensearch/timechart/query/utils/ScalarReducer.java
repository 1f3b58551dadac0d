/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.utils;

import org.opensearch.timechart.core.model.AggregateFunction;
import org.opensearch.timechart.core.model.AggregateValue;

/**
 * Reduces two partial aggregate values of the same column into one.
 */
@FunctionalInterface
public interface ScalarReducer {

    /**
     * Combine two values under an aggregate function.
     *
     * @param first first value
     * @param second second value
     * @param function the aggregate function
     * @return the combined value
     * @throws IllegalArgumentException if the values cannot be combined under the function
     */
    AggregateValue reduce(AggregateValue first, AggregateValue second, AggregateFunction function);
}
