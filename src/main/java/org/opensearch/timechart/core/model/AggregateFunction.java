/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.core.model;

/**
 * Aggregate functions a timechart measure can apply.
 */
public enum AggregateFunction {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX,
    RANGE,
    CARDINALITY,
    VALUES;

    /**
     * How partial results of this function combine once they reach the timechart merge step.
     * Sum-like functions have already been reduced to mergeable primitives, so their partials add.
     */
    public enum MergeKind {
        SUM_LIKE,
        CARDINALITY,
        STRING_VALUED
    }

    public MergeKind mergeKind() {
        return switch (this) {
            case COUNT, SUM, AVG, MIN, MAX, RANGE -> MergeKind.SUM_LIKE;
            case CARDINALITY -> MergeKind.CARDINALITY;
            case VALUES -> MergeKind.STRING_VALUED;
        };
    }

    public static AggregateFunction fromString(String function) {
        return switch (function) {
            case "count", "c" -> COUNT;
            case "sum" -> SUM;
            case "avg", "mean" -> AVG;
            case "min" -> MIN;
            case "max" -> MAX;
            case "range" -> RANGE;
            case "dc", "distinct_count", "cardinality" -> CARDINALITY;
            case "values" -> VALUES;
            default -> throw new IllegalArgumentException("Invalid aggregate function: " + function);
        };
    }
}
