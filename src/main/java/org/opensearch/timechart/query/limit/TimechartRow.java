/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.limit;

import org.opensearch.common.Nullable;
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.core.sketch.CardinalitySketch;

import java.util.List;
import java.util.Objects;

/**
 * Partial values of one split-by series in one time bucket, one value per output column.
 *
 * @param bucket start of the time bucket
 * @param groupValue the split-by value
 * @param values one value per output column
 * @param sketches sketches backing cardinality columns, parallel to {@code values}; null or with null entries when absent
 */
public record TimechartRow(long bucket, String groupValue, List<AggregateValue> values, @Nullable List<CardinalitySketch> sketches) {

    public TimechartRow {
        Objects.requireNonNull(groupValue, "groupValue cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (sketches != null && sketches.size() != values.size()) {
            throw new IllegalArgumentException(
                "Row of group [" + groupValue + "] has " + values.size() + " values but " + sketches.size() + " sketches"
            );
        }
    }

    public TimechartRow(long bucket, String groupValue, List<AggregateValue> values) {
        this(bucket, groupValue, values, null);
    }

    public AggregateValue value(int columnIndex) {
        return values.get(columnIndex);
    }

    @Nullable
    public CardinalitySketch sketch(int columnIndex) {
        return sketches == null ? null : sketches.get(columnIndex);
    }
}
