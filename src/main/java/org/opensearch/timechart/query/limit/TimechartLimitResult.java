/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.limit;

import org.opensearch.common.Nullable;
import org.opensearch.common.lease.Releasable;
import org.opensearch.common.lease.Releasables;
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.core.sketch.CardinalitySketch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Mutable top-N state of one running timechart query.
 *
 * <ul>
 *   <li>{@code groupValueCount}: occurrences per split-by value, in first-seen order.</li>
 *   <li>{@code groupScoreMap}: accumulated score per split-by value, only under sum ranking.</li>
 *   <li>{@code otherValues}: one value per output column for the "other" series, null until the
 *       first demotion or until {@link #materializeOther()} is called.</li>
 *   <li>{@code valueIsInLimit}: classification result, set once and then frozen.</li>
 * </ul>
 *
 * <p>Not thread safe. Callers serialize access to one query's state. Closing releases the sketches
 * backing the cardinality columns of the "other" series.</p>
 */
public class TimechartLimitResult implements Releasable {

    private final int columnCount;
    private final Supplier<CardinalitySketch> sketchFactory;
    private final Map<String, Long> groupValueCount;

    private Map<String, AggregateValue> groupScoreMap;
    private List<AggregateValue> otherValues;
    private CardinalitySketch[] otherSketches;
    private Map<String, Boolean> valueIsInLimit;
    private boolean limitFrozen;

    /**
     * Create the state of a query producing {@code columnCount} values per row.
     *
     * @param columnCount number of output columns
     * @param sketchFactory creates the sketches backing "other" cardinality columns
     */
    public TimechartLimitResult(int columnCount, Supplier<CardinalitySketch> sketchFactory) {
        this(columnCount, new LinkedHashMap<>(), sketchFactory);
    }

    /**
     * Create the state of a query around already accumulated group counts.
     *
     * @param columnCount number of output columns
     * @param groupValueCount occurrences per split-by value, owned by this state from now on
     * @param sketchFactory creates the sketches backing "other" cardinality columns
     */
    public TimechartLimitResult(int columnCount, Map<String, Long> groupValueCount, Supplier<CardinalitySketch> sketchFactory) {
        if (columnCount < 0) {
            throw new IllegalArgumentException("Column count must be non-negative, got: " + columnCount);
        }
        this.columnCount = columnCount;
        this.groupValueCount = groupValueCount;
        this.sketchFactory = sketchFactory;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public Map<String, Long> getGroupValueCount() {
        return groupValueCount;
    }

    /**
     * Count occurrences of a split-by value.
     *
     * @param groupValue the split-by value
     * @param count occurrences to add
     */
    public void addGroupCount(String groupValue, long count) {
        groupValueCount.merge(groupValue, count, Long::sum);
    }

    @Nullable
    public Map<String, AggregateValue> getGroupScoreMap() {
        return groupScoreMap;
    }

    public void setGroupScoreMap(@Nullable Map<String, AggregateValue> groupScoreMap) {
        this.groupScoreMap = groupScoreMap;
    }

    /**
     * Accumulated score of a split-by value, an invalid placeholder when nothing was accumulated yet.
     */
    public AggregateValue getScore(String groupValue) {
        if (groupScoreMap == null) {
            return AggregateValue.invalid();
        }
        return groupScoreMap.getOrDefault(groupValue, AggregateValue.invalid());
    }

    /**
     * Store the accumulated score of a split-by value, creating the score map if needed.
     */
    public void setScore(String groupValue, AggregateValue score) {
        if (groupScoreMap == null) {
            groupScoreMap = new LinkedHashMap<>();
        }
        groupScoreMap.put(groupValue, score);
    }

    public boolean isOtherMaterialized() {
        return otherValues != null;
    }

    /**
     * Create the "other" series values as invalid placeholders, if they do not exist yet.
     */
    public void materializeOther() {
        if (otherValues == null) {
            otherValues = new ArrayList<>(Collections.nCopies(columnCount, AggregateValue.invalid()));
            otherSketches = new CardinalitySketch[columnCount];
        }
    }

    /**
     * Drop the "other" series values and release their sketches, e.g. before moving to the next time bucket.
     */
    public void resetOther() {
        releaseSketches();
        otherValues = null;
        otherSketches = null;
    }

    /**
     * @return the "other" series values, or null if no value was demoted yet
     */
    @Nullable
    public List<AggregateValue> getOtherValues() {
        return otherValues == null ? null : Collections.unmodifiableList(otherValues);
    }

    public AggregateValue getOtherValue(int columnIndex) {
        requireOther();
        return otherValues.get(columnIndex);
    }

    public void setOtherValue(int columnIndex, AggregateValue value) {
        requireOther();
        otherValues.set(columnIndex, value);
    }

    /**
     * Sketch backing a cardinality column of the "other" series, created on first use.
     *
     * @param columnIndex the output column
     * @return the column's sketch
     */
    public CardinalitySketch otherSketch(int columnIndex) {
        requireOther();
        if (otherSketches[columnIndex] == null) {
            otherSketches[columnIndex] = sketchFactory.get();
        }
        return otherSketches[columnIndex];
    }

    private void requireOther() {
        if (otherValues == null) {
            throw new IllegalStateException("The other series has not been materialized");
        }
    }

    /**
     * @return the classification result, null if unlimited or not classified yet
     */
    @Nullable
    public Map<String, Boolean> getValueIsInLimit() {
        return valueIsInLimit;
    }

    public boolean isLimitFrozen() {
        return limitFrozen;
    }

    /**
     * Record the classification result. It cannot change for the rest of the query.
     *
     * @param classification split-by value to whether it is kept, null when unlimited
     */
    public void freezeLimit(@Nullable Map<String, Boolean> classification) {
        if (limitFrozen) {
            throw new IllegalStateException("Top-N classification has already been computed for this query");
        }
        this.valueIsInLimit = classification == null ? null : Collections.unmodifiableMap(classification);
        this.limitFrozen = true;
    }

    private void releaseSketches() {
        if (otherSketches != null) {
            Releasables.close(Arrays.asList(otherSketches));
        }
    }

    @Override
    public void close() {
        resetOther();
    }
}
