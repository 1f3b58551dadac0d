/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.stats;

import org.opensearch.timechart.core.model.AggregateFunction;
import org.opensearch.timechart.core.model.MeasureAggregator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Measure aggregators rewritten into primitives that merge correctly across shards.
 *
 * <p>An average cannot be merged from two partial averages, so it is computed as a sum and a count
 * and recombined when the result is presented. Every expanded aggregator keeps a reverse index
 * entry pointing at the position of the aggregator it came from, and {@link #colToIndex()} lists
 * the expanded positions derived from each measure column.</p>
 *
 * <p>Instances are immutable: each expand call returns a new, longer expansion. Expanded positions
 * are insertion order, so {@link #reverseIndex()} is parallel to {@link #aggregators()}.</p>
 */
public final class RunningStatsExpansion {

    private static final RunningStatsExpansion EMPTY = new RunningStatsExpansion(List.of(), List.of(), Map.of());

    private final List<MeasureAggregator> aggregators;
    private final List<Integer> reverseIndex;
    private final Map<String, List<Integer>> colToIndex;

    private RunningStatsExpansion(List<MeasureAggregator> aggregators, List<Integer> reverseIndex, Map<String, List<Integer>> colToIndex) {
        this.aggregators = aggregators;
        this.reverseIndex = reverseIndex;
        this.colToIndex = colToIndex;
    }

    public static RunningStatsExpansion empty() {
        return EMPTY;
    }

    /**
     * Expand every aggregator of a query, in order.
     * Counts and averages are expanded, other functions pass through unchanged.
     *
     * @param originals the aggregators requested by the query
     * @return the expansion of all of them
     */
    public static RunningStatsExpansion expandAll(List<MeasureAggregator> originals) {
        RunningStatsExpansion expansion = EMPTY;
        for (int i = 0; i < originals.size(); i++) {
            MeasureAggregator original = originals.get(i);
            expansion = switch (original.function()) {
                case COUNT -> expansion.expandCount(original, i);
                case AVG -> expansion.expandAvg(original, i);
                case SUM, MIN, MAX, RANGE, CARDINALITY, VALUES -> expansion.passThrough(original, i);
            };
        }
        return expansion;
    }

    /**
     * Append a count of the original's column.
     *
     * @param original the aggregator being expanded
     * @param originalIndex position of {@code original} in the query's aggregators
     * @return the extended expansion
     */
    public RunningStatsExpansion expandCount(MeasureAggregator original, int originalIndex) {
        return append(original, originalIndex, AggregateFunction.COUNT);
    }

    /**
     * Append a sum then a count of the original's column.
     *
     * @param original the aggregator being expanded
     * @param originalIndex position of {@code original} in the query's aggregators
     * @return the extended expansion
     */
    public RunningStatsExpansion expandAvg(MeasureAggregator original, int originalIndex) {
        return append(original, originalIndex, AggregateFunction.SUM, AggregateFunction.COUNT);
    }

    /**
     * Append the original aggregator unchanged.
     *
     * @param original the aggregator
     * @param originalIndex position of {@code original} in the query's aggregators
     * @return the extended expansion
     */
    public RunningStatsExpansion passThrough(MeasureAggregator original, int originalIndex) {
        return append(original, originalIndex, original.function());
    }

    private RunningStatsExpansion append(MeasureAggregator original, int originalIndex, AggregateFunction... primitives) {
        if (originalIndex < 0) {
            throw new IllegalArgumentException("Original index must be non-negative, got: " + originalIndex);
        }
        List<MeasureAggregator> newAggregators = new ArrayList<>(aggregators.size() + primitives.length);
        newAggregators.addAll(aggregators);
        List<Integer> newReverseIndex = new ArrayList<>(reverseIndex.size() + primitives.length);
        newReverseIndex.addAll(reverseIndex);
        Map<String, List<Integer>> newColToIndex = new LinkedHashMap<>(colToIndex);
        List<Integer> columnIndices = new ArrayList<>(newColToIndex.getOrDefault(original.measureColumn(), List.of()));

        for (AggregateFunction primitive : primitives) {
            columnIndices.add(newAggregators.size());
            newAggregators.add(original.withFunction(primitive));
            newReverseIndex.add(originalIndex);
        }
        newColToIndex.put(original.measureColumn(), Collections.unmodifiableList(columnIndices));

        return new RunningStatsExpansion(
            Collections.unmodifiableList(newAggregators),
            Collections.unmodifiableList(newReverseIndex),
            Collections.unmodifiableMap(newColToIndex)
        );
    }

    /**
     * @return the expanded aggregators, in push-down order
     */
    public List<MeasureAggregator> aggregators() {
        return aggregators;
    }

    /**
     * @return for each expanded aggregator, the position of the aggregator it was derived from
     */
    public List<Integer> reverseIndex() {
        return reverseIndex;
    }

    /**
     * @return for each measure column, the expanded positions derived from it
     */
    public Map<String, List<Integer>> colToIndex() {
        return colToIndex;
    }

    public int size() {
        return aggregators.size();
    }

    @Override
    public String toString() {
        return "RunningStatsExpansion{aggregators=" + aggregators + ", reverseIndex=" + reverseIndex + ", colToIndex=" + colToIndex + '}';
    }
}
