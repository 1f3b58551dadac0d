/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.limit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.Nullable;
import org.opensearch.timechart.core.model.AggregateFunction;
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.core.sketch.CardinalitySketch;
import org.opensearch.timechart.query.utils.DefaultScalarReducer;
import org.opensearch.timechart.query.utils.ScalarReducer;

import java.util.Map;

/**
 * Folds partial aggregate values into an accumulator.
 *
 * <p>Merge failures never abort a query: they are logged and the accumulator is returned unchanged.</p>
 */
public class TimechartValueMerger {

    private static final Logger logger = LogManager.getLogger(TimechartValueMerger.class);

    private final ScalarReducer reducer;
    private final Logger log;

    public TimechartValueMerger() {
        this(DefaultScalarReducer.INSTANCE);
    }

    public TimechartValueMerger(ScalarReducer reducer) {
        this(reducer, logger);
    }

    TimechartValueMerger(ScalarReducer reducer, Logger log) {
        this.reducer = reducer;
        this.log = log;
    }

    /**
     * Merge an incoming partial value into the accumulated one.
     *
     * <p>Partials of sum-like functions are added, since averages arrive expanded into sums and counts.
     * Cardinalities are added while {@code useAdditionForMerge} is set or a sketch is missing, and
     * otherwise computed from the union of the sketches. Value lists are unioned.</p>
     *
     * @param target the accumulated value
     * @param incoming the partial value to fold in
     * @param sketch the sketch backing {@code target}, updated in place
     * @param incomingSketch the sketch backing {@code incoming}, left unchanged
     * @param function the function that produced both values
     * @param useAdditionForMerge whether cardinalities are merged by adding estimates
     * @return the merged value, or {@code target} if the values could not be merged
     */
    public AggregateValue mergeScalar(
        AggregateValue target,
        AggregateValue incoming,
        @Nullable CardinalitySketch sketch,
        @Nullable CardinalitySketch incomingSketch,
        AggregateFunction function,
        boolean useAdditionForMerge
    ) {
        return switch (function.mergeKind()) {
            case SUM_LIKE -> reduceOrKeep(target, incoming, AggregateFunction.SUM);
            case CARDINALITY -> mergeCardinality(target, incoming, sketch, incomingSketch, useAdditionForMerge);
            case STRING_VALUED -> reduceOrKeep(target, incoming, AggregateFunction.VALUES);
        };
    }

    /**
     * Merge two partials of the same series, such as the values two shards computed for one group and bucket.
     * Each function keeps its own semantics here: minimums and maximums are selected, cardinalities are
     * unioned whenever both sketches exist. Partial averages and ranges cannot be recombined from their
     * scalars, so like {@link #mergeScalar} they fall back to addition.
     *
     * @param target the accumulated value
     * @param incoming the partial value to fold in
     * @param sketch the sketch backing {@code target}, updated in place
     * @param incomingSketch the sketch backing {@code incoming}, left unchanged
     * @param function the function that produced both values
     * @return the merged value, or {@code target} if the values could not be merged
     */
    public AggregateValue mergePartial(
        AggregateValue target,
        AggregateValue incoming,
        @Nullable CardinalitySketch sketch,
        @Nullable CardinalitySketch incomingSketch,
        AggregateFunction function
    ) {
        return switch (function) {
            case CARDINALITY -> mergeCardinality(target, incoming, sketch, incomingSketch, sketch == null || incomingSketch == null);
            case AVG, RANGE -> reduceOrKeep(target, incoming, AggregateFunction.SUM);
            case COUNT, SUM, MIN, MAX, VALUES -> reduceOrKeep(target, incoming, function);
        };
    }

    private AggregateValue mergeCardinality(
        AggregateValue target,
        AggregateValue incoming,
        @Nullable CardinalitySketch sketch,
        @Nullable CardinalitySketch incomingSketch,
        boolean useAdditionForMerge
    ) {
        boolean haveSketches = sketch != null && incomingSketch != null;
        if (useAdditionForMerge == false) {
            if (haveSketches) {
                if (unionSketches(sketch, incomingSketch) == false) {
                    return target;
                }
                return AggregateValue.ofUnsigned(sketch.estimate());
            }
            log.warn("Missing cardinality sketch, merging distinct counts by addition");
        }

        AggregateValue merged = reduceOrKeep(target, incoming, AggregateFunction.SUM);
        if (haveSketches) {
            // keep the sketch in step so a later union still sees these values
            unionSketches(sketch, incomingSketch);
        }
        return merged;
    }

    private boolean unionSketches(CardinalitySketch sketch, CardinalitySketch incomingSketch) {
        try {
            sketch.merge(incomingSketch);
            return true;
        } catch (IllegalArgumentException e) {
            log.error("Failed to merge cardinality sketches: {}", e.getMessage());
            return false;
        }
    }

    private AggregateValue reduceOrKeep(AggregateValue target, AggregateValue incoming, AggregateFunction function) {
        try {
            return reducer.reduce(incoming, target, function);
        } catch (IllegalArgumentException e) {
            log.error("Failed to merge values under {}: {}", function, e.getMessage());
            return target;
        }
    }

    /**
     * Add the counts of {@code incoming} into {@code target}. Keys new to {@code target} are appended in
     * {@code incoming} order. Applying the same map twice counts it twice.
     *
     * @param target the accumulated counts, updated in place
     * @param incoming counts to add
     */
    public static void mergeCountMaps(Map<String, Long> target, Map<String, Long> incoming) {
        for (Map.Entry<String, Long> entry : incoming.entrySet()) {
            target.merge(entry.getKey(), entry.getValue(), Long::sum);
        }
    }
}
