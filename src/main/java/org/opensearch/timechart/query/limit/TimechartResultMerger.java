/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.limit;

import org.opensearch.common.Nullable;
import org.opensearch.timechart.core.model.AggregateFunction;
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.core.sketch.CardinalitySketch;
import org.opensearch.timechart.query.config.TimechartConfig;

/**
 * Routes each partial value of a split-by series either to the result or into the query's limit state.
 */
public class TimechartResultMerger {

    private final TimechartValueMerger valueMerger;

    public TimechartResultMerger() {
        this(new TimechartValueMerger());
    }

    public TimechartResultMerger(TimechartValueMerger valueMerger) {
        this.valueMerger = valueMerger;
    }

    /**
     * Decide where a partial value goes.
     *
     * <ol>
     *   <li>Values of demoted groups fold into the "other" series, which is created on the first demotion.</li>
     *   <li>Under sum ranking, before the "other" series exists, values accumulate into the group's score.</li>
     *   <li>Everything else belongs in the result.</li>
     * </ol>
     *
     * Cardinalities merge by addition as long as the "other" series had not been created when this call
     * started, and by sketch union afterwards.
     *
     * @param timechart the query's timechart configuration, null when there is no split-by field
     * @param limitResult the query's limit state
     * @param columnIndex output column of the value
     * @param incoming the partial value
     * @param incomingSketch the sketch backing {@code incoming}, for cardinality columns
     * @param function the function that produced the value
     * @param groupValue the split-by value the partial belongs to
     * @param isDemoted whether {@code groupValue} fell outside the limit
     * @return true if the caller must add the value to the result itself
     */
    public boolean shouldAddResult(
        @Nullable TimechartConfig timechart,
        TimechartLimitResult limitResult,
        int columnIndex,
        AggregateValue incoming,
        @Nullable CardinalitySketch incomingSketch,
        AggregateFunction function,
        String groupValue,
        boolean isDemoted
    ) {
        boolean useAdditionForMerge = limitResult.isOtherMaterialized() == false;

        if (isDemoted) {
            limitResult.materializeOther();
            CardinalitySketch sketch = function.mergeKind() == AggregateFunction.MergeKind.CARDINALITY
                ? limitResult.otherSketch(columnIndex)
                : null;
            AggregateValue merged = valueMerger.mergeScalar(
                limitResult.getOtherValue(columnIndex),
                incoming,
                sketch,
                incomingSketch,
                function,
                useAdditionForMerge
            );
            limitResult.setOtherValue(columnIndex, merged);
            return false;
        }

        if (useAdditionForMerge && timechart != null && TopNClassifier.isSumRanked(timechart.limit())) {
            AggregateValue score = valueMerger.mergeScalar(limitResult.getScore(groupValue), incoming, null, null, function, true);
            limitResult.setScore(groupValue, score);
            return false;
        }

        return true;
    }
}
