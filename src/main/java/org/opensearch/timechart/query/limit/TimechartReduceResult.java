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

import java.util.List;
import java.util.Map;

/**
 * Final timechart result after merging every shard.
 *
 * @param rows kept series, ordered by bucket then by first-seen group; rows carry no sketches
 * @param otherValues per bucket, the "other" series values, present only for buckets with demoted values
 * @param otherSeriesName name under which the "other" series is presented
 */
public record TimechartReduceResult(List<TimechartRow> rows, Map<Long, List<AggregateValue>> otherValues, String otherSeriesName) {

    @Nullable
    public List<AggregateValue> otherValues(long bucket) {
        return otherValues.get(bucket);
    }

    public boolean hasOther() {
        return otherValues.isEmpty() == false;
    }
}
