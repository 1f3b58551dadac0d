/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.limit;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partial timechart result of one shard.
 *
 * @param groupValueCount occurrences per split-by value seen by the shard, in first-seen order
 * @param rows the shard's rows
 */
public record TimechartShardResult(Map<String, Long> groupValueCount, List<TimechartRow> rows) {

    public TimechartShardResult {
        Objects.requireNonNull(groupValueCount, "groupValueCount cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");
    }
}
