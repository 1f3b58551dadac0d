/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.config;

import org.opensearch.common.Nullable;

/**
 * Split-by part of a timechart.
 *
 * @param byField split-by field, empty for no grouping
 * @param limit limit clause, null when split-by values are unlimited
 */
public record TimechartConfig(String byField, @Nullable LimitConfig limit) {

    public TimechartConfig {
        byField = byField == null ? "" : byField;
    }

    public boolean hasByField() {
        return byField.isEmpty() == false;
    }

    public boolean hasLimit() {
        return limit != null;
    }
}
