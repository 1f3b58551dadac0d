/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.config;

import java.util.Objects;

/**
 * Limit clause of a timechart: keep the {@code count} top or bottom split-by values, ranked by {@code scoreMode}.
 *
 * @param direction which extreme to keep
 * @param count number of split-by values kept, non-negative
 * @param scoreMode how split-by values are scored
 */
public record LimitConfig(LimitDirection direction, int count, ScoreMode scoreMode) {

    public LimitConfig {
        Objects.requireNonNull(direction, "direction cannot be null");
        Objects.requireNonNull(scoreMode, "scoreMode cannot be null");
        if (count < 0) {
            throw new IllegalArgumentException("Limit count must be non-negative, got: " + count);
        }
    }

    /**
     * Limit applied when a split-by field is given without an explicit limit.
     * Sum ranking only makes sense for a single measure, so several measures rank by frequency.
     *
     * @param count number of split-by values kept
     * @param measureCount number of measure aggregators requested
     * @return the default limit
     */
    public static LimitConfig defaultFor(int count, int measureCount) {
        return new LimitConfig(LimitDirection.TOP, count, measureCount > 1 ? ScoreMode.BY_FREQUENCY : ScoreMode.BY_SUM);
    }

    public boolean isTop() {
        return direction == LimitDirection.TOP;
    }
}
