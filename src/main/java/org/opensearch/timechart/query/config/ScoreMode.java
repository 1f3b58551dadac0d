/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.config;

/**
 * How split-by values are scored when a timechart limit ranks them.
 */
public enum ScoreMode {
    /**
     * Score is the sum of the measure values of the group. Ranking is only known once every
     * partial result has been seen.
     */
    BY_SUM,

    /**
     * Score is the number of occurrences of the group. Ranking can be decided as soon as counts are known.
     */
    BY_FREQUENCY
}
