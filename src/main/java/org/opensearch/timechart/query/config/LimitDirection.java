/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.config;

/**
 * Which extreme of the ranking a timechart limit keeps.
 */
public enum LimitDirection {
    /** Keep the highest scoring split-by values */
    TOP,
    /** Keep the lowest scoring split-by values */
    BOTTOM;

    public static LimitDirection fromString(String direction) {
        return switch (direction) {
            case "top" -> TOP;
            case "bottom" -> BOTTOM;
            default -> throw new IllegalArgumentException("Invalid limit direction: " + direction);
        };
    }
}
