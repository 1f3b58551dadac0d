/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.core.model;

/**
 * Enum representing the type tag of an {@link AggregateValue}.
 */
public enum ValueType {
    /** No value yet, or a value that could not be computed */
    INVALID,
    /** Signed 64-bit integer */
    SIGNED,
    /** Unsigned 64-bit integer, stored in a long */
    UNSIGNED,
    /** 64-bit floating point */
    FLOAT,
    /** Single string */
    STRING,
    /** Sorted distinct strings */
    STRING_LIST;

    public boolean isNumeric() {
        return this == SIGNED || this == UNSIGNED || this == FLOAT;
    }
}
