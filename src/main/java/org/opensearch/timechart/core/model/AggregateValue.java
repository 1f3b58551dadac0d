/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Tagged scalar holding one piece of mergeable aggregate state: nothing, a number, a string or a
 * list of strings.
 *
 * <p>Instances are immutable. Merging two values produces a new value which the owner stores back
 * in place of the old one.</p>
 */
public final class AggregateValue {

    private static final AggregateValue INVALID = new AggregateValue(ValueType.INVALID, null);

    private final ValueType type;
    private final Object value;

    private AggregateValue(ValueType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static AggregateValue invalid() {
        return INVALID;
    }

    public static AggregateValue ofSigned(long value) {
        return new AggregateValue(ValueType.SIGNED, value);
    }

    /**
     * Unsigned values are kept in a long and compared with {@link Long#compareUnsigned}.
     */
    public static AggregateValue ofUnsigned(long value) {
        return new AggregateValue(ValueType.UNSIGNED, value);
    }

    public static AggregateValue ofFloat(double value) {
        return new AggregateValue(ValueType.FLOAT, value);
    }

    public static AggregateValue ofString(String value) {
        return new AggregateValue(ValueType.STRING, Objects.requireNonNull(value, "value cannot be null"));
    }

    /**
     * @param values sorted distinct strings
     */
    public static AggregateValue ofStrings(List<String> values) {
        return new AggregateValue(ValueType.STRING_LIST, List.copyOf(values));
    }

    public ValueType getType() {
        return type;
    }

    public boolean isValid() {
        return type != ValueType.INVALID;
    }

    /**
     * Read this value as a double.
     *
     * @return the numeric value
     * @throws IllegalStateException if the value is not numeric
     */
    public double toDouble() {
        return switch (type) {
            case SIGNED -> (long) value;
            case UNSIGNED -> unsignedToDouble((long) value);
            case FLOAT -> (double) value;
            case INVALID, STRING, STRING_LIST -> throw new IllegalStateException("Cannot read " + type + " value as a number");
        };
    }

    /**
     * Raw long of a {@link ValueType#SIGNED} or {@link ValueType#UNSIGNED} value.
     *
     * @throws IllegalStateException if the value is not an integer
     */
    public long longValue() {
        if (type != ValueType.SIGNED && type != ValueType.UNSIGNED) {
            throw new IllegalStateException("Cannot read " + type + " value as an integer");
        }
        return (long) value;
    }

    /**
     * Strings of a {@link ValueType#STRING} or {@link ValueType#STRING_LIST} value.
     *
     * @throws IllegalStateException if the value holds no strings
     */
    @SuppressWarnings("unchecked")
    public List<String> strings() {
        return switch (type) {
            case STRING -> List.of((String) value);
            case STRING_LIST -> (List<String>) value;
            case INVALID, SIGNED, UNSIGNED, FLOAT -> throw new IllegalStateException("Cannot read " + type + " value as strings");
        };
    }

    private static double unsignedToDouble(long value) {
        double asDouble = (double) (value & Long.MAX_VALUE);
        return value < 0 ? asDouble + 0x1.0p63 : asDouble;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregateValue that = (AggregateValue) o;
        return type == that.type && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        if (type == ValueType.UNSIGNED) {
            return "AggregateValue{type=" + type + ", value=" + Long.toUnsignedString((long) value) + '}';
        }
        return "AggregateValue{type=" + type + ", value=" + value + '}';
    }
}
