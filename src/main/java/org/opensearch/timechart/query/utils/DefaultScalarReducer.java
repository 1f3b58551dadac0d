/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.utils;

import org.opensearch.timechart.core.model.AggregateFunction;
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.core.model.ValueType;

import java.util.ArrayList;
import java.util.TreeSet;

/**
 * Default {@link ScalarReducer}.
 *
 * <ul>
 *   <li>An invalid value is the identity on either side.</li>
 *   <li>{@code SUM}, {@code COUNT} and {@code CARDINALITY} add, {@code MIN} and {@code MAX} select.</li>
 *   <li>Two signed or two unsigned integers keep their type, any other numeric mix becomes a float.</li>
 *   <li>{@code VALUES} unions strings into a sorted distinct list.</li>
 * </ul>
 * {@code AVG} and {@code RANGE} partials are not reducible here; they are expanded into primitives upstream.
 */
public class DefaultScalarReducer implements ScalarReducer {

    public static final DefaultScalarReducer INSTANCE = new DefaultScalarReducer();

    @Override
    public AggregateValue reduce(AggregateValue first, AggregateValue second, AggregateFunction function) {
        if (first.isValid() == false) {
            return second;
        }
        if (second.isValid() == false) {
            return first;
        }

        return switch (function) {
            case SUM, COUNT, CARDINALITY -> add(first, second, function);
            case MIN -> select(first, second, function, true);
            case MAX -> select(first, second, function, false);
            case VALUES -> union(first, second);
            case AVG, RANGE -> throw new IllegalArgumentException("Cannot reduce partial " + function + " values, expand them first");
        };
    }

    private static AggregateValue add(AggregateValue first, AggregateValue second, AggregateFunction function) {
        requireNumeric(first, second, function);
        if (first.getType() == second.getType()) {
            switch (first.getType()) {
                case SIGNED:
                    return AggregateValue.ofSigned(first.longValue() + second.longValue());
                case UNSIGNED:
                    return AggregateValue.ofUnsigned(first.longValue() + second.longValue());
                default:
                    break;
            }
        }
        return AggregateValue.ofFloat(first.toDouble() + second.toDouble());
    }

    private static AggregateValue select(AggregateValue first, AggregateValue second, AggregateFunction function, boolean min) {
        requireNumeric(first, second, function);
        int cmp;
        if (first.getType() == ValueType.SIGNED && second.getType() == ValueType.SIGNED) {
            cmp = Long.compare(first.longValue(), second.longValue());
        } else if (first.getType() == ValueType.UNSIGNED && second.getType() == ValueType.UNSIGNED) {
            cmp = Long.compareUnsigned(first.longValue(), second.longValue());
        } else {
            double a = first.toDouble();
            double b = second.toDouble();
            return AggregateValue.ofFloat(min ? Math.min(a, b) : Math.max(a, b));
        }
        if (min) {
            return cmp <= 0 ? first : second;
        }
        return cmp >= 0 ? first : second;
    }

    private static AggregateValue union(AggregateValue first, AggregateValue second) {
        if (isStringValued(first) == false || isStringValued(second) == false) {
            throw new IllegalArgumentException(
                "Cannot reduce " + first.getType() + " and " + second.getType() + " values under " + AggregateFunction.VALUES
            );
        }
        TreeSet<String> merged = new TreeSet<>(first.strings());
        merged.addAll(second.strings());
        return AggregateValue.ofStrings(new ArrayList<>(merged));
    }

    private static boolean isStringValued(AggregateValue value) {
        return value.getType() == ValueType.STRING || value.getType() == ValueType.STRING_LIST;
    }

    private static void requireNumeric(AggregateValue first, AggregateValue second, AggregateFunction function) {
        if (first.getType().isNumeric() == false || second.getType().isNumeric() == false) {
            throw new IllegalArgumentException(
                "Cannot reduce " + first.getType() + " and " + second.getType() + " values under " + function
            );
        }
    }
}
