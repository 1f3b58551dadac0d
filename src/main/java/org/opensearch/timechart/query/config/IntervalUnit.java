/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.config;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Time units accepted for a timechart span, with their fixed length in milliseconds.
 * <p>
 * Month and quarter are fixed approximations (30 and 120 days), not calendar units.
 * Microsecond spans resolve to zero milliseconds because timestamps are stored at millisecond resolution.
 */
public enum IntervalUnit {
    MICROSECOND(0L),
    MILLISECOND(1L),
    CENTISECOND(10L),
    DECISECOND(100L),
    SECOND(1000L),
    MINUTE(60_000L),
    HOUR(3_600_000L),
    DAY(24 * 3_600_000L),
    WEEK(7 * 24 * 3_600_000L),
    MONTH(30 * 24 * 3_600_000L),
    QUARTER(120 * 24 * 3_600_000L);

    private static final Map<String, IntervalUnit> SUFFIXES = createSuffixes();

    private final long millis;

    IntervalUnit(long millis) {
        this.millis = millis;
    }

    private static Map<String, IntervalUnit> createSuffixes() {
        Map<String, IntervalUnit> suffixes = new HashMap<>();
        suffixes.put("us", MICROSECOND);
        suffixes.put("ms", MILLISECOND);
        suffixes.put("cs", CENTISECOND);
        suffixes.put("ds", DECISECOND);
        suffixes.put("s", SECOND);
        suffixes.put("sec", SECOND);
        suffixes.put("second", SECOND);
        suffixes.put("seconds", SECOND);
        suffixes.put("m", MINUTE);
        suffixes.put("min", MINUTE);
        suffixes.put("minute", MINUTE);
        suffixes.put("minutes", MINUTE);
        suffixes.put("h", HOUR);
        suffixes.put("hr", HOUR);
        suffixes.put("hour", HOUR);
        suffixes.put("hours", HOUR);
        suffixes.put("d", DAY);
        suffixes.put("day", DAY);
        suffixes.put("days", DAY);
        suffixes.put("w", WEEK);
        suffixes.put("week", WEEK);
        suffixes.put("weeks", WEEK);
        suffixes.put("mon", MONTH);
        suffixes.put("month", MONTH);
        suffixes.put("months", MONTH);
        suffixes.put("q", QUARTER);
        suffixes.put("qtr", QUARTER);
        suffixes.put("quarter", QUARTER);
        suffixes.put("quarters", QUARTER);
        return suffixes;
    }

    /**
     * Length of {@code count} units in milliseconds.
     *
     * @param count number of units, must be non-negative
     * @return interval length in milliseconds
     */
    public long toMillis(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Interval count must be non-negative, got: " + count);
        }
        return Math.multiplyExact(count, millis);
    }

    /**
     * Resolve a span suffix such as {@code m}, {@code hr} or {@code mon}.
     *
     * @param unit the suffix, case-insensitive
     * @return the matching unit
     */
    public static IntervalUnit fromString(String unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Interval unit cannot be null");
        }
        IntervalUnit resolved = SUFFIXES.get(unit.trim().toLowerCase(Locale.ROOT));
        if (resolved == null) {
            throw new IllegalArgumentException("Invalid interval unit: " + unit);
        }
        return resolved;
    }
}
