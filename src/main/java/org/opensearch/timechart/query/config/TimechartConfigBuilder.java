/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.Nullable;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.timechart.TimechartPlugin;

/**
 * Translates a user supplied span and split-by clause into a {@link TimeBucketConfig}.
 *
 * <p>When a split-by field is given without a limit, the default limit keeps the top
 * {@link TimechartPlugin#TIMECHART_DEFAULT_LIMIT} values, ranked by sum for a single measure and
 * by frequency for several measures. Without a split-by field no limit is attached, even if one
 * was supplied.</p>
 */
public class TimechartConfigBuilder {

    private static final Logger logger = LogManager.getLogger(TimechartConfigBuilder.class);

    private volatile TimechartSettings settings;

    /**
     * Create a builder with the given settings.
     *
     * @param settings resolved timechart settings
     */
    public TimechartConfigBuilder(TimechartSettings settings) {
        this.settings = settings;
    }

    /**
     * Follow dynamic updates of the default limit.
     *
     * @param clusterSettings the cluster settings to listen on
     */
    public void registerListeners(ClusterSettings clusterSettings) {
        clusterSettings.addSettingsUpdateConsumer(TimechartPlugin.TIMECHART_DEFAULT_LIMIT, this::updateDefaultLimit);
    }

    void updateDefaultLimit(int newDefaultLimit) {
        settings = settings.withDefaultLimit(newDefaultLimit);
        logger.info("Updated timechart default limit to: {}", newDefaultLimit);
    }

    public TimechartSettings getSettings() {
        return settings;
    }

    /**
     * Build the bucket configuration of a timechart.
     *
     * @param intervalNumber number of interval units per bucket
     * @param intervalUnit the interval unit
     * @param byField split-by field, null or empty for none
     * @param explicitLimit user supplied limit, null to apply the default
     * @param measureCount number of measure aggregators in the query
     * @return the resolved configuration, not yet bound to a time range
     */
    public TimeBucketConfig build(
        long intervalNumber,
        IntervalUnit intervalUnit,
        @Nullable String byField,
        @Nullable LimitConfig explicitLimit,
        int measureCount
    ) {
        long intervalMillis = intervalUnit.toMillis(intervalNumber);
        if (intervalMillis == 0) {
            logger.debug("Interval [{} {}] resolves to 0ms, timestamps are stored at millisecond resolution", intervalNumber, intervalUnit);
        }

        LimitConfig limit = null;
        if (byField != null && byField.isEmpty() == false) {
            limit = explicitLimit != null ? explicitLimit : LimitConfig.defaultFor(settings.defaultLimit(), measureCount);
        }

        return new TimeBucketConfig(0L, 0L, intervalMillis, new TimechartConfig(byField, limit));
    }

    /**
     * Build the bucket configuration of a timechart from a span such as {@code 5m} or {@code 1mon}.
     *
     * @param span number immediately followed by a unit suffix
     * @param byField split-by field, null or empty for none
     * @param explicitLimit user supplied limit, null to apply the default
     * @param measureCount number of measure aggregators in the query
     * @return the resolved configuration, not yet bound to a time range
     */
    public TimeBucketConfig build(String span, @Nullable String byField, @Nullable LimitConfig explicitLimit, int measureCount) {
        if (span == null || span.isBlank()) {
            throw new IllegalArgumentException("Span cannot be null or empty");
        }
        String trimmed = span.trim();
        int index = 0;
        while (index < trimmed.length() && Character.isDigit(trimmed.charAt(index))) {
            index++;
        }
        if (index == 0) {
            throw new IllegalArgumentException("Span must start with a number: " + span);
        }

        long count;
        try {
            count = Long.parseLong(trimmed.substring(0, index));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value in span: " + span, e);
        }

        String unit = trimmed.substring(index);
        if (unit.isEmpty()) {
            throw new IllegalArgumentException("Missing time unit in span: " + span);
        }
        return build(count, IntervalUnit.fromString(unit), byField, explicitLimit, measureCount);
    }
}
