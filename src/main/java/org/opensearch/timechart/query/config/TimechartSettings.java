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
import org.opensearch.common.settings.Settings;
import org.opensearch.timechart.TimechartPlugin;

/**
 * Resolved node-level tunables of the timechart engine.
 *
 * <p>Settings are defined in {@link TimechartPlugin}:</p>
 * <ul>
 *   <li>{@link TimechartPlugin#TIMECHART_DEFAULT_LIMIT}</li>
 *   <li>{@link TimechartPlugin#TIMECHART_CARDINALITY_PRECISION}</li>
 *   <li>{@link TimechartPlugin#TIMECHART_OTHER_SERIES_NAME}</li>
 * </ul>
 *
 * @param defaultLimit number of split-by values kept when no explicit limit is given
 * @param cardinalityPrecision HyperLogLog++ precision for "other" cardinality sketches
 * @param otherSeriesName name of the synthetic series holding demoted values
 */
public record TimechartSettings(int defaultLimit, int cardinalityPrecision, String otherSeriesName) {

    private static final Logger logger = LogManager.getLogger(TimechartSettings.class);

    public TimechartSettings {
        if (defaultLimit < 0) {
            throw new IllegalArgumentException("Default limit must be non-negative, got: " + defaultLimit);
        }
        if (cardinalityPrecision < 4 || cardinalityPrecision > 18) {
            throw new IllegalArgumentException("Cardinality precision must be in [4, 18], got: " + cardinalityPrecision);
        }
        if (otherSeriesName == null || otherSeriesName.isEmpty()) {
            throw new IllegalArgumentException("Other series name cannot be null or empty");
        }
    }

    /**
     * Resolve the timechart settings from node settings, falling back to the setting defaults.
     *
     * @param settings the node settings
     * @return resolved settings
     */
    public static TimechartSettings fromSettings(Settings settings) {
        TimechartSettings resolved = new TimechartSettings(
            TimechartPlugin.TIMECHART_DEFAULT_LIMIT.get(settings),
            TimechartPlugin.TIMECHART_CARDINALITY_PRECISION.get(settings),
            TimechartPlugin.TIMECHART_OTHER_SERIES_NAME.get(settings)
        );
        logger.debug(
            "Resolved timechart settings: defaultLimit={}, cardinalityPrecision={}, otherSeriesName={}",
            resolved.defaultLimit(),
            resolved.cardinalityPrecision(),
            resolved.otherSeriesName()
        );
        return resolved;
    }

    /**
     * Settings used when no node settings are available, e.g. in unit tests.
     *
     * @return default settings
     */
    public static TimechartSettings defaults() {
        return fromSettings(Settings.EMPTY);
    }

    /**
     * Copy of these settings with a different default limit, for dynamic setting updates.
     *
     * @param newDefaultLimit the new default limit
     * @return updated settings
     */
    public TimechartSettings withDefaultLimit(int newDefaultLimit) {
        return new TimechartSettings(newDefaultLimit, cardinalityPrecision, otherSeriesName);
    }
}
