/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart;

import org.opensearch.common.settings.Setting;
import org.opensearch.plugins.Plugin;

import java.util.List;

/**
 * Plugin exposing the timechart top-N grouping and merge engine settings.
 */
public class TimechartPlugin extends Plugin {

    /**
     * Number of split-by values kept when a timechart names a split-by field without an explicit limit.
     */
    public static final Setting<Integer> TIMECHART_DEFAULT_LIMIT = Setting.intSetting(
        "timechart.limit.default_count",
        10,
        0,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * HyperLogLog++ precision of the sketches backing cardinality columns of the "other" series.
     */
    public static final Setting<Integer> TIMECHART_CARDINALITY_PRECISION = Setting.intSetting(
        "timechart.cardinality.precision",
        14,
        4,
        18,
        Setting.Property.NodeScope
    );

    /**
     * Name of the synthetic series that accumulates every demoted split-by value.
     */
    public static final Setting<String> TIMECHART_OTHER_SERIES_NAME = Setting.simpleString(
        "timechart.other_series_name",
        "other",
        Setting.Property.NodeScope
    );

    /**
     * Default constructor
     */
    public TimechartPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(TIMECHART_DEFAULT_LIMIT, TIMECHART_CARDINALITY_PRECISION, TIMECHART_OTHER_SERIES_NAME);
    }
}
