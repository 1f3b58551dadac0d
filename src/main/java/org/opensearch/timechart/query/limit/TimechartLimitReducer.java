/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.limit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.Nullable;
import org.opensearch.common.lease.Releasable;
import org.opensearch.common.lease.Releasables;
import org.opensearch.timechart.core.model.AggregateFunction;
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.core.model.MeasureAggregator;
import org.opensearch.timechart.core.sketch.CardinalitySketch;
import org.opensearch.timechart.core.sketch.HllCardinalitySketch;
import org.opensearch.timechart.query.config.LimitConfig;
import org.opensearch.timechart.query.config.TimeBucketConfig;
import org.opensearch.timechart.query.config.TimechartConfig;
import org.opensearch.timechart.query.config.TimechartSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the partial timechart results of all shards into the final series.
 *
 * <p>Reduction runs in two passes. The first pass collects group counts and, under sum ranking, group
 * scores, after which the groups are classified once. The second pass walks the rows bucket by bucket,
 * merging kept series across shards and folding demoted ones into the bucket's "other" series. The
 * output does not depend on how rows were distributed over shards.</p>
 *
 * <p>Shard rows and their sketches stay owned by the caller. Sketches created while reducing are
 * released before {@link #reduce} returns.</p>
 */
public class TimechartLimitReducer {

    private static final Logger logger = LogManager.getLogger(TimechartLimitReducer.class);

    private final TimechartSettings settings;
    private final TopNClassifier classifier;
    private final TimechartValueMerger valueMerger;
    private final TimechartResultMerger resultMerger;

    public TimechartLimitReducer(TimechartSettings settings) {
        this(settings, new TopNClassifier(), new TimechartValueMerger());
    }

    TimechartLimitReducer(TimechartSettings settings, TopNClassifier classifier, TimechartValueMerger valueMerger) {
        this.settings = settings;
        this.classifier = classifier;
        this.valueMerger = valueMerger;
        this.resultMerger = new TimechartResultMerger(valueMerger);
    }

    /**
     * Reduce shard results into the final timechart.
     *
     * @param config the query's bucket configuration, carrying the split-by limit if any
     * @param aggregators the function of each output column, in column order
     * @param shardResults partial results of every shard
     * @return kept series and, per bucket, the "other" series
     * @throws IllegalArgumentException if a row does not have one value per aggregator
     */
    public TimechartReduceResult reduce(TimeBucketConfig config, List<MeasureAggregator> aggregators, List<TimechartShardResult> shardResults) {
        TimechartConfig timechart = config.timechart();
        LimitConfig limit = config.limit();
        int columnCount = aggregators.size();
        validateRows(shardResults, columnCount);

        Map<String, Long> groupValueCount = new LinkedHashMap<>();
        for (TimechartShardResult shard : shardResults) {
            TimechartValueMerger.mergeCountMaps(groupValueCount, shard.groupValueCount());
        }

        try (TimechartLimitResult limitResult = new TimechartLimitResult(columnCount, groupValueCount, this::newSketch)) {
            limitResult.setGroupScoreMap(TopNClassifier.initialScoreMap(limit, groupValueCount));
            if (TopNClassifier.isSumRanked(limit)) {
                for (TimechartShardResult shard : shardResults) {
                    for (TimechartRow row : shard.rows()) {
                        accumulateScore(timechart, limitResult, aggregators, row);
                    }
                }
            }
            limitResult.freezeLimit(classifier.classify(limit, groupValueCount, limitResult.getGroupScoreMap()));

            TreeMap<Long, List<TimechartRow>> rowsByBucket = new TreeMap<>();
            for (TimechartShardResult shard : shardResults) {
                for (TimechartRow row : shard.rows()) {
                    rowsByBucket.computeIfAbsent(row.bucket(), bucket -> new ArrayList<>()).add(row);
                }
            }

            List<TimechartRow> keptRows = new ArrayList<>();
            Map<Long, List<AggregateValue>> otherValues = new LinkedHashMap<>();
            for (Map.Entry<Long, List<TimechartRow>> bucketRows : rowsByBucket.entrySet()) {
                reduceBucket(bucketRows.getKey(), bucketRows.getValue(), timechart, limitResult, aggregators, keptRows, otherValues);
            }

            logger.debug(
                "Reduced {} shard results into {} rows over {} buckets, {} buckets with other values",
                shardResults.size(),
                keptRows.size(),
                rowsByBucket.size(),
                otherValues.size()
            );
            return new TimechartReduceResult(
                Collections.unmodifiableList(keptRows),
                Collections.unmodifiableMap(otherValues),
                settings.otherSeriesName()
            );
        }
    }

    private void accumulateScore(
        @Nullable TimechartConfig timechart,
        TimechartLimitResult limitResult,
        List<MeasureAggregator> aggregators,
        TimechartRow row
    ) {
        for (int column = 0; column < aggregators.size(); column++) {
            resultMerger.shouldAddResult(
                timechart,
                limitResult,
                column,
                row.value(column),
                row.sketch(column),
                aggregators.get(column).function(),
                row.groupValue(),
                false
            );
        }
    }

    private void reduceBucket(
        long bucket,
        List<TimechartRow> rows,
        @Nullable TimechartConfig timechart,
        TimechartLimitResult limitResult,
        List<MeasureAggregator> aggregators,
        List<TimechartRow> keptRows,
        Map<Long, List<AggregateValue>> otherValues
    ) {
        limitResult.resetOther();
        if (limitResult.getValueIsInLimit() != null) {
            limitResult.materializeOther();
        }

        Map<String, KeptSeries> kept = new LinkedHashMap<>();
        try {
            boolean anyDemoted = false;
            for (TimechartRow row : rows) {
                boolean demoted = TopNClassifier.isDemoted(limitResult.getValueIsInLimit(), row.groupValue());
                anyDemoted |= demoted;
                for (int column = 0; column < aggregators.size(); column++) {
                    AggregateFunction function = aggregators.get(column).function();
                    boolean add = resultMerger.shouldAddResult(
                        timechart,
                        limitResult,
                        column,
                        row.value(column),
                        row.sketch(column),
                        function,
                        row.groupValue(),
                        demoted
                    );
                    if (add) {
                        kept.computeIfAbsent(row.groupValue(), group -> new KeptSeries(bucket, group, aggregators.size()))
                            .merge(column, row.value(column), row.sketch(column), function);
                    }
                }
            }

            for (KeptSeries series : kept.values()) {
                keptRows.add(series.toRow());
            }
            if (anyDemoted) {
                otherValues.put(bucket, List.copyOf(limitResult.getOtherValues()));
            }
        } finally {
            Releasables.close(kept.values());
        }
    }

    private static void validateRows(List<TimechartShardResult> shardResults, int columnCount) {
        for (TimechartShardResult shard : shardResults) {
            for (TimechartRow row : shard.rows()) {
                if (row.values().size() != columnCount) {
                    throw new IllegalArgumentException(
                        "Row of group [" + row.groupValue() + "] at bucket [" + row.bucket() + "] has " + row.values().size()
                            + " values, expected " + columnCount
                    );
                }
            }
        }
    }

    private CardinalitySketch newSketch() {
        return new HllCardinalitySketch(settings.cardinalityPrecision());
    }

    /**
     * Accumulates the partials of one kept group in one bucket.
     */
    private final class KeptSeries implements Releasable {
        private final long bucket;
        private final String groupValue;
        private final AggregateValue[] values;
        private final CardinalitySketch[] sketches;

        KeptSeries(long bucket, String groupValue, int columnCount) {
            this.bucket = bucket;
            this.groupValue = groupValue;
            this.values = new AggregateValue[columnCount];
            this.sketches = new CardinalitySketch[columnCount];
            Arrays.fill(values, AggregateValue.invalid());
        }

        void merge(int column, AggregateValue incoming, @Nullable CardinalitySketch incomingSketch, AggregateFunction function) {
            CardinalitySketch sketch = null;
            if (incomingSketch != null && function.mergeKind() == AggregateFunction.MergeKind.CARDINALITY) {
                if (sketches[column] == null) {
                    sketches[column] = newSketch();
                }
                sketch = sketches[column];
            }
            values[column] = valueMerger.mergePartial(values[column], incoming, sketch, incomingSketch, function);
        }

        TimechartRow toRow() {
            return new TimechartRow(bucket, groupValue, List.of(values));
        }

        @Override
        public void close() {
            Releasables.close(Arrays.asList(sketches));
        }
    }
}
