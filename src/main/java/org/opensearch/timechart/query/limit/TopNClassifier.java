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
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.query.config.LimitConfig;
import org.opensearch.timechart.query.config.ScoreMode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which split-by values are kept as their own series and which are folded into "other".
 *
 * <p>Under {@link ScoreMode#BY_SUM} groups are ranked by their accumulated score, under
 * {@link ScoreMode#BY_FREQUENCY} by their occurrence count. Ranking uses a stable sort, so tied groups
 * keep the order in which they were first seen.</p>
 */
public class TopNClassifier {

    private static final Logger logger = LogManager.getLogger(TopNClassifier.class);

    private final Logger log;

    public TopNClassifier() {
        this(logger);
    }

    TopNClassifier(Logger log) {
        this.log = log;
    }

    /**
     * Classify every known group. Call once, after all candidate groups have been seen.
     *
     * @param limit the limit configuration, null when the query is unlimited
     * @param groupValueCount occurrences per split-by value
     * @param groupScoreMap accumulated score per split-by value, used under sum ranking
     * @return split-by value to true when kept, in first-seen order, or null when unlimited
     */
    @Nullable
    public Map<String, Boolean> classify(
        @Nullable LimitConfig limit,
        @Nullable Map<String, Long> groupValueCount,
        @Nullable Map<String, AggregateValue> groupScoreMap
    ) {
        if (limit == null) {
            return null;
        }

        Map<String, Boolean> valueIsInLimit = new LinkedHashMap<>();
        List<ScoredGroup> ranked = new ArrayList<>();

        if (limit.scoreMode() == ScoreMode.BY_SUM) {
            if (groupScoreMap != null) {
                for (Map.Entry<String, AggregateValue> entry : groupScoreMap.entrySet()) {
                    valueIsInLimit.put(entry.getKey(), false);
                    AggregateValue score = entry.getValue();
                    if (score == null || score.getType().isNumeric() == false) {
                        log.error("Cannot read score of group [{}] as a number", entry.getKey());
                        continue;
                    }
                    ranked.add(new ScoredGroup(entry.getKey(), score.toDouble()));
                }
            }
        } else if (groupValueCount != null) {
            for (Map.Entry<String, Long> entry : groupValueCount.entrySet()) {
                valueIsInLimit.put(entry.getKey(), false);
                ranked.add(new ScoredGroup(entry.getKey(), entry.getValue()));
            }
        }

        Comparator<ScoredGroup> byScore = Comparator.comparingDouble(ScoredGroup::score);
        ranked.sort(limit.isTop() ? byScore.reversed() : byScore);

        int selected = Math.min(limit.count(), ranked.size());
        for (int i = 0; i < selected; i++) {
            valueIsInLimit.put(ranked.get(i).group(), true);
        }

        log.debug("Kept {} of {} groups ranked {} {}", selected, valueIsInLimit.size(), limit.direction(), limit.scoreMode());
        return valueIsInLimit;
    }

    /**
     * Score map to accumulate into before classification.
     *
     * @return one invalid placeholder per known group under sum ranking, null otherwise
     */
    @Nullable
    public static Map<String, AggregateValue> initialScoreMap(@Nullable LimitConfig limit, Map<String, Long> groupValueCount) {
        if (isSumRanked(limit) == false) {
            return null;
        }
        Map<String, AggregateValue> scores = new LinkedHashMap<>();
        for (String group : groupValueCount.keySet()) {
            scores.put(group, AggregateValue.invalid());
        }
        return scores;
    }

    /**
     * A group is demoted only when it was classified and did not make the cut. Unknown groups are kept.
     */
    public static boolean isDemoted(@Nullable Map<String, Boolean> valueIsInLimit, String groupValue) {
        if (valueIsInLimit == null) {
            return false;
        }
        Boolean inLimit = valueIsInLimit.get(groupValue);
        return inLimit != null && inLimit == false;
    }

    public static boolean isSumRanked(@Nullable LimitConfig limit) {
        return limit != null && limit.scoreMode() == ScoreMode.BY_SUM;
    }

    private record ScoredGroup(String group, double score) {
    }
}
