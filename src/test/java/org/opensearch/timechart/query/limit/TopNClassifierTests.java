/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.query.limit;

import org.apache.logging.log4j.Logger;
import org.opensearch.test.OpenSearchTestCase;
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.query.config.LimitConfig;
import org.opensearch.timechart.query.config.LimitDirection;
import org.opensearch.timechart.query.config.ScoreMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for TopNClassifier.
 */
public class TopNClassifierTests extends OpenSearchTestCase {

    private final Logger log = mock(Logger.class);
    private final TopNClassifier classifier = new TopNClassifier(log);

    /**
     * Test that an unlimited query has no classification.
     */
    public void testNoLimit() {
        assertNull(classifier.classify(null, counts("a", 1L), null));
    }

    /**
     * Test ranking by frequency, keeping first-seen order in the result.
     */
    public void testTopByFrequency() {
        LimitConfig limit = new LimitConfig(LimitDirection.TOP, 2, ScoreMode.BY_FREQUENCY);

        Map<String, Boolean> result = classifier.classify(limit, counts("a", 5L, "b", 2L, "c", 8L), null);

        assertEquals(Map.of("a", true, "b", false, "c", true), result);
        assertEquals(List.of("a", "b", "c"), new ArrayList<>(result.keySet()));
    }

    public void testBottomByFrequency() {
        LimitConfig limit = new LimitConfig(LimitDirection.BOTTOM, 1, ScoreMode.BY_FREQUENCY);

        Map<String, Boolean> result = classifier.classify(limit, counts("a", 5L, "b", 2L, "c", 8L), null);

        assertEquals(Map.of("a", false, "b", true, "c", false), result);
    }

    /**
     * Test that a limit larger than the number of groups keeps every group, and a zero limit keeps none.
     */
    public void testLimitBounds() {
        Map<String, Long> counts = counts("a", 5L, "b", 2L);

        Map<String, Boolean> all = classifier.classify(new LimitConfig(LimitDirection.TOP, 10, ScoreMode.BY_FREQUENCY), counts, null);
        Map<String, Boolean> none = classifier.classify(new LimitConfig(LimitDirection.TOP, 0, ScoreMode.BY_FREQUENCY), counts, null);

        assertEquals(Map.of("a", true, "b", true), all);
        assertEquals(Map.of("a", false, "b", false), none);
    }

    /**
     * Test that ties keep the first-seen groups.
     */
    public void testTiesKeepFirstSeen() {
        LimitConfig limit = new LimitConfig(LimitDirection.TOP, 2, ScoreMode.BY_FREQUENCY);

        Map<String, Boolean> result = classifier.classify(limit, counts("x", 3L, "y", 3L, "z", 3L), null);

        assertEquals(Map.of("x", true, "y", true, "z", false), result);
    }

    /**
     * Test that equal sums keep the first-seen groups whichever end is ranked, even across value types.
     */
    public void testSumTiesKeepFirstSeen() {
        Map<String, AggregateValue> scores = new LinkedHashMap<>();
        scores.put("a", AggregateValue.ofSigned(5L));
        scores.put("b", AggregateValue.ofFloat(5.0));
        scores.put("c", AggregateValue.ofUnsigned(5L));
        Map<String, Long> counts = counts("c", 9L, "b", 1L, "a", 4L);

        Map<String, Boolean> top = classifier.classify(new LimitConfig(LimitDirection.TOP, 2, ScoreMode.BY_SUM), counts, scores);
        Map<String, Boolean> bottom = classifier.classify(new LimitConfig(LimitDirection.BOTTOM, 1, ScoreMode.BY_SUM), counts, scores);

        assertEquals(Map.of("a", true, "b", true, "c", false), top);
        assertEquals(Map.of("a", true, "b", false, "c", false), bottom);
        assertEquals(List.of("a", "b", "c"), new ArrayList<>(top.keySet()));
    }

    /**
     * Test ranking by accumulated score across value types.
     */
    public void testTopBySum() {
        LimitConfig limit = new LimitConfig(LimitDirection.TOP, 1, ScoreMode.BY_SUM);
        Map<String, AggregateValue> scores = new LinkedHashMap<>();
        scores.put("a", AggregateValue.ofSigned(10L));
        scores.put("b", AggregateValue.ofFloat(2.5));
        scores.put("c", AggregateValue.ofUnsigned(30L));

        Map<String, Boolean> result = classifier.classify(limit, counts("a", 100L, "b", 100L, "c", 1L), scores);

        assertEquals(Map.of("a", false, "b", false, "c", true), result);
    }

    /**
     * Test that groups whose score cannot be read are logged and excluded from the kept set.
     */
    public void testUnreadableScores() {
        LimitConfig limit = new LimitConfig(LimitDirection.TOP, 2, ScoreMode.BY_SUM);
        Map<String, AggregateValue> scores = new LinkedHashMap<>();
        scores.put("a", AggregateValue.invalid());
        scores.put("b", AggregateValue.ofString("oops"));
        scores.put("c", AggregateValue.ofSigned(1L));

        Map<String, Boolean> result = classifier.classify(limit, counts("a", 1L, "b", 1L, "c", 1L), scores);

        assertEquals(Map.of("a", false, "b", false, "c", true), result);
        verify(log).error(anyString(), eq("a"));
        verify(log).error(anyString(), eq("b"));
        verify(log, never()).error(anyString(), eq("c"));
    }

    /**
     * Test that exactly min(count, groups) groups are kept and that the result does not depend on the run.
     */
    public void testSelectedCountAndDeterminism() {
        int groups = randomIntBetween(1, 50);
        int count = randomIntBetween(0, 60);
        Map<String, Long> counts = new LinkedHashMap<>();
        for (int i = 0; i < groups; i++) {
            counts.put("g" + i, randomLongBetween(0L, 20L));
        }
        LimitConfig limit = new LimitConfig(randomFrom(LimitDirection.values()), count, ScoreMode.BY_FREQUENCY);

        Map<String, Boolean> first = classifier.classify(limit, counts, null);
        Map<String, Boolean> second = classifier.classify(limit, counts, null);

        assertEquals(first, second);
        assertEquals(groups, first.size());
        assertEquals(Math.min(count, groups), Collections.frequency(first.values(), true));
    }

    /**
     * Test that without ties the top k groups are exactly the groups left out of the bottom n - k.
     */
    public void testTopBottomSymmetry() {
        int groups = randomIntBetween(2, 30);
        int k = randomIntBetween(0, groups);
        List<Long> distinctCounts = new ArrayList<>();
        for (long i = 0; i < groups; i++) {
            distinctCounts.add(i * 3 + 1);
        }
        Collections.shuffle(distinctCounts, random());
        Map<String, Long> counts = new LinkedHashMap<>();
        for (int i = 0; i < groups; i++) {
            counts.put("g" + i, distinctCounts.get(i));
        }

        Map<String, Boolean> top = classifier.classify(new LimitConfig(LimitDirection.TOP, k, ScoreMode.BY_FREQUENCY), counts, null);
        Map<String, Boolean> bottom = classifier.classify(
            new LimitConfig(LimitDirection.BOTTOM, groups - k, ScoreMode.BY_FREQUENCY),
            counts,
            null
        );

        Set<String> keptTop = new HashSet<>();
        Set<String> demotedBottom = new HashSet<>();
        for (String group : counts.keySet()) {
            if (top.get(group)) {
                keptTop.add(group);
            }
            if (bottom.get(group) == false) {
                demotedBottom.add(group);
            }
        }
        assertEquals(keptTop, demotedBottom);
    }

    public void testInitialScoreMap() {
        Map<String, Long> counts = counts("a", 1L, "b", 2L);

        Map<String, AggregateValue> scores = TopNClassifier.initialScoreMap(new LimitConfig(LimitDirection.TOP, 1, ScoreMode.BY_SUM), counts);

        assertEquals(List.of("a", "b"), new ArrayList<>(scores.keySet()));
        assertFalse(scores.get("a").isValid());
        assertNull(TopNClassifier.initialScoreMap(new LimitConfig(LimitDirection.TOP, 1, ScoreMode.BY_FREQUENCY), counts));
        assertNull(TopNClassifier.initialScoreMap(null, counts));
    }

    public void testIsDemoted() {
        Map<String, Boolean> classification = Map.of("a", true, "b", false);

        assertFalse(TopNClassifier.isDemoted(classification, "a"));
        assertTrue(TopNClassifier.isDemoted(classification, "b"));
        assertFalse(TopNClassifier.isDemoted(classification, "unknown"));
        assertFalse(TopNClassifier.isDemoted(null, "b"));
    }

    public void testIsSumRanked() {
        assertTrue(TopNClassifier.isSumRanked(new LimitConfig(LimitDirection.BOTTOM, 3, ScoreMode.BY_SUM)));
        assertFalse(TopNClassifier.isSumRanked(new LimitConfig(LimitDirection.TOP, 3, ScoreMode.BY_FREQUENCY)));
        assertFalse(TopNClassifier.isSumRanked(null));
    }

    private static Map<String, Long> counts(Object... groupsAndCounts) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (int i = 0; i < groupsAndCounts.length; i += 2) {
            counts.put((String) groupsAndCounts[i], (Long) groupsAndCounts[i + 1]);
        }
        return counts;
    }
}
