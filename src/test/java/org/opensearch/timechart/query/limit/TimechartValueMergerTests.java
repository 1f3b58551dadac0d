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
import org.opensearch.timechart.core.model.AggregateFunction;
import org.opensearch.timechart.core.model.AggregateValue;
import org.opensearch.timechart.core.sketch.HllCardinalitySketch;
import org.opensearch.timechart.query.utils.DefaultScalarReducer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests for TimechartValueMerger.
 */
public class TimechartValueMergerTests extends OpenSearchTestCase {

    private final Logger log = mock(Logger.class);
    private final TimechartValueMerger merger = new TimechartValueMerger(DefaultScalarReducer.INSTANCE, log);

    /**
     * Test that every sum-like function merges its partials by addition.
     */
    public void testSumLikeFunctionsAdd() {
        for (AggregateFunction function : new AggregateFunction[] {
            AggregateFunction.COUNT,
            AggregateFunction.SUM,
            AggregateFunction.AVG,
            AggregateFunction.MIN,
            AggregateFunction.MAX,
            AggregateFunction.RANGE }) {
            AggregateValue merged = merger.mergeScalar(AggregateValue.ofSigned(3L), AggregateValue.ofSigned(4L), null, null, function, true);
            assertEquals(function.name(), AggregateValue.ofSigned(7L), merged);
        }
        verifyNoInteractions(log);
    }

    /**
     * Test that merging into an empty accumulator yields the incoming value.
     */
    public void testMergeIntoInvalid() {
        AggregateValue merged = merger.mergeScalar(AggregateValue.invalid(), AggregateValue.ofFloat(1.5), null, null, AggregateFunction.SUM, false);

        assertEquals(AggregateValue.ofFloat(1.5), merged);
    }

    public void testValuesUnion() {
        AggregateValue merged = merger.mergeScalar(
            AggregateValue.ofStrings(List.of("a", "c")),
            AggregateValue.ofStrings(List.of("b", "c")),
            null,
            null,
            AggregateFunction.VALUES,
            true
        );

        assertEquals(AggregateValue.ofStrings(List.of("a", "b", "c")), merged);
    }

    /**
     * Test that a failed merge is logged and leaves the accumulator unchanged.
     */
    public void testTypeMismatchKeepsTarget() {
        AggregateValue target = AggregateValue.ofSigned(1L);

        AggregateValue merged = merger.mergeScalar(target, AggregateValue.ofString("x"), null, null, AggregateFunction.SUM, true);

        assertSame(target, merged);
        verify(log).error(anyString(), eq(AggregateFunction.SUM), anyString());
    }

    public void testCardinalityByAddition() {
        AggregateValue merged = merger.mergeScalar(
            AggregateValue.ofUnsigned(3L),
            AggregateValue.ofUnsigned(4L),
            null,
            null,
            AggregateFunction.CARDINALITY,
            true
        );

        assertEquals(AggregateValue.ofUnsigned(7L), merged);
        verifyNoInteractions(log);
    }

    /**
     * Test that overlapping distinct counts merged by union are not double counted.
     */
    public void testCardinalityByUnion() {
        try (HllCardinalitySketch sketch = sketchOf(0, 100); HllCardinalitySketch incoming = sketchOf(50, 150)) {
            AggregateValue merged = merger.mergeScalar(
                AggregateValue.ofUnsigned(sketch.estimate()),
                AggregateValue.ofUnsigned(incoming.estimate()),
                sketch,
                incoming,
                AggregateFunction.CARDINALITY,
                false
            );

            assertEquals(AggregateValue.ofUnsigned(sketch.estimate()), merged);
            assertTrue("union estimate " + merged, Math.abs(merged.longValue() - 150) <= 8);
        }
    }

    /**
     * Test that merging by addition still folds the incoming sketch in, so a later union sees its values.
     */
    public void testAdditionKeepsSketchInStep() {
        try (HllCardinalitySketch sketch = new HllCardinalitySketch(14); HllCardinalitySketch incoming = sketchOf(0, 40)) {
            AggregateValue merged = merger.mergeScalar(
                AggregateValue.ofUnsigned(2L),
                AggregateValue.ofUnsigned(incoming.estimate()),
                sketch,
                incoming,
                AggregateFunction.CARDINALITY,
                true
            );

            assertEquals(AggregateValue.ofUnsigned(2L + incoming.estimate()), merged);
            assertEquals(incoming.estimate(), sketch.estimate());
        }
    }

    /**
     * Test that a union without sketches warns and falls back to addition.
     */
    public void testUnionWithoutSketchFallsBackToAddition() {
        try (HllCardinalitySketch sketch = sketchOf(0, 10)) {
            AggregateValue merged = merger.mergeScalar(
                AggregateValue.ofUnsigned(10L),
                AggregateValue.ofUnsigned(5L),
                sketch,
                null,
                AggregateFunction.CARDINALITY,
                false
            );

            assertEquals(AggregateValue.ofUnsigned(15L), merged);
            verify(log).warn(anyString());
        }
    }

    public void testIncompatibleSketchesKeepTarget() {
        try (HllCardinalitySketch sketch = new HllCardinalitySketch(14); HllCardinalitySketch incoming = new HllCardinalitySketch(12)) {
            AggregateValue target = AggregateValue.ofUnsigned(4L);

            AggregateValue merged = merger.mergeScalar(target, AggregateValue.ofUnsigned(2L), sketch, incoming, AggregateFunction.CARDINALITY, false);

            assertSame(target, merged);
            verify(log).error(anyString(), anyString());
        }
    }

    /**
     * Test that partials of the same series keep their function's semantics.
     */
    public void testMergePartial() {
        assertEquals(
            AggregateValue.ofSigned(2L),
            merger.mergePartial(AggregateValue.ofSigned(5L), AggregateValue.ofSigned(2L), null, null, AggregateFunction.MIN)
        );
        assertEquals(
            AggregateValue.ofSigned(5L),
            merger.mergePartial(AggregateValue.ofSigned(5L), AggregateValue.ofSigned(2L), null, null, AggregateFunction.MAX)
        );
        assertEquals(
            AggregateValue.ofUnsigned(7L),
            merger.mergePartial(AggregateValue.ofUnsigned(5L), AggregateValue.ofUnsigned(2L), null, null, AggregateFunction.COUNT)
        );
        assertEquals(
            AggregateValue.ofUnsigned(9L),
            merger.mergePartial(AggregateValue.ofUnsigned(4L), AggregateValue.ofUnsigned(5L), null, null, AggregateFunction.CARDINALITY)
        );
        verifyNoInteractions(log);
    }

    /**
     * Test that partial averages and ranges of one series are added rather than rejected.
     */
    public void testMergePartialAvgAndRangeAdd() {
        assertEquals(
            AggregateValue.ofSigned(12L),
            merger.mergePartial(AggregateValue.ofSigned(5L), AggregateValue.ofSigned(7L), null, null, AggregateFunction.RANGE)
        );
        assertEquals(
            AggregateValue.ofFloat(4.0),
            merger.mergePartial(AggregateValue.ofFloat(1.5), AggregateValue.ofFloat(2.5), null, null, AggregateFunction.AVG)
        );
        verifyNoInteractions(log);
    }

    public void testMergePartialCardinalityUnion() {
        try (HllCardinalitySketch sketch = new HllCardinalitySketch(14); HllCardinalitySketch incoming = sketchOf(0, 30)) {
            AggregateValue first = merger.mergePartial(
                AggregateValue.invalid(),
                AggregateValue.ofUnsigned(incoming.estimate()),
                sketch,
                incoming,
                AggregateFunction.CARDINALITY
            );
            AggregateValue second = merger.mergePartial(
                first,
                AggregateValue.ofUnsigned(incoming.estimate()),
                sketch,
                incoming,
                AggregateFunction.CARDINALITY
            );

            assertEquals(AggregateValue.ofUnsigned(incoming.estimate()), first);
            assertEquals("merging the same values twice does not double count", first, second);
        }
    }

    public void testMergeCountMaps() {
        Map<String, Long> target = new LinkedHashMap<>(Map.of("a", 2L));
        Map<String, Long> incoming = new LinkedHashMap<>();
        incoming.put("b", 1L);
        incoming.put("a", 3L);
        incoming.put("c", 4L);

        TimechartValueMerger.mergeCountMaps(target, incoming);

        assertEquals(List.of("a", "b", "c"), new ArrayList<>(target.keySet()));
        assertEquals(Long.valueOf(5L), target.get("a"));
        assertEquals(Long.valueOf(1L), target.get("b"));
        assertEquals(Long.valueOf(4L), target.get("c"));

        TimechartValueMerger.mergeCountMaps(target, incoming);
        assertEquals("merging twice counts twice", Long.valueOf(8L), target.get("a"));
    }

    /**
     * Test that merging count maps in either order gives the same counts.
     */
    public void testMergeCountMapsCommutative() {
        Map<String, Long> first = randomCounts();
        Map<String, Long> second = randomCounts();

        Map<String, Long> forward = new LinkedHashMap<>(first);
        TimechartValueMerger.mergeCountMaps(forward, second);
        Map<String, Long> backward = new LinkedHashMap<>(second);
        TimechartValueMerger.mergeCountMaps(backward, first);

        assertEquals(forward, backward);
    }

    private Map<String, Long> randomCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        int size = randomIntBetween(0, 10);
        for (int i = 0; i < size; i++) {
            counts.put(randomFrom("a", "b", "c", "d", "e"), randomLongBetween(1L, 100L));
        }
        return counts;
    }

    private static HllCardinalitySketch sketchOf(int from, int to) {
        HllCardinalitySketch sketch = new HllCardinalitySketch(14);
        for (int i = from; i < to; i++) {
            sketch.offer("value-" + i);
        }
        return sketch;
    }
}
