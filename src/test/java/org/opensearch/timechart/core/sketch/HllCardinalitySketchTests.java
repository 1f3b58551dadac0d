/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.timechart.core.sketch;

import org.opensearch.test.OpenSearchTestCase;

import static org.mockito.Mockito.mock;

/**
 * Unit tests for HllCardinalitySketch.
 */
public class HllCardinalitySketchTests extends OpenSearchTestCase {

    public void testEmptySketch() {
        try (HllCardinalitySketch sketch = new HllCardinalitySketch(14)) {
            assertEquals(0L, sketch.estimate());
            assertEquals(14, sketch.getPrecision());
        }
    }

    /**
     * Test that repeated values are counted once.
     */
    public void testDuplicatesCountedOnce() {
        try (HllCardinalitySketch sketch = new HllCardinalitySketch(14)) {
            for (int repeat = 0; repeat < 3; repeat++) {
                for (int i = 0; i < 100; i++) {
                    sketch.offer("host-" + i);
                }
            }
            assertEstimate(100, sketch.estimate());
        }
    }

    /**
     * Test that merging overlapping sketches estimates the size of the union, not the sum of estimates.
     */
    public void testMergeIsUnion() {
        try (
            HllCardinalitySketch first = new HllCardinalitySketch(14);
            HllCardinalitySketch second = new HllCardinalitySketch(14);
            HllCardinalitySketch combined = new HllCardinalitySketch(14)
        ) {
            for (int i = 0; i < 1000; i++) {
                first.offer("user-" + i);
                combined.offer("user-" + i);
            }
            for (int i = 500; i < 1500; i++) {
                second.offer("user-" + i);
                combined.offer("user-" + i);
            }
            long secondEstimate = second.estimate();

            first.merge(second);

            assertEstimate(1500, first.estimate());
            assertEquals(combined.estimate(), first.estimate());
            assertEquals("merge leaves the other sketch unchanged", secondEstimate, second.estimate());
        }
    }

    public void testMergeDifferentPrecision() {
        try (HllCardinalitySketch first = new HllCardinalitySketch(14); HllCardinalitySketch second = new HllCardinalitySketch(10)) {
            IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> first.merge(second));
            assertTrue(e.getMessage().contains("different precisions"));
        }
    }

    public void testMergeOtherImplementation() {
        try (HllCardinalitySketch sketch = new HllCardinalitySketch(14)) {
            CardinalitySketch other = mock(CardinalitySketch.class);
            expectThrows(IllegalArgumentException.class, () -> sketch.merge(other));
        }
    }

    private static void assertEstimate(long expected, long actual) {
        assertTrue("estimate " + actual + " too far from " + expected, Math.abs(actual - expected) <= expected * 0.05);
    }
}
