/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class DendrogramTests {

    private static final List<ItemId> ITEMS = List.of(ItemId.of(1), ItemId.of(2), ItemId.of(3), ItemId.of(4));

    private static Dendrogram sample() {
        return Dendrogram
            .of(ITEMS, List.of(new MergeEvent(4, 0, 1, 0.0, 2), new MergeEvent(5, 4, 2, 2.0, 3), new MergeEvent(6, 5, 3, 5.0, 4)));
    }

    @Test
    public void testAccessors() {
        Dendrogram dendrogram = sample();

        assertEquals(4, dendrogram.getLeafCount());
        assertFalse(dendrogram.isTrivial());
        assertEquals(6, dendrogram.getRoot());
        assertEquals(5.0, dendrogram.getRootHeight(), 0.0);
        assertTrue(dendrogram.isLeaf(3));
        assertFalse(dendrogram.isLeaf(4));
        assertEquals(0.0, dendrogram.getHeight(2), 0.0);
        assertEquals(2.0, dendrogram.getHeight(5), 0.0);
        assertEquals(3, dendrogram.getSize(5));
        assertEquals(1, dendrogram.getSize(0));
        assertEquals(new MergeEvent(5, 4, 2, 2.0, 3), dendrogram.getMerge(5));
    }

    @Test
    public void testMembers() {
        Dendrogram dendrogram = sample();

        assertArrayEquals(new int[] { 0, 1, 2 }, dendrogram.getLeaves(5));
        assertArrayEquals(new int[] { 3 }, dendrogram.getLeaves(3));
        assertEquals(ITEMS, dendrogram.getMembers(6));
    }

    @Test
    public void testSingleItemIsTrivial() {
        Dendrogram dendrogram = Dendrogram.of(List.of(ItemId.of("only")), List.of());

        assertTrue(dendrogram.isTrivial());
        assertEquals(0, dendrogram.getRoot());
        assertEquals(0.0, dendrogram.getRootHeight(), 0.0);
        assertEquals(List.of(ItemId.of("only")), dendrogram.getMembers(0));
    }

    @Test
    public void testNoItemsIsDegenerate() {
        assertThrows(DegenerateInputException.class, () -> Dendrogram.of(List.of(), List.of()));
    }

    @Test
    public void testWrongMergeCount() {
        MalformedInputException e = assertThrows(
            MalformedInputException.class,
            () -> Dendrogram.of(ITEMS, List.of(new MergeEvent(4, 0, 1, 0.0, 2)))
        );
        assertThat(e.getMessage(), containsString("needs 3 merges"));
    }

    @Test
    public void testNodeMergedTwice() {
        assertThrows(
            MalformedInputException.class,
            () -> Dendrogram
                .of(
                    ITEMS,
                    List.of(new MergeEvent(4, 0, 1, 1.0, 2), new MergeEvent(5, 0, 2, 2.0, 2), new MergeEvent(6, 5, 3, 3.0, 3))
                )
        );
    }

    @Test
    public void testForwardReference() {
        assertThrows(
            MalformedInputException.class,
            () -> Dendrogram
                .of(
                    ITEMS,
                    List.of(new MergeEvent(4, 0, 5, 1.0, 2), new MergeEvent(5, 1, 2, 2.0, 2), new MergeEvent(6, 4, 3, 3.0, 4))
                )
        );
    }

    @Test
    public void testSelfMerge() {
        assertThrows(MalformedInputException.class, () -> Dendrogram.of(ITEMS.subList(0, 2), List.of(new MergeEvent(2, 1, 1, 1.0, 2))));
    }

    @Test
    public void testWrongSize() {
        assertThrows(MalformedInputException.class, () -> Dendrogram.of(ITEMS.subList(0, 2), List.of(new MergeEvent(2, 0, 1, 1.0, 3))));
    }

    @Test
    public void testWrongNodeId() {
        assertThrows(MalformedInputException.class, () -> Dendrogram.of(ITEMS.subList(0, 2), List.of(new MergeEvent(3, 0, 1, 1.0, 2))));
    }

    @Test
    public void testHeightBelowChild() {
        MalformedInputException e = assertThrows(
            MalformedInputException.class,
            () -> Dendrogram
                .of(
                    ITEMS,
                    List.of(new MergeEvent(4, 0, 1, 3.0, 2), new MergeEvent(5, 4, 2, 2.0, 3), new MergeEvent(6, 5, 3, 5.0, 4))
                )
        );
        assertThat(e.getMessage(), containsString("below one of its children"));
    }

    @Test
    public void testInvalidHeight() {
        assertThrows(
            MalformedInputException.class,
            () -> Dendrogram.of(ITEMS.subList(0, 2), List.of(new MergeEvent(2, 0, 1, Double.NaN, 2)))
        );
        assertThrows(MalformedInputException.class, () -> Dendrogram.of(ITEMS.subList(0, 2), List.of(new MergeEvent(2, 0, 1, -1.0, 2))));
    }

    @Test
    public void testUnknownNode() {
        Dendrogram dendrogram = sample();
        assertThrows(IllegalArgumentException.class, () -> dendrogram.isLeaf(7));
        assertThrows(IllegalArgumentException.class, () -> dendrogram.getMerge(1));
    }
}
