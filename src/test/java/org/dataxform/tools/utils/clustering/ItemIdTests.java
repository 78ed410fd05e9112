/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class ItemIdTests {

    @Test
    public void testFromValueNumbers() {
        assertEquals(ItemId.of(7), ItemId.fromValue(7));
        assertEquals(ItemId.of(7), ItemId.fromValue(7L));
        assertEquals(ItemId.of(7), ItemId.fromValue(7.0));
        assertEquals(Long.valueOf(7), ItemId.fromValue(7.0).toValue());
        assertTrue(ItemId.fromValue((short) 3).isNumeric());
    }

    @Test
    public void testFromValueStrings() {
        ItemId id = ItemId.fromValue("7");
        assertFalse(id.isNumeric());
        assertEquals("7", id.toValue());
        assertNotEquals(ItemId.of(7), id);
    }

    @Test
    public void testFromValuePassesItemIdsThrough() {
        ItemId id = ItemId.of("page");
        assertSame(id, ItemId.fromValue(id));
    }

    @Test
    public void testFromValueRejectsUnsupportedValues() {
        assertThrows(MalformedInputException.class, () -> ItemId.fromValue(null));
        assertThrows(MalformedInputException.class, () -> ItemId.fromValue(1.5));
        assertThrows(MalformedInputException.class, () -> ItemId.fromValue(Double.NaN));
        assertThrows(MalformedInputException.class, () -> ItemId.fromValue(new BigDecimal("2.5")));
        assertThrows(MalformedInputException.class, () -> ItemId.fromValue(List.of(1)));
        assertThrows(MalformedInputException.class, () -> ItemId.of((String) null));
    }

    @Test
    public void testOrdering() {
        List<ItemId> ids = new ArrayList<>(List.of(ItemId.of("b"), ItemId.of(10), ItemId.of("a"), ItemId.of(2)));
        Collections.sort(ids);
        assertEquals(List.of(ItemId.of(2), ItemId.of(10), ItemId.of("a"), ItemId.of("b")), ids);
    }

    @Test
    public void testEqualsAndHashCode() {
        assertEquals(ItemId.of(5), ItemId.of(5));
        assertEquals(ItemId.of(5).hashCode(), ItemId.of(5).hashCode());
        assertEquals(ItemId.of("x"), ItemId.of("x"));
        assertEquals("5", ItemId.of(5).toString());
    }
}
