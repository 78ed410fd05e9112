/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.storage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class RelationTests {

    @Test
    public void testRowsAreCopiedAndReadOnly() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", 1);
        row.put("email", null);
        List<Map<String, Object>> rows = new ArrayList<>(List.of(row));
        Relation relation = new Relation("people", List.of("id", "email"), rows);

        row.put("id", 2);
        rows.clear();
        assertEquals(1, relation.size());
        assertEquals(1, relation.getRows().get(0).get("id"));
        assertNull(relation.getRows().get(0).get("email"));
        assertThrows(UnsupportedOperationException.class, () -> relation.getRows().get(0).put("id", 3));
        assertThrows(UnsupportedOperationException.class, () -> relation.getRows().clear());
    }

    @Test
    public void testColumns() {
        Relation relation = new Relation("people", List.of("id", "email"), List.of());

        assertTrue(relation.hasColumn("email"));
        assertFalse(relation.hasColumn("phone"));
        assertEquals(List.of("id", "email"), relation.getColumns());
    }

    @Test
    public void testInvalidRelations() {
        assertThrows(IllegalArgumentException.class, () -> new Relation(" ", List.of("id"), List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Relation("people", List.of("id", "id"), List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Relation("people", List.of("id"), List.of(Map.of("phone", "555"))));
    }

    @Test
    public void testWithName() {
        Relation relation = new Relation("people", List.of("id"), List.of(Map.of("id", 1)));
        Relation renamed = relation.withName("persons");

        assertEquals("persons", renamed.getName());
        assertEquals(relation.getRows(), renamed.getRows());
        assertEquals("people", relation.getName());
    }
}
