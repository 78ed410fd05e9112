/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import lombok.Getter;

/**
 * Immutable named table exchanged with the storage collaborator: an ordered column list and rows keyed by column.
 * Cells may be null; a row never holds a column the relation does not declare.
 */
@Getter
public class Relation {
    private final String name;
    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    public Relation(String name, List<String> columns, List<Map<String, Object>> rows) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Relation name cannot be blank");
        }
        Set<String> uniqueColumns = new LinkedHashSet<>(columns);
        if (uniqueColumns.size() != columns.size()) {
            throw new IllegalArgumentException("Relation " + name + " declares duplicate columns: " + columns);
        }
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            for (String column : row.keySet()) {
                if (!uniqueColumns.contains(column)) {
                    throw new IllegalArgumentException("Row of relation " + name + " holds undeclared column " + column);
                }
            }
            copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.name = name;
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(copied);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }

    public Relation withName(String newName) {
        return new Relation(newName, columns, rows);
    }
}
