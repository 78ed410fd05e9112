/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.anonymization;

import static org.dataxform.tools.utils.ToolConstants.ORIGINAL_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.PSEUDONYM_COLUMN;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;

/**
 * One-to-one mapping between original values and their pseudonyms, in both directions.
 * Rows keep the order in which the pairs were added. Integral numbers are keyed as {@code Long}, so a value read
 * as an {@code Integer} in one relation and as a {@code Long} or a whole {@code Double} in another shares one
 * pseudonym.
 */
public class PseudonymMapping {

    private final BiMap<Object, String> pseudonyms = HashBiMap.create();
    private final List<Object> insertionOrder = new ArrayList<>();

    /**
     * Rebuild a mapping from the rows of a mapping relation.
     *
     * @throws IllegalArgumentException if a row is incomplete or an original or a pseudonym appears twice
     */
    public static PseudonymMapping fromRows(List<Map<String, Object>> rows) {
        PseudonymMapping mapping = new PseudonymMapping();
        for (Map<String, Object> row : rows) {
            Object original = row.get(ORIGINAL_COLUMN);
            Object pseudonym = row.get(PSEUDONYM_COLUMN);
            if (original == null || !(pseudonym instanceof String)) {
                throw new IllegalArgumentException("Mapping row must hold an original value and a string pseudonym, got " + row);
            }
            mapping.put(normalize(original), (String) pseudonym);
        }
        return mapping;
    }

    private void put(Object original, String pseudonym) {
        if (pseudonyms.containsKey(original)) {
            throw new IllegalArgumentException("Original value " + original + " is mapped twice");
        }
        if (pseudonyms.containsValue(pseudonym)) {
            throw new IllegalArgumentException("Pseudonym " + pseudonym + " is mapped twice");
        }
        pseudonyms.put(original, pseudonym);
        insertionOrder.add(original);
    }

    /**
     * Return the pseudonym of a value, generating and recording one if the value is new.
     */
    public String pseudonymize(Object value, PseudonymGenerator generator) {
        Object original = normalize(value);
        String existing = pseudonyms.get(original);
        if (existing != null) {
            return existing;
        }
        String pseudonym = generator.generate(original, pseudonyms::containsValue);
        put(original, pseudonym);
        return pseudonym;
    }

    public Optional<Object> original(String pseudonym) {
        return Optional.ofNullable(pseudonyms.inverse().get(pseudonym));
    }

    public Optional<String> pseudonym(Object original) {
        return Optional.ofNullable(pseudonyms.get(normalize(original)));
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p53) {
                return (long) d;
            }
        }
        return value;
    }

    public int size() {
        return pseudonyms.size();
    }

    public List<Map<String, Object>> toRows() {
        List<Map<String, Object>> rows = new ArrayList<>(insertionOrder.size());
        for (Object original : insertionOrder) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ORIGINAL_COLUMN, original);
            row.put(PSEUDONYM_COLUMN, pseudonyms.get(original));
            rows.add(row);
        }
        return rows;
    }
}
