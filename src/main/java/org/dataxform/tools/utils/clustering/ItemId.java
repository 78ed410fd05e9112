/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import java.util.Objects;

/**
 * Opaque identifier of one clustered entity, either an integer or a string.
 * Numeric ids order numerically, string ids lexicographically. A single distance set never mixes the two kinds.
 */
public final class ItemId implements Comparable<ItemId> {

    private final Long number;
    private final String text;

    private ItemId(Long number, String text) {
        this.number = number;
        this.text = text;
    }

    public static ItemId of(long number) {
        return new ItemId(number, null);
    }

    public static ItemId of(String text) {
        if (text == null) {
            throw new MalformedInputException("Item id cannot be null");
        }
        return new ItemId(null, text);
    }

    /**
     * Converts a relation cell into an item id. Integral numbers become numeric ids, strings stay strings.
     *
     * @param value raw cell value
     * @return the item id
     * @throws MalformedInputException if the value is null, fractional or of an unsupported type
     */
    public static ItemId fromValue(Object value) {
        if (value instanceof ItemId) {
            return (ItemId) value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p53) {
                return of((long) d);
            }
            throw new MalformedInputException("Item id must be an integer or a string, got " + value);
        }
        if (value instanceof String) {
            return of((String) value);
        }
        throw new MalformedInputException("Item id must be an integer or a string, got " + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    public boolean isNumeric() {
        return number != null;
    }

    /**
     * @return the id as it is written back to a relation, a {@link Long} or a {@link String}
     */
    public Object toValue() {
        return isNumeric() ? number : text;
    }

    @Override
    public int compareTo(ItemId other) {
        if (isNumeric() && other.isNumeric()) {
            return Long.compare(number, other.number);
        }
        if (!isNumeric() && !other.isNumeric()) {
            return text.compareTo(other.text);
        }
        return isNumeric() ? -1 : 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ItemId)) {
            return false;
        }
        ItemId other = (ItemId) o;
        return Objects.equals(number, other.number) && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, text);
    }

    @Override
    public String toString() {
        return String.valueOf(toValue());
    }
}
