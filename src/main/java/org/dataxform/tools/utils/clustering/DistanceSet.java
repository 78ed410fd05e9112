/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable pairwise distance relation over a universe of items.
 *
 * Items are kept in ascending order and addressed by their rank in that order. Distances live in a
 * condensed upper-triangular array; a pair without a record holds {@link Double#NaN}, meaning undefined.
 *
 * Usage:
 * DistanceSet distances = DistanceSet.builder().add(ItemId.of(1), ItemId.of(2), 0.5).build();
 */
public final class DistanceSet {

    /** Largest universe whose condensed matrix still fits in a Java array. */
    public static final int MAX_ITEMS = 65_536;

    private final List<ItemId> items;
    private final Map<ItemId, Integer> ranks;
    private final double[] condensed;
    private final int pairCount;

    private DistanceSet(List<ItemId> items, Map<ItemId, Integer> ranks, double[] condensed, int pairCount) {
        this.items = items;
        this.ranks = ranks;
        this.condensed = condensed;
        this.pairCount = pairCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return number of items in the universe
     */
    public int size() {
        return items.size();
    }

    /**
     * @return number of distance records
     */
    public int getPairCount() {
        return pairCount;
    }

    /**
     * @return all items in ascending order
     */
    public List<ItemId> getItems() {
        return items;
    }

    public ItemId getItem(int rank) {
        return items.get(rank);
    }

    /**
     * @param item an item id
     * @return rank of the item, or -1 when it is not part of the universe
     */
    public int rankOf(ItemId item) {
        Integer rank = ranks.get(item);
        return rank == null ? -1 : rank;
    }

    /**
     * Distance between two items addressed by rank.
     *
     * @return the distance, 0 for i == j, or NaN when no record exists for the pair
     */
    public double distance(int i, int j) {
        if (i == j) {
            return 0.0;
        }
        return condensed[condensedIndex(items.size(), Math.min(i, j), Math.max(i, j))];
    }

    public double distance(ItemId a, ItemId b) {
        int i = rankOf(a);
        int j = rankOf(b);
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("Unknown item: " + (i < 0 ? a : b));
        }
        return distance(i, j);
    }

    public boolean hasDistance(int i, int j) {
        return !Double.isNaN(distance(i, j));
    }

    /**
     * @return a private copy of the condensed matrix for builders that update it in place
     */
    double[] condensedCopy() {
        return Arrays.copyOf(condensed, condensed.length);
    }

    /**
     * Position of pair (i, j), i &lt; j, in a condensed upper-triangular matrix over n items.
     */
    static int condensedIndex(int n, int i, int j) {
        return (int) ((long) n * i - ((long) i * (i + 1)) / 2 + (j - i - 1));
    }

    /**
     * Collects distance records. Duplicate records for the same unordered pair are rejected, whatever their value.
     */
    public static final class Builder {
        private final Set<ItemId> declaredItems = new LinkedHashSet<>();
        private final List<ItemId> firsts = new ArrayList<>();
        private final List<ItemId> seconds = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();
        private Boolean numeric;

        private Builder() {}

        /**
         * Adds one distance record.
         *
         * @throws MalformedInputException on a self pair, a negative or non-finite distance, or a mixed item type
         */
        public Builder add(ItemId a, ItemId b, double distance) {
            checkType(a);
            checkType(b);
            if (a.equals(b)) {
                throw new MalformedInputException("Distance record must join two distinct items, got (" + a + ", " + b + ")");
            }
            if (Double.isNaN(distance) || Double.isInfinite(distance) || distance < 0) {
                throw new MalformedInputException("Distance between " + a + " and " + b + " must be finite and non-negative, got " + distance);
            }
            declaredItems.add(a);
            declaredItems.add(b);
            firsts.add(a);
            seconds.add(b);
            values.add(distance);
            return this;
        }

        /**
         * Declares an item that may have no distance record at all.
         */
        public Builder addItem(ItemId item) {
            checkType(item);
            declaredItems.add(item);
            return this;
        }

        private void checkType(ItemId item) {
            if (item == null) {
                throw new MalformedInputException("Item id cannot be null");
            }
            if (numeric == null) {
                numeric = item.isNumeric();
            } else if (numeric != item.isNumeric()) {
                throw new MalformedInputException("Item ids must all be integers or all be strings, got " + item);
            }
        }

        public DistanceSet build() {
            if (declaredItems.size() > MAX_ITEMS) {
                throw new MalformedInputException("Distance set references " + declaredItems.size() + " items, at most " + MAX_ITEMS + " supported");
            }
            List<ItemId> sorted = new ArrayList<>(declaredItems);
            Collections.sort(sorted);
            Map<ItemId, Integer> ranks = new HashMap<>(sorted.size() * 2);
            for (int i = 0; i < sorted.size(); i++) {
                ranks.put(sorted.get(i), i);
            }

            int n = sorted.size();
            double[] condensed = new double[(int) ((long) n * (n - 1) / 2)];
            Arrays.fill(condensed, Double.NaN);
            for (int r = 0; r < values.size(); r++) {
                int i = ranks.get(firsts.get(r));
                int j = ranks.get(seconds.get(r));
                int index = condensedIndex(n, Math.min(i, j), Math.max(i, j));
                if (!Double.isNaN(condensed[index])) {
                    throw new MalformedInputException("Duplicate distance record for pair (" + firsts.get(r) + ", " + seconds.get(r) + ")");
                }
                condensed[index] = values.get(r);
            }
            return new DistanceSet(Collections.unmodifiableList(sorted), ranks, condensed, values.size());
        }
    }
}
