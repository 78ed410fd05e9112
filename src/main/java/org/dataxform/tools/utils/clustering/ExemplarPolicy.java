/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import java.util.Locale;

/**
 * Rule choosing the representative member of a flat cluster.
 */
public enum ExemplarPolicy {
    /** The member with the smallest item id. */
    MIN_ID,
    /** The member with the smallest total distance to the other members, ties to the smaller item id. */
    MEDOID;

    public static ExemplarPolicy from(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown exemplar policy '" + value + "', expected one of min_id, medoid");
        }
    }

    /**
     * @param leaves member leaf ranks in ascending order
     * @param distances distances over the same universe, required by {@link #MEDOID}
     * @return the rank of the exemplar
     */
    int select(int[] leaves, DistanceSet distances) {
        if (this == MIN_ID || leaves.length <= 2) {
            return leaves[0];
        }
        if (distances == null) {
            throw new IllegalArgumentException("Medoid exemplars need the distance set");
        }
        int medoid = leaves[0];
        double minTotalDistance = Double.POSITIVE_INFINITY;
        for (int pointI : leaves) {
            double totalDistance = 0.0;
            for (int pointJ : leaves) {
                if (pointI != pointJ) {
                    totalDistance += distances.distance(pointI, pointJ);
                }
            }
            // ascending scan with a strict comparison keeps the smaller id on ties
            if (totalDistance < minTotalDistance) {
                minTotalDistance = totalDistance;
                medoid = pointI;
            }
        }
        return medoid;
    }
}
