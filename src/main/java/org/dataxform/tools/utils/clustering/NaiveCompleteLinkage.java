/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Reference complete-linkage clustering that recomputes every cluster distance from the raw item distances before
 * each merge. Quadratic in memory like {@link CompleteLinkageClustering} but far slower; it exists to check the
 * incremental builder and should only be used on small inputs.
 */
@Log4j2
public class NaiveCompleteLinkage implements DendrogramBuilder {

    /**
     * Internal cluster node for tracking during clustering process
     */
    private static final class ClusterNode {
        final int id;
        final List<Integer> samples;

        ClusterNode(int id, int sample) {
            this.id = id;
            this.samples = new ArrayList<>();
            this.samples.add(sample);
        }

        ClusterNode(int id, ClusterNode left, ClusterNode right) {
            this.id = id;
            this.samples = new ArrayList<>(left.samples.size() + right.samples.size());
            this.samples.addAll(left.samples);
            this.samples.addAll(right.samples);
        }

        int minSample() {
            int min = Integer.MAX_VALUE;
            for (int sample : samples) {
                min = Math.min(min, sample);
            }
            return min;
        }
    }

    @Override
    public Dendrogram build(DistanceSet distances) {
        int n = distances.size();
        if (n == 0) {
            throw new DegenerateInputException("Distance set references no items");
        }
        List<ClusterNode> activeClusters = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            activeClusters.add(new ClusterNode(i, i));
        }

        List<MergeEvent> merges = new ArrayList<>();
        int nextClusterId = n;
        while (activeClusters.size() > 1) {
            ClusterNode bestFirst = null;
            ClusterNode bestSecond = null;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int i = 0; i < activeClusters.size(); i++) {
                for (int j = i + 1; j < activeClusters.size(); j++) {
                    ClusterNode first = activeClusters.get(i);
                    ClusterNode second = activeClusters.get(j);
                    if (first.minSample() > second.minSample()) {
                        ClusterNode swap = first;
                        first = second;
                        second = swap;
                    }
                    double distance = completeLinkage(distances, first, second);
                    if (Double.isNaN(distance)) {
                        continue;
                    }
                    if (bestFirst == null || precedes(distance, first, second, bestDistance, bestFirst, bestSecond)) {
                        bestDistance = distance;
                        bestFirst = first;
                        bestSecond = second;
                    }
                }
            }
            if (bestFirst == null) {
                throw new DisconnectedInputException(
                    "No pair of the " + activeClusters.size() + " remaining clusters has all cross distances defined"
                );
            }
            ClusterNode merged = new ClusterNode(nextClusterId++, bestFirst, bestSecond);
            merges.add(new MergeEvent(merged.id, bestFirst.id, bestSecond.id, bestDistance, merged.samples.size()));
            activeClusters.remove(bestFirst);
            activeClusters.remove(bestSecond);
            activeClusters.add(merged);
        }
        log.debug("Naive complete linkage produced {} merges", merges.size());
        return Dendrogram.of(distances.getItems(), merges);
    }

    private static boolean precedes(
        double distance,
        ClusterNode first,
        ClusterNode second,
        double bestDistance,
        ClusterNode bestFirst,
        ClusterNode bestSecond
    ) {
        if (distance != bestDistance) {
            return distance < bestDistance;
        }
        if (first.minSample() != bestFirst.minSample()) {
            return first.minSample() < bestFirst.minSample();
        }
        return second.minSample() < bestSecond.minSample();
    }

    /**
     * Complete linkage: maximum distance between any two points in different clusters, NaN if any of them is missing
     */
    private static double completeLinkage(DistanceSet distances, ClusterNode c1, ClusterNode c2) {
        double maxDist = 0.0;
        for (int i : c1.samples) {
            for (int j : c2.samples) {
                double dist = distances.distance(i, j);
                if (Double.isNaN(dist)) {
                    return Double.NaN;
                }
                if (dist > maxDist) {
                    maxDist = dist;
                }
            }
        }
        return maxDist;
    }
}
