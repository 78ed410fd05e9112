/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Cuts a dendrogram into flat clusters at a height threshold.
 *
 * A node whose height is at most the threshold becomes one cluster holding all its leaves, with the node's height.
 * Higher nodes are expanded into their children; leaves reached that way are singletons of height 0.
 * Clusters are numbered from 0 in ascending order of their smallest member.
 *
 * Usage:
 * List&lt;FlatCluster&gt; clusters = new TreeCutter().cut(dendrogram, 2.0);
 */
@Log4j2
public class TreeCutter {

    @Getter
    private final ExemplarPolicy exemplarPolicy;
    private final DistanceSet distances;

    public TreeCutter() {
        this(ExemplarPolicy.MIN_ID, null);
    }

    /**
     * @param exemplarPolicy how each cluster's exemplar is chosen
     * @param distances distances the dendrogram was built from, required by {@link ExemplarPolicy#MEDOID}
     */
    public TreeCutter(ExemplarPolicy exemplarPolicy, DistanceSet distances) {
        if (exemplarPolicy == ExemplarPolicy.MEDOID && distances == null) {
            throw new IllegalArgumentException("Medoid exemplars need the distance set");
        }
        this.exemplarPolicy = exemplarPolicy;
        this.distances = distances;
    }

    /**
     * Cut the dendrogram at the given height.
     *
     * @param dendrogram the tree to cut
     * @param threshold height threshold, or null for no cut which keeps the root as one cluster
     * @return flat clusters ordered by cluster id
     * @throws InvalidThresholdException if the threshold is negative or NaN
     */
    public List<FlatCluster> cut(Dendrogram dendrogram, Double threshold) {
        double height = threshold == null ? dendrogram.getRootHeight() : threshold;
        if (Double.isNaN(height) || height < 0) {
            throw new InvalidThresholdException("Height threshold must be non-negative, got: " + threshold);
        }

        List<int[]> groups = new ArrayList<>();
        List<Double> groupHeights = new ArrayList<>();
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(dendrogram.getRoot());
        while (!pending.isEmpty()) {
            int node = pending.pop();
            if (dendrogram.isLeaf(node)) {
                groups.add(new int[] { node });
                groupHeights.add(0.0);
            } else if (dendrogram.getHeight(node) <= height) {
                groups.add(dendrogram.getLeaves(node));
                groupHeights.add(dendrogram.getHeight(node));
            } else {
                MergeEvent merge = dendrogram.getMerge(node);
                pending.push(merge.right());
                pending.push(merge.left());
            }
        }

        List<Integer> order = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingInt(i -> groups.get(i)[0]));

        List<FlatCluster> clusters = new ArrayList<>(groups.size());
        for (int clusterId = 0; clusterId < order.size(); clusterId++) {
            int index = order.get(clusterId);
            int[] leaves = groups.get(index);
            List<ItemId> members = new ArrayList<>(leaves.length);
            for (int leaf : leaves) {
                members.add(dendrogram.getItem(leaf));
            }
            ItemId exemplar = dendrogram.getItem(exemplarPolicy.select(leaves, distances));
            clusters.add(new FlatCluster(clusterId, members, groupHeights.get(index), exemplar));
        }
        log.debug("Cut dendrogram of {} items at height {} into {} clusters", dendrogram.getLeafCount(), height, clusters.size());
        return clusters;
    }
}
