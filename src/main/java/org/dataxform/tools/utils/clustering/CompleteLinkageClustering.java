/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import com.google.common.collect.Lists;

import lombok.extern.log4j.Log4j2;

/**
 * Complete-linkage agglomerative clustering over a precomputed, possibly sparse, distance set, built with a
 * nearest-neighbour chain in O(n^2) time.
 *
 * Each live cluster occupies the slot of its smallest item rank. Cluster distances are kept in a condensed matrix
 * updated with the Lance-Williams rule d(A+B, X) = max(d(A, X), d(B, X)); an undefined distance stays undefined.
 * Cluster pairs are totally ordered by (distance, smaller slot, larger slot). Complete linkage stays reducible under
 * that order, so the chain finds exactly the merges of the greedy "closest pair first" procedure; sorting them by the
 * same key restores the greedy merge order, and node ids are assigned in that order.
 *
 * Pairs with an undefined distance are never merged; when live clusters remain and no pair can be merged the build
 * fails with {@link DisconnectedInputException}.
 *
 * When an executor is supplied, nearest neighbour scans over at least {@code parallelMinClusters} live clusters are
 * split across it. Workers only read the matrix and propose a candidate; merges and matrix updates stay on the
 * calling thread.
 */
@Log4j2
public class CompleteLinkageClustering implements DendrogramBuilder {

    private static final int NO_NEIGHBOR = -1;

    private static final Comparator<ChainMerge> MERGE_ORDER = Comparator
        .comparingDouble(ChainMerge::height)
        .thenComparingInt(ChainMerge::first)
        .thenComparingInt(ChainMerge::second);

    private final ExecutorService executor;
    private final int parallelism;
    private final int parallelMinClusters;

    public CompleteLinkageClustering() {
        this(null, 1, Integer.MAX_VALUE);
    }

    /**
     * @param executor pool used for sharded neighbour scans, or null to stay on the calling thread
     * @param parallelism number of shards a scan is split into
     * @param parallelMinClusters smallest number of live clusters worth sharding
     */
    public CompleteLinkageClustering(ExecutorService executor, int parallelism, int parallelMinClusters) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got: " + parallelism);
        }
        if (parallelMinClusters < 1) {
            throw new IllegalArgumentException("Minimum clusters for a parallel scan must be at least 1, got: " + parallelMinClusters);
        }
        this.executor = executor;
        this.parallelism = parallelism;
        this.parallelMinClusters = parallelMinClusters;
    }

    /**
     * Merge of the clusters in slots {@code first < second}, as found by the chain
     */
    private record ChainMerge(int first, int second, double height) {
    }

    @Override
    public Dendrogram build(DistanceSet distances) {
        int n = distances.size();
        if (n == 0) {
            throw new DegenerateInputException("Distance set references no items");
        }
        if (n == 1) {
            log.warn("Distance set references a single item {}, returning a dendrogram without merges", distances.getItem(0));
            return Dendrogram.of(distances.getItems(), List.of());
        }
        log.debug("Building complete-linkage dendrogram for {} items and {} distance records", n, distances.getPairCount());

        double[] matrix = distances.condensedCopy();
        List<Integer> live = new ArrayList<>(n);
        for (int slot = 0; slot < n; slot++) {
            live.add(slot);
        }
        int[] chain = new int[n];
        int chainSize = 0;
        int isolated = 0;
        List<ChainMerge> found = new ArrayList<>(n - 1);

        while (live.size() > 1) {
            if (chainSize == 0) {
                chain[chainSize++] = live.get(0);
            }
            int top = chain[chainSize - 1];
            int neighbor = nearestNeighbor(matrix, n, live, top);
            if (neighbor == NO_NEIGHBOR) {
                // distances only grow, so a cluster without a defined distance never merges again
                live.remove(Integer.valueOf(top));
                chainSize--;
                isolated++;
                continue;
            }
            if (chainSize > 1 && chain[chainSize - 2] == neighbor) {
                chainSize -= 2;
                int a = Math.min(top, neighbor);
                int b = Math.max(top, neighbor);
                found.add(new ChainMerge(a, b, matrix[DistanceSet.condensedIndex(n, a, b)]));
                live.remove(Integer.valueOf(b));
                mergeRows(matrix, n, live, a, b);
            } else {
                chain[chainSize++] = neighbor;
            }
        }

        if (isolated > 0) {
            int remaining = n - found.size();
            throw new DisconnectedInputException(
                "No pair of the " + remaining + " remaining clusters has all cross distances defined, merged " + found.size() + " of " + (n - 1)
            );
        }

        List<MergeEvent> merges = toMergeEvents(n, found);
        log.debug("Built dendrogram with {} merges, root height {}", merges.size(), merges.get(merges.size() - 1).height());
        return Dendrogram.of(distances.getItems(), merges);
    }

    /**
     * Replays the chain merges in greedy order, numbering the new nodes as they are created.
     */
    private static List<MergeEvent> toMergeEvents(int n, List<ChainMerge> found) {
        found.sort(MERGE_ORDER);
        int[] node = new int[n];
        int[] size = new int[n];
        for (int slot = 0; slot < n; slot++) {
            node[slot] = slot;
            size[slot] = 1;
        }
        List<MergeEvent> merges = new ArrayList<>(found.size());
        for (int k = 0; k < found.size(); k++) {
            ChainMerge merge = found.get(k);
            int nodeId = n + k;
            int mergedSize = size[merge.first()] + size[merge.second()];
            merges.add(new MergeEvent(nodeId, node[merge.first()], node[merge.second()], merge.height(), mergedSize));
            node[merge.first()] = nodeId;
            size[merge.first()] = mergedSize;
        }
        return merges;
    }

    /**
     * Finds the live slot closest to {@code slot} under the pair order, sharding the scan when it is large enough.
     */
    private int nearestNeighbor(double[] matrix, int n, List<Integer> live, int slot) {
        if (executor == null || parallelism == 1 || live.size() < parallelMinClusters) {
            return scan(matrix, n, live, slot);
        }
        int shardSize = (live.size() + parallelism - 1) / parallelism;
        List<List<Integer>> shards = Lists.partition(live, shardSize);
        List<Future<Integer>> proposals = new ArrayList<>(shards.size());
        for (List<Integer> shard : shards) {
            proposals.add(executor.submit(() -> scan(matrix, n, shard, slot)));
        }
        int best = NO_NEIGHBOR;
        try {
            for (Future<Integer> proposal : proposals) {
                int candidate = proposal.get();
                if (candidate != NO_NEIGHBOR && (best == NO_NEIGHBOR || precedes(matrix, n, slot, candidate, best))) {
                    best = candidate;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proposals.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while searching nearest neighbours", e);
        } catch (ExecutionException e) {
            proposals.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Nearest neighbour search failed: " + e.getCause().getMessage(), e.getCause());
        }
        return best;
    }

    private static int scan(double[] matrix, int n, List<Integer> candidates, int slot) {
        int best = NO_NEIGHBOR;
        for (int candidate : candidates) {
            if (candidate == slot || Double.isNaN(matrix[index(n, slot, candidate)])) {
                continue;
            }
            if (best == NO_NEIGHBOR || precedes(matrix, n, slot, candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Whether pair (slot, x) comes before pair (slot, y): smaller distance, then smaller slots
     */
    private static boolean precedes(double[] matrix, int n, int slot, int x, int y) {
        int c = Double.compare(matrix[index(n, slot, x)], matrix[index(n, slot, y)]);
        if (c != 0) {
            return c < 0;
        }
        int lowX = Math.min(slot, x);
        int lowY = Math.min(slot, y);
        if (lowX != lowY) {
            return lowX < lowY;
        }
        return Math.max(slot, x) < Math.max(slot, y);
    }

    /**
     * Folds row b into row a with the complete-linkage rule. Slot b must already be gone from the live list.
     */
    private static void mergeRows(double[] matrix, int n, List<Integer> live, int a, int b) {
        for (int x : live) {
            if (x == a) {
                continue;
            }
            int ax = index(n, a, x);
            double da = matrix[ax];
            double db = matrix[index(n, b, x)];
            matrix[ax] = Double.isNaN(da) || Double.isNaN(db) ? Double.NaN : Math.max(da, db);
        }
    }

    private static int index(int n, int i, int j) {
        return i < j ? DistanceSet.condensedIndex(n, i, j) : DistanceSet.condensedIndex(n, j, i);
    }
}
