/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Immutable binary merge tree over n items.
 *
 * Node ids 0..n-1 are the leaves, the leaf with id i wrapping the item of rank i. Node n + k is created by the
 * k-th merge. The last merge is the root; a single-item dendrogram has no merges and its root is leaf 0.
 */
public final class Dendrogram {

    private final List<ItemId> items;
    private final List<MergeEvent> merges;

    private Dendrogram(List<ItemId> items, List<MergeEvent> merges) {
        this.items = List.copyOf(items);
        this.merges = List.copyOf(merges);
    }

    /**
     * Creates a dendrogram after checking it is a well formed complete-linkage tree: every merge consumes two
     * distinct, previously unconsumed nodes created before it, sizes add up, and no height is below a child height.
     *
     * @param items leaf items in ascending order
     * @param merges merge events in merge order
     * @throws MalformedInputException if the merges do not form such a tree
     */
    public static Dendrogram of(List<ItemId> items, List<MergeEvent> merges) {
        int n = items.size();
        if (n == 0) {
            throw new DegenerateInputException("Dendrogram needs at least one item");
        }
        if (merges.size() != n - 1) {
            throw new MalformedInputException("Dendrogram over " + n + " items needs " + (n - 1) + " merges, got " + merges.size());
        }
        boolean[] consumed = new boolean[2 * n - 1];
        int[] sizes = new int[2 * n - 1];
        double[] heights = new double[2 * n - 1];
        Arrays.fill(sizes, 0, n, 1);
        for (int k = 0; k < merges.size(); k++) {
            MergeEvent merge = merges.get(k);
            int id = n + k;
            if (merge.nodeId() != id) {
                throw new MalformedInputException("Merge " + k + " must create node " + id + ", got " + merge.nodeId());
            }
            checkChild(merge, merge.left(), id, consumed);
            checkChild(merge, merge.right(), id, consumed);
            if (merge.left() == merge.right()) {
                throw new MalformedInputException("Node " + id + " merges node " + merge.left() + " with itself");
            }
            consumed[merge.left()] = true;
            consumed[merge.right()] = true;
            sizes[id] = sizes[merge.left()] + sizes[merge.right()];
            if (merge.size() != sizes[id]) {
                throw new MalformedInputException("Node " + id + " must have size " + sizes[id] + ", got " + merge.size());
            }
            double height = merge.height();
            if (Double.isNaN(height) || Double.isInfinite(height) || height < 0) {
                throw new MalformedInputException("Node " + id + " has invalid height " + height);
            }
            if (height < heights[merge.left()] || height < heights[merge.right()]) {
                throw new MalformedInputException("Node " + id + " at height " + height + " lies below one of its children");
            }
            heights[id] = height;
        }
        return new Dendrogram(items, merges);
    }

    private static void checkChild(MergeEvent merge, int child, int id, boolean[] consumed) {
        if (child < 0 || child >= id) {
            throw new MalformedInputException("Node " + id + " references node " + child + " which does not precede it");
        }
        if (consumed[child]) {
            throw new MalformedInputException("Node " + child + " is merged more than once (again by node " + merge.nodeId() + ")");
        }
    }

    public int getLeafCount() {
        return items.size();
    }

    public List<ItemId> getItems() {
        return items;
    }

    public ItemId getItem(int leaf) {
        return items.get(leaf);
    }

    /**
     * @return merge events in merge order
     */
    public List<MergeEvent> getMerges() {
        return merges;
    }

    /**
     * @return true when the tree is a single leaf without any merge
     */
    public boolean isTrivial() {
        return merges.isEmpty();
    }

    public int getRoot() {
        return isTrivial() ? 0 : merges.get(merges.size() - 1).nodeId();
    }

    public double getRootHeight() {
        return getHeight(getRoot());
    }

    public boolean isLeaf(int node) {
        checkNode(node);
        return node < items.size();
    }

    public MergeEvent getMerge(int node) {
        if (isLeaf(node)) {
            throw new IllegalArgumentException("Node " + node + " is a leaf");
        }
        return merges.get(node - items.size());
    }

    public double getHeight(int node) {
        return isLeaf(node) ? 0.0 : getMerge(node).height();
    }

    public int getSize(int node) {
        return isLeaf(node) ? 1 : getMerge(node).size();
    }

    /**
     * @return leaf ids below the node in ascending order, which is also ascending item order
     */
    public int[] getLeaves(int node) {
        int[] leaves = new int[getSize(node)];
        int count = 0;
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (isLeaf(current)) {
                leaves[count++] = current;
            } else {
                MergeEvent merge = getMerge(current);
                stack.push(merge.right());
                stack.push(merge.left());
            }
        }
        Arrays.sort(leaves);
        return leaves;
    }

    /**
     * @return items below the node in ascending order
     */
    public List<ItemId> getMembers(int node) {
        int[] leaves = getLeaves(node);
        List<ItemId> members = new ArrayList<>(leaves.length);
        for (int leaf : leaves) {
            members.add(items.get(leaf));
        }
        return members;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= items.size() + merges.size()) {
            throw new IllegalArgumentException("Unknown node " + node);
        }
    }
}
