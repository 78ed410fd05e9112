/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

/**
 * One internal node of a dendrogram.
 *
 * @param nodeId id of the new node, leaf count plus the merge position
 * @param left child holding the smaller minimum item
 * @param right the other child
 * @param height complete-linkage distance between the children at merge time
 * @param size number of leaves below the node
 */
public record MergeEvent(int nodeId, int left, int right, double height, int size) {
}
