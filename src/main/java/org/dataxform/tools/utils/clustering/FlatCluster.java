/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import java.util.List;

/**
 * Cell of a dendrogram cut. Members are sorted ascending; height is 0 for a singleton that never merged below the threshold.
 */
public record FlatCluster(int clusterId, List<ItemId> members, double height, ItemId exemplar) {

    public FlatCluster {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
