/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

public interface DendrogramBuilder {
    /**
     * Builds the dendrogram of the given distances. Either the complete tree is returned or an exception is thrown.
     * @param distances pairwise distances over the item universe
     * @return dendrogram with one merge less than there are items
     * @throws DegenerateInputException if the distance set has no items
     * @throws DisconnectedInputException if the universe cannot be merged into a single cluster
     */
    Dendrogram build(DistanceSet distances);
}
