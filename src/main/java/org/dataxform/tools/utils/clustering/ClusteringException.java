/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

/**
 * Base type of the errors raised by the clustering core. Every error rejects the whole invocation,
 * no partial dendrogram or cut is ever returned.
 */
public class ClusteringException extends IllegalArgumentException {

    public ClusteringException(String message) {
        super(message);
    }

    public ClusteringException(String message, Throwable cause) {
        super(message, cause);
    }
}
