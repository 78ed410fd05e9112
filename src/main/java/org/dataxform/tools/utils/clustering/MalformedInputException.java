/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

/**
 * A distance record or a stored dendrogram violates the input invariants: symmetry, uniqueness,
 * distinct endpoints, finite non-negative distances or a consistent item type.
 */
public class MalformedInputException extends ClusteringException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
