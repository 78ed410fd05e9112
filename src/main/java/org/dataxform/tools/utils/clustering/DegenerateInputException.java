/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

/**
 * The distance set references no items at all, so there is nothing to build a tree from.
 */
public class DegenerateInputException extends ClusteringException {

    public DegenerateInputException(String message) {
        super(message);
    }
}
