/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

/**
 * Raised when live clusters remain but no pair of them has every cross distance defined.
 */
public class DisconnectedInputException extends ClusteringException {

    public DisconnectedInputException(String message) {
        super(message);
    }
}
