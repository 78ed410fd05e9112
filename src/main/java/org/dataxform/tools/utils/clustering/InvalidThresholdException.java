/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

public class InvalidThresholdException extends ClusteringException {

    public InvalidThresholdException(String message) {
        super(message);
    }
}
