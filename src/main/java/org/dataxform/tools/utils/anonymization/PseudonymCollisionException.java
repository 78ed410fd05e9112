/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.anonymization;

/**
 * Every regenerated pseudonym for a value collided with one already in use.
 */
public class PseudonymCollisionException extends IllegalStateException {

    public PseudonymCollisionException(String message) {
        super(message);
    }
}
