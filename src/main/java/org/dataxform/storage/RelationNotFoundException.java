/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.storage;

import lombok.Getter;

public class RelationNotFoundException extends RuntimeException {
    @Getter
    private final String relationName;

    public RelationNotFoundException(String relationName) {
        super("Relation not found: " + relationName);
        this.relationName = relationName;
    }
}
