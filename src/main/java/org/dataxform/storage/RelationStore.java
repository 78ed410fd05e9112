/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.storage;

import org.opensearch.core.action.ActionListener;

/**
 * Narrow view of the storage engine that materializes input and output relations.
 */
public interface RelationStore {

    /**
     * Read a relation.
     * @param name relation name
     * @param listener receives the relation, or a {@link RelationNotFoundException} when it does not exist
     */
    void getRelation(String name, ActionListener<Relation> listener);

    /**
     * Create or replace a relation in a single step.
     * @param relation relation to store under its own name
     * @param listener receives the stored relation
     */
    void putRelation(Relation relation, ActionListener<Relation> listener);
}
