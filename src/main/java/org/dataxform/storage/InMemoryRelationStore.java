/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.storage;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.opensearch.core.action.ActionListener;

import lombok.extern.log4j.Log4j2;

/**
 * Relation store kept in memory. Listeners are completed on the calling thread.
 */
@Log4j2
public class InMemoryRelationStore implements RelationStore {

    private final ConcurrentMap<String, Relation> relations = new ConcurrentHashMap<>();

    @Override
    public void getRelation(String name, ActionListener<Relation> listener) {
        Relation relation = relations.get(name);
        if (relation == null) {
            listener.onFailure(new RelationNotFoundException(name));
        } else {
            listener.onResponse(relation);
        }
    }

    @Override
    public void putRelation(Relation relation, ActionListener<Relation> listener) {
        relations.put(relation.getName(), relation);
        log.debug("Stored relation {} with {} rows", relation.getName(), relation.size());
        listener.onResponse(relation);
    }

    public Optional<Relation> find(String name) {
        return Optional.ofNullable(relations.get(name));
    }

    public Set<String> getRelationNames() {
        return Set.copyOf(relations.keySet());
    }
}
