package com.skein.store;

import com.skein.model.EntityReference;

import java.util.Collection;
import java.util.Map;

/**
 * Graph store holding one vertex per entity plus the nodes and edges derived from it.
 */
public interface GraphStore {

    /** Vertex collection holding one vertex per indexed entity, keyed by {@link EntityReference#getKey()}. */
    String RECORDS = "records";

    /**
     * Writes the entity's vertex and replaces every edge it owns with those in
     * {@code mutation}.
     */
    void upsert(EntityReference ref, GraphMutation mutation);

    /**
     * Removes the entity's vertex and the edges it owns.  Shared nodes stay.
     */
    void delete(EntityReference ref);

    /**
     * Resolves display labels for nodes of one collection.
     *
     * @return key → label for the keys that exist; unknown keys are absent
     */
    Map<String, String> lookupLabels(String nodeCollection, Collection<String> keys);
}
