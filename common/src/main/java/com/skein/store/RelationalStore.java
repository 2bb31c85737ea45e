package com.skein.store;

import com.skein.model.EntityReference;

/**
 * Relational index: the system of record for whether an entity is indexed.
 */
public interface RelationalStore {

    /**
     * Inserts or replaces the row for {@code ref}.  Writing the same row twice leaves
     * the same state as writing it once.
     */
    void upsert(EntityReference ref, RelationalRow row);

    /**
     * Removes the row for {@code ref}; a missing row is not an error.
     */
    void delete(EntityReference ref);
}
