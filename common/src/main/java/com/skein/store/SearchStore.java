package com.skein.store;

import com.skein.model.EntityReference;

/**
 * Full-text search index, one document per entity.
 */
public interface SearchStore {

    void upsert(EntityReference ref, SearchDocument document);

    /** Removes the document for {@code ref}; a missing document is not an error. */
    void delete(EntityReference ref);
}
