package com.skein.reindex;

import com.skein.model.EntityReference;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads the current version of a record from its origin.
 */
public interface RecordFetcher {

    /**
     * @return the record, or empty when the origin reports that it no longer exists
     * @throws IOException when the origin cannot be reached or answers with an error
     */
    Optional<FetchedRecord> fetch(EntityReference ref) throws IOException;
}
