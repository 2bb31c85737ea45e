package com.skein.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Canonical indexed form of a record for the relational store.
 *
 * <p>The row is keyed by the entity reference URI, which the store adds itself, and
 * the target table follows from the record's collection.  The column map holds
 * everything else; map, collection and JSON-tree values are stored as JSON documents.</p>
 */
@Value
@Builder
public class RelationalRow {

    @Singular
    Map<String, Object> columns;
}
