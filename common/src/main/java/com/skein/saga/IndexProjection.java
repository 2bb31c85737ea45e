package com.skein.saga;

import com.skein.store.GraphMutation;
import com.skein.store.RelationalRow;
import com.skein.store.SearchDocument;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one record writes into the three stores, derived once before the first
 * stage runs so that every stage sees the same values.
 */
@Value
@Builder
public class IndexProjection {

    @NonNull
    RelationalRow relational;

    @NonNull
    SearchDocument search;

    /** Absent or empty when the record has no graph-relevant data. */
    GraphMutation graph;

    public boolean hasGraph() {
        return graph != null && !graph.isEmpty();
    }
}
