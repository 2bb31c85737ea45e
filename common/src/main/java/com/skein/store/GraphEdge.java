package com.skein.store;

import com.skein.model.EntityReference;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A relationship owned by the record that produced it.  Edges are replaced wholesale
 * whenever their owning record is re-indexed and removed when it is deleted.
 */
@Value
@Builder
public class GraphEdge {

    String fromCollection;
    String fromKey;
    String toCollection;
    String toKey;
    String relation;

    @Singular
    Map<String, Object> properties;

    /** Starts an edge leaving the vertex of {@code ref}. */
    public static GraphEdgeBuilder outOf(EntityReference ref) {
        return builder().fromCollection(GraphStore.RECORDS).fromKey(ref.getKey());
    }

    /** Starts an edge leaving {@code ref} towards another record's vertex. */
    public static GraphEdgeBuilder between(EntityReference from, EntityReference to) {
        return outOf(from).toCollection(GraphStore.RECORDS).toKey(to.getKey());
    }
}
