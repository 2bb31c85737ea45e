package com.skein.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Graph-relevant data carried by a record: properties of the record's own vertex plus
 * the nodes and edges derived from it.
 */
@Value
@Builder
public class GraphMutation {

    @Singular
    Map<String, Object> recordProperties;

    @Singular
    List<GraphNode> nodes;

    @Singular
    List<GraphEdge> edges;

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }
}
