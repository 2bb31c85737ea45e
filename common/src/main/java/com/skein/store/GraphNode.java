package com.skein.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A vertex derived from a record, e.g. a tag or a field.  Nodes are shared between
 * records and are never removed when one of their records is deleted.
 */
@Value
@Builder
public class GraphNode {

    String collection;
    String key;

    @Singular
    Map<String, Object> properties;
}
