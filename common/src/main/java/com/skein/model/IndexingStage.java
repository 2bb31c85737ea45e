package com.skein.model;

/**
 * The stores a record is written to, in the order the saga commits them.
 * Compensation always walks committed stages in reverse of this order.
 */
public enum IndexingStage {

    /** System of record for "is this entity indexed". */
    RELATIONAL,

    /** Full-text search projection. */
    SEARCH,

    /** Derived nodes and edges (tags, fields, relationships). */
    GRAPH
}
