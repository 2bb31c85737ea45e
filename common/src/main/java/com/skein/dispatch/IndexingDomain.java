package com.skein.dispatch;

import com.skein.saga.IndexingSaga;
import com.skein.store.GraphStore;

import java.util.Map;
import java.util.Set;

/**
 * What a domain module contributes to the generic engine: its record kinds, where they
 * live in the stores and how each one is indexed.
 */
public interface IndexingDomain {

    /** Relational table per collection NSID. */
    Map<String, String> tablesByCollection();

    /** Graph node collections the domain writes besides the per-record vertices. */
    Set<String> graphNodeCollections();

    /**
     * Registers a handler for every (kind, operation) the domain indexes.
     *
     * @param graphStore read access for projections that resolve labels
     */
    void registerHandlers(HandlerRegistry registry, IndexingSaga saga, GraphStore graphStore);
}
