package com.skein.cursor;

import com.skein.model.EntityReference;

import java.util.OptionalLong;

/**
 * Highest firehose sequence applied to each entity.
 *
 * <p>Entries outlive the entity itself, so a delete leaves its sequence behind and an
 * older create or update for the same entity can still be recognised as stale.</p>
 */
public interface EntitySequenceStore {

    /** Returns the highest sequence applied to {@code ref}, or empty if none was recorded. */
    OptionalLong lastApplied(EntityReference ref);

    /**
     * Records {@code seq} as applied to {@code ref}.  A lower value than the one stored is
     * ignored.
     */
    void recordApplied(EntityReference ref, long seq);
}
