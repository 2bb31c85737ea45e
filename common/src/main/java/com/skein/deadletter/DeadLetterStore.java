package com.skein.deadletter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for dead-lettered frames.
 */
public interface DeadLetterStore {

    /**
     * Stores a new entry and returns its generated id.  The {@code id} of the argument is ignored.
     */
    long insert(DeadLetterEntry entry);

    Optional<DeadLetterEntry> find(long id);

    List<DeadLetterEntry> list(DeadLetterQuery query);

    /** Increments the retry count and records the latest failure. */
    void recordRetryFailure(long id, String errorMessage, Instant failedAt);

    boolean delete(long id);

    long count();

    DeadLetterStats stats();

    /** Deletes entries first recorded before {@code cutoff}; returns how many. */
    int purgeOlderThan(Instant cutoff);
}
