package com.skein.cursor;

import java.util.OptionalLong;

/**
 * Durable home of the committed cursor, one value per consumer service name.
 */
public interface CursorStore {

    /** Returns the persisted cursor, or empty when the service has never committed one. */
    OptionalLong load(String serviceName);

    /**
     * Persists {@code seq}.  Implementations never move a stored cursor backwards.
     */
    void save(String serviceName, long seq);
}
