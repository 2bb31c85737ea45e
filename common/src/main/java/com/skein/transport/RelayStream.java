package com.skein.transport;

/**
 * One live subscription to the relay.  Frames are delivered in relay order, one per
 * {@link #next()} call; the stream never reorders, drops or retries.
 */
public interface RelayStream extends AutoCloseable {

    /**
     * Blocks until the next frame arrives.
     *
     * @return the next message; one that could not be decoded is returned as an
     *         undecodable message, not thrown
     * @throws ConnectionLostException when the connection fails, the relay closes it,
     *                                 the sequence goes backwards or no frame arrives
     *                                 within the idle timeout
     */
    RelayMessage next() throws ConnectionLostException;

    /** Terminates the subscription; a thread blocked in {@link #next()} is released. */
    @Override
    void close();
}
