package com.skein.cursor;

import com.skein.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Tracks which firehose sequences are still in flight and derives the committed cursor.
 *
 * <p>The committed cursor is the highest sequence {@code s} such that every frame received
 * with a sequence {@code <= s} has been resolved (indexed, filtered, skipped or
 * dead-lettered).  It is a low watermark over the in-flight set, so frames finishing out
 * of order across lanes never move it past an unresolved frame, and it never decreases.</p>
 *
 * <p>A commit with several operations is tracked with its operation count and stays in
 * flight until every one of them is checkpointed.</p>
 *
 * <h3>Persistence</h3>
 * <p>Advances are written to the {@link CursorStore} every {@code flushBatchSize} advances
 * and by the periodic {@link #flush()} the service schedules every {@code flushInterval}.
 * After a crash the persisted cursor may trail the in-memory one by at most that much;
 * frames in the gap are replayed and land idempotently.</p>
 *
 * <p>All state is guarded by one lock.  Store writes happen outside it so that a slow
 * database does not stall workers checkpointing.</p>
 */
@Slf4j
public class CursorManager {

    private final CursorStore store;
    private final String serviceName;
    private final int flushBatchSize;

    private final Object lock = new Object();
    private final Object flushLock = new Object();

    // guarded by lock
    // seq -> operations not yet checkpointed
    private final NavigableMap<Long, Integer> inFlight = new TreeMap<>();
    private long highestReceived;
    private long committed;
    private int advancesSinceFlush;

    // guarded by flushLock
    private long persisted;

    public CursorManager(CursorStore store, PipelineConfig.CursorSection config) {
        this(store, config.getServiceName(), config.getFlushBatchSize());
    }

    public CursorManager(CursorStore store, String serviceName, int flushBatchSize) {
        this.store = store;
        this.serviceName = serviceName;
        this.flushBatchSize = Math.max(1, flushBatchSize);
    }

    /**
     * Reads the persisted cursor and resets in-memory state to it.
     *
     * @return the cursor to resume after, or empty for a fresh start at the live tip
     */
    public OptionalLong load() {
        OptionalLong loaded = store.load(serviceName);
        long value = loaded.orElse(0L);
        synchronized (lock) {
            inFlight.clear();
            highestReceived = value;
            committed = value;
            advancesSinceFlush = 0;
        }
        synchronized (flushLock) {
            persisted = value;
        }
        log.info("Loaded cursor service={} seq={}", serviceName, loaded.isPresent() ? value : "none");
        return loaded;
    }

    /**
     * Registers a single-operation frame as received.
     */
    public void track(long seq) {
        track(seq, 1);
    }

    /**
     * Registers a frame carrying {@code operations} operations as received.  Called by the
     * transport thread in receipt order.
     *
     * @return false when the sequence is already in flight or at or below the committed
     *         cursor, in which case nothing is tracked
     */
    public boolean track(long seq, int operations) {
        if (operations < 1) {
            throw new IllegalArgumentException("operations must be positive: " + operations);
        }
        synchronized (lock) {
            if (seq <= committed || inFlight.containsKey(seq)) {
                log.debug("Ignoring already-tracked seq={} (committed={})", seq, committed);
                return false;
            }
            inFlight.put(seq, operations);
            if (seq > highestReceived) {
                highestReceived = seq;
            }
            return true;
        }
    }

    public boolean isInFlight(long seq) {
        synchronized (lock) {
            return inFlight.containsKey(seq);
        }
    }

    /**
     * Marks one operation of a tracked frame as resolved and advances the committed cursor
     * once the whole frame is.
     */
    public void checkpoint(long seq) {
        boolean flushNow = false;
        synchronized (lock) {
            Integer pending = inFlight.get(seq);
            if (pending == null) {
                log.debug("Checkpoint for untracked seq={} ignored", seq);
                return;
            }
            if (pending > 1) {
                inFlight.put(seq, pending - 1);
                return;
            }
            inFlight.remove(seq);
            long candidate = inFlight.isEmpty() ? highestReceived : inFlight.firstKey() - 1;
            if (candidate > committed) {
                committed = candidate;
                advancesSinceFlush++;
                if (advancesSinceFlush >= flushBatchSize) {
                    advancesSinceFlush = 0;
                    flushNow = true;
                }
            }
        }
        if (flushNow) {
            persistQuietly();
        }
    }

    /**
     * Writes the committed cursor if it moved since the last write.
     *
     * @throws RuntimeException if the store rejects the write
     */
    public void flush() {
        long target = getCommittedCursor();
        synchronized (flushLock) {
            if (target <= persisted) {
                return;
            }
            store.save(serviceName, target);
            persisted = target;
        }
        synchronized (lock) {
            advancesSinceFlush = 0;
        }
        log.debug("Flushed cursor service={} seq={}", serviceName, target);
    }

    private void persistQuietly() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.warn("Cursor write failed for service={}, keeping it for the next flush: {}",
                    serviceName, e.getMessage(), e);
        }
    }

    // ── Observability ────────────────────────────────────────────────────

    public long getCommittedCursor() {
        synchronized (lock) {
            return committed;
        }
    }

    public long getHighestReceived() {
        synchronized (lock) {
            return highestReceived;
        }
    }

    public long getPersistedCursor() {
        synchronized (flushLock) {
            return persisted;
        }
    }

    public int inFlightCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    /** Highest received sequence minus the committed cursor. */
    public long lag() {
        synchronized (lock) {
            return highestReceived - committed;
        }
    }

    public String getServiceName() {
        return serviceName;
    }
}
