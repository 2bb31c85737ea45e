package com.skein.ingest;

import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded buffer between the transport thread and the lane workers.
 *
 * <p>Frames are partitioned into lanes by {@link EntityReference}: every frame for one
 * entity lands in the same lane, and each lane is FIFO, so frames for an entity are
 * processed in receipt order.  Frames for different entities may run in parallel.</p>
 *
 * <p>Capacity is shared by all lanes.  {@link #enqueue} blocks once it is exhausted,
 * which stalls the transport read loop and, through WebSocket demand, the socket.</p>
 *
 * <p>After {@link #close()} no new frames are accepted, but workers keep draining what is
 * already buffered; {@link #dequeue} returns empty once its lane is drained.</p>
 */
@Slf4j
public class EventQueue {

    private static final long POLL_MS = 100;

    private final int capacity;
    private final LinkedBlockingQueue<CommitFrame>[] lanes;
    private final Semaphore permits;
    private final ReadWriteLock closeLock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    @SuppressWarnings("unchecked")
    public EventQueue(int capacity, int laneCount) {
        if (capacity <= 0 || laneCount <= 0) {
            throw new IllegalArgumentException(
                    "capacity and lanes must be positive: capacity=" + capacity + " lanes=" + laneCount);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity);
        this.lanes = new LinkedBlockingQueue[laneCount];
        for (int i = 0; i < laneCount; i++) {
            lanes[i] = new LinkedBlockingQueue<>();
        }
    }

    /**
     * Adds a frame to its entity's lane, blocking while the queue is full.
     *
     * @throws IllegalStateException if the queue is closed before or while waiting
     */
    public void enqueue(CommitFrame frame) throws InterruptedException {
        while (!permits.tryAcquire(POLL_MS, TimeUnit.MILLISECONDS)) {
            if (closed) {
                throw new IllegalStateException("Queue closed, rejecting " + frame.describe());
            }
        }
        closeLock.readLock().lock();
        try {
            if (closed) {
                permits.release();
                throw new IllegalStateException("Queue closed, rejecting " + frame.describe());
            }
            lanes[laneFor(frame.entityReference())].add(frame);
        } finally {
            closeLock.readLock().unlock();
        }
    }

    /**
     * Takes the next frame of {@code lane}, blocking until one is available.
     *
     * @return the frame, or empty once the queue is closed and the lane is drained
     */
    public Optional<CommitFrame> dequeue(int lane) throws InterruptedException {
        LinkedBlockingQueue<CommitFrame> queue = lanes[lane];
        while (true) {
            CommitFrame frame = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            if (frame != null) {
                permits.release();
                return Optional.of(frame);
            }
            if (closed && queue.isEmpty()) {
                return Optional.empty();
            }
        }
    }

    public void close() {
        closeLock.writeLock().lock();
        try {
            if (!closed) {
                closed = true;
                log.info("Event queue closed with {} frames buffered", size());
            }
        } finally {
            closeLock.writeLock().unlock();
        }
    }

    public int laneFor(EntityReference reference) {
        return Math.floorMod(reference.hashCode(), lanes.length);
    }

    public int laneCount() {
        return lanes.length;
    }

    public int size() {
        return capacity - permits.availablePermits();
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isClosed() {
        return closed;
    }
}
