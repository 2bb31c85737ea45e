package com.skein.pipeline;

import com.skein.cursor.CursorManager;
import com.skein.dispatch.FrameProcessor;
import com.skein.dispatch.ProcessingResult;
import com.skein.ingest.EventQueue;
import com.skein.model.CommitFrame;
import com.skein.transport.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Drains one queue lane, taking each frame to resolution before the next.
 *
 * <p>A frame is checkpointed only once it is resolved: indexed, skipped or
 * dead-lettered.  If processing throws unexpectedly (for example the dead-letter store
 * is down) the same frame is tried again after a pause, so it is never silently lost
 * and the cursor never passes it.</p>
 *
 * <p>Once halted, a frame waiting between retries is abandoned unresolved; a saga
 * attempt already under way always runs to its end.</p>
 */
@Slf4j
public class LaneWorker implements Runnable {

    private static final Duration UNEXPECTED_FAILURE_PAUSE = Duration.ofSeconds(5);

    private final int lane;
    private final EventQueue queue;
    private final FrameProcessor processor;
    private final CursorManager cursor;
    private final PipelineCounters counters;
    private final Sleeper sleeper;

    private volatile boolean halted;

    LaneWorker(int lane, EventQueue queue, FrameProcessor processor, CursorManager cursor,
               PipelineCounters counters, Sleeper sleeper) {
        this.lane = lane;
        this.queue = queue;
        this.processor = processor;
        this.cursor = cursor;
        this.counters = counters;
        this.sleeper = sleeper;
    }

    @Override
    public void run() {
        log.debug("Lane {} started", lane);
        try {
            while (!halted) {
                Optional<CommitFrame> next = queue.dequeue(lane);
                if (next.isEmpty()) {
                    log.info("Lane {} drained", lane);
                    return;
                }
                processUntilResolved(next.get());
            }
            log.info("Lane {} halted with {} frames still queued overall", lane, queue.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Lane {} interrupted; unresolved frames will be replayed from the cursor", lane);
        }
    }

    private void processUntilResolved(CommitFrame frame) throws InterruptedException {
        while (true) {
            if (halted) {
                log.warn("Lane {} halted with {} unresolved", lane, frame.describe());
                return;
            }
            try {
                ProcessingResult result = processor.process(frame, () -> halted);
                if (result.getStatus() == ProcessingResult.Status.ABANDONED) {
                    log.warn("Lane {} halted with {} unresolved", lane, frame.describe());
                    return;
                }
                resolved(frame, result);
                return;
            } catch (RuntimeException e) {
                counters.unexpectedErrors.incrementAndGet();
                if (halted) {
                    log.error("Lane {} halted with {} unresolved", lane, frame.describe(), e);
                    return;
                }
                log.error("Lane {} could not resolve {}, trying again in {} ms", lane, frame.describe(),
                        UNEXPECTED_FAILURE_PAUSE.toMillis(), e);
                sleeper.sleep(UNEXPECTED_FAILURE_PAUSE);
            }
        }
    }

    private void resolved(CommitFrame frame, ProcessingResult result) {
        counters.framesProcessed.incrementAndGet();
        if (result.getStatus() == ProcessingResult.Status.DEAD_LETTERED) {
            counters.framesDeadLettered.incrementAndGet();
        }
        if (!frame.isSynthetic()) {
            cursor.checkpoint(frame.getSequence());
        }
        log.debug("Lane {} resolved {} status={} attempts={}", lane, frame.describe(),
                result.getStatus(), result.getAttempts());
    }

    /** Stops taking new frames once the current one is resolved. */
    void halt() {
        halted = true;
    }

    int getLane() {
        return lane;
    }
}
