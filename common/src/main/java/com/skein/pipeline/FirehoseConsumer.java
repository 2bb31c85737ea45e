package com.skein.pipeline;

import com.skein.cursor.CursorManager;
import com.skein.ingest.EventFilter;
import com.skein.ingest.EventQueue;
import com.skein.ingest.FilterResult;
import com.skein.metrics.IndexerMetrics;
import com.skein.model.CommitFrame;
import com.skein.transport.ConnectionLostException;
import com.skein.transport.ReconnectionManager;
import com.skein.transport.RelayMessage;
import com.skein.transport.RelayStream;
import com.skein.transport.RelayTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * The single transport thread: reads frames, registers them with the cursor, filters
 * them and feeds the event queue.  It never touches a store.
 *
 * <p>Rejected frames are resolved on the spot.  Accepted frames are handed to the queue,
 * whose blocking {@code enqueue} is what stops the read loop when workers fall behind.
 * A commit with several accepted operations is tracked once with their count.  A
 * sequence still in flight is not enqueued a second time.</p>
 *
 * <p>Any failure other than a closed queue, expected or not, ends the current connection
 * and goes through the reconnect backoff.</p>
 *
 * <p>After a lost connection the subscription resumes after the highest sequence already
 * received in this process; on a fresh start it resumes after the persisted cursor.</p>
 */
@Slf4j
public class FirehoseConsumer implements Runnable {

    private final RelayTransport transport;
    private final ReconnectionManager reconnection;
    private final EventFilter filter;
    private final EventQueue queue;
    private final CursorManager cursor;
    private final IndexerMetrics metrics;
    private final PipelineCounters counters;
    private final Clock clock;

    private volatile boolean running = true;
    private volatile RelayStream current;

    FirehoseConsumer(RelayTransport transport, ReconnectionManager reconnection, EventFilter filter,
                     EventQueue queue, CursorManager cursor, IndexerMetrics metrics,
                     PipelineCounters counters, Clock clock) {
        this.transport = transport;
        this.reconnection = reconnection;
        this.filter = filter;
        this.queue = queue;
        this.cursor = cursor;
        this.metrics = metrics;
        this.counters = counters;
        this.clock = clock;
    }

    @Override
    public void run() {
        log.info("Firehose consumer started");
        while (running) {
            try (RelayStream stream = transport.connect(resumePoint())) {
                current = stream;
                reconnection.onConnected();
                while (running) {
                    RelayMessage message = stream.next();
                    reconnection.onFrame();
                    handle(message);
                }
            } catch (ConnectionLostException e) {
                if (!running || !backOff(e)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                if (!running || queue.isClosed()) {
                    if (running) {
                        log.error("Event queue rejected a frame while the consumer was running", e);
                    }
                    break;
                }
                counters.unexpectedErrors.incrementAndGet();
                log.error("Unexpected failure reading the firehose, reconnecting", e);
                if (!backOff(e)) {
                    break;
                }
            } finally {
                current = null;
            }
        }
        log.info("Firehose consumer stopped at highestReceived={}", cursor.getHighestReceived());
    }

    /** Records the failure and waits out the reconnect delay; false if interrupted. */
    private boolean backOff(Throwable cause) {
        reconnection.onFailure(cause);
        try {
            reconnection.awaitNextAttempt();
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    void handle(RelayMessage message) throws InterruptedException {
        metrics.frameReceived();
        counters.framesReceived.incrementAndGet();
        counters.lastFrameAt.set(clock.instant());

        Long seq = message.getSeq();
        boolean sequenced = seq != null && seq > 0;
        if (sequenced && cursor.isInFlight(seq)) {
            log.debug("Ignoring repeated delivery of in-flight seq={}", seq);
            return;
        }

        List<CommitFrame> accepted = new ArrayList<>();
        for (FilterResult result : filter.filter(message)) {
            if (result.isAccepted()) {
                accepted.add(result.getFrame());
            }
        }
        if (sequenced) {
            cursor.track(seq, Math.max(1, accepted.size()));
            if (accepted.isEmpty()) {
                cursor.checkpoint(seq);
            }
        }
        for (CommitFrame frame : accepted) {
            queue.enqueue(frame);
        }
    }

    private OptionalLong resumePoint() {
        long highest = cursor.getHighestReceived();
        return highest > 0 ? OptionalLong.of(highest) : OptionalLong.empty();
    }

    /**
     * Stops reading.  A thread blocked on the socket is released by closing the stream;
     * one blocked on a full queue is released when the queue closes.
     */
    public void stop() {
        running = false;
        RelayStream stream = current;
        if (stream != null) {
            stream.close();
        }
    }

    public boolean isRunning() {
        return running;
    }
}
