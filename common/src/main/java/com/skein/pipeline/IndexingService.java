package com.skein.pipeline;

import com.skein.config.PipelineConfig;
import com.skein.cursor.CursorManager;
import com.skein.deadletter.DeadLetterHandler;
import com.skein.deadletter.DeadLetterSweeper;
import com.skein.dispatch.FrameProcessor;
import com.skein.ingest.EventFilter;
import com.skein.ingest.EventQueue;
import com.skein.metrics.IndexerMetrics;
import com.skein.transport.ReconnectionManager;
import com.skein.transport.RelayTransport;
import com.skein.transport.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the indexer: one transport thread, one worker per queue lane, a periodic cursor
 * flush and, when configured, the dead-letter sweep.
 *
 * <h3>Threads</h3>
 * <ul>
 *   <li>{@code skein-firehose}: {@link FirehoseConsumer}, reads and enqueues only.</li>
 *   <li>{@code skein-lane-N}: {@link LaneWorker}s, dispatch and saga.</li>
 *   <li>{@code skein-cursor-flush}: persists the committed cursor every flush interval.</li>
 *   <li>{@code skein-dlq-sweep}: optional {@link DeadLetterSweeper}.</li>
 * </ul>
 *
 * <h3>Shutdown</h3>
 * <ol>
 *   <li>Stop the consumer and close the relay stream.</li>
 *   <li>Close the queue so nothing new is accepted.</li>
 *   <li>Let the workers drain their lanes, bounded by the drain timeout.  A saga in
 *       progress is never interrupted; workers still busy at the deadline are told to
 *       stop after their current saga attempt, and stop waits for them.</li>
 *   <li>Flush the cursor.</li>
 * </ol>
 */
@Slf4j
public class IndexingService {

    private final PipelineConfig config;
    private final RelayTransport transport;
    private final ReconnectionManager reconnection;
    private final EventFilter filter;
    private final EventQueue queue;
    private final CursorManager cursor;
    private final FrameProcessor processor;
    private final DeadLetterHandler deadLetters;
    private final IndexerMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    private final PipelineCounters counters = new PipelineCounters();
    private final List<LaneWorker> workers = new ArrayList<>();
    private final List<Thread> workerThreads = new ArrayList<>();

    private FirehoseConsumer consumer;
    private Thread consumerThread;
    private ScheduledExecutorService scheduler;
    private volatile boolean running;
    private volatile Instant startedAt;

    public IndexingService(PipelineConfig config, RelayTransport transport, ReconnectionManager reconnection,
                           EventFilter filter, EventQueue queue, CursorManager cursor, FrameProcessor processor,
                           DeadLetterHandler deadLetters, IndexerMetrics metrics) {
        this(config, transport, reconnection, filter, queue, cursor, processor, deadLetters, metrics,
                Clock.systemUTC(), Sleeper.SYSTEM);
    }

    IndexingService(PipelineConfig config, RelayTransport transport, ReconnectionManager reconnection,
                    EventFilter filter, EventQueue queue, CursorManager cursor, FrameProcessor processor,
                    DeadLetterHandler deadLetters, IndexerMetrics metrics, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.transport = transport;
        this.reconnection = reconnection;
        this.filter = filter;
        this.queue = queue;
        this.cursor = cursor;
        this.processor = processor;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("Indexing service already running");
        }
        if (queue.isClosed()) {
            throw new IllegalStateException("Indexing service cannot be restarted once stopped");
        }

        cursor.load();
        metrics.bindCursor(cursor);
        metrics.bindQueue(queue);
        metrics.bindReconnection(reconnection);

        for (int lane = 0; lane < queue.laneCount(); lane++) {
            LaneWorker worker = new LaneWorker(lane, queue, processor, cursor, counters, sleeper);
            workers.add(worker);
            workerThreads.add(startThread(worker, "skein-lane-" + lane));
        }

        consumer = new FirehoseConsumer(transport, reconnection, filter, queue, cursor, metrics, counters, clock);
        consumerThread = startThread(consumer, "skein-firehose");

        scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "skein-scheduler");
            t.setDaemon(true);
            return t;
        });
        long flushMs = config.getCursor().getFlushIntervalMs();
        scheduler.scheduleAtFixedRate(named("skein-cursor-flush", this::flushCursorQuietly),
                flushMs, flushMs, TimeUnit.MILLISECONDS);

        long sweepMs = config.getDeadLetter().getSweepIntervalMs();
        if (sweepMs > 0) {
            DeadLetterSweeper sweeper = new DeadLetterSweeper(deadLetters, config.getDeadLetter());
            scheduler.scheduleWithFixedDelay(named("skein-dlq-sweep", sweeper), sweepMs, sweepMs,
                    TimeUnit.MILLISECONDS);
        }

        startedAt = clock.instant();
        running = true;
        log.info("Indexing service started: lanes={} queueCapacity={} relay={}",
                queue.laneCount(), queue.getCapacity(), config.getRelayUrl());
    }

    /**
     * Stops ingestion, drains in-flight frames and persists the final cursor.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Duration drainTimeout = Duration.ofMillis(config.getShutdown().getDrainTimeoutMs());
        log.info("Stopping indexing service: queued={} drainTimeout={}", queue.size(), drainTimeout);

        consumer.stop();
        queue.close();
        join(consumerThread, Duration.ofSeconds(5));

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        for (Thread thread : workerThreads) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            join(thread, Duration.ofMillis(Math.max(1, remainingMs)));
        }
        long stillBusy = workerThreads.stream().filter(Thread::isAlive).count();
        if (stillBusy > 0) {
            log.warn("{} lanes still busy after {}; they stop after their current saga attempt and the rest "
                    + "replays from the cursor", stillBusy, drainTimeout);
            workers.forEach(LaneWorker::halt);
            for (Thread thread : workerThreads) {
                awaitHalted(thread);
            }
        }

        scheduler.shutdown();
        try {
            cursor.flush();
        } catch (RuntimeException e) {
            log.error("Final cursor flush failed; up to one flush interval of frames will replay", e);
        }
        log.info("Indexing service stopped at cursor={} processed={}",
                cursor.getCommittedCursor(), counters.framesProcessed.get());
    }

    public boolean isRunning() {
        return running;
    }

    // ── Status ───────────────────────────────────────────────────────────

    public IndexingStatus status() {
        Instant started = startedAt;
        long processed = counters.framesProcessed.get();
        double perSecond = 0;
        if (started != null) {
            double seconds = Duration.between(started, clock.instant()).toMillis() / 1000.0;
            perSecond = seconds > 0 ? processed / seconds : 0;
        }
        return IndexingStatus.builder()
                .running(running)
                .connectionState(reconnection.getState())
                .sustainedOutage(reconnection.isSustainedOutage())
                .committedCursor(cursor.getCommittedCursor())
                .cursorLag(cursor.lag())
                .framesReceived(counters.framesReceived.get())
                .framesProcessed(processed)
                .framesPerSecond(perSecond)
                .framesDeadLettered(counters.framesDeadLettered.get())
                .errors(counters.unexpectedErrors.get())
                .queueDepth(queue.size())
                .deadLetterSize(deadLetters.count())
                .lastFrameAt(counters.lastFrameAt.get())
                .startedAt(started)
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private void flushCursorQuietly() {
        try {
            cursor.flush();
        } catch (RuntimeException e) {
            // the scheduler cancels a task that throws
            log.warn("Periodic cursor flush failed: {}", e.getMessage(), e);
        }
    }

    private static Thread startThread(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static Runnable named(String name, Runnable task) {
        return () -> {
            Thread current = Thread.currentThread();
            String previous = current.getName();
            current.setName(name);
            try {
                task.run();
            } finally {
                current.setName(previous);
            }
        };
    }

    private static void awaitHalted(Thread thread) {
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} to finish its current frame", thread.getName());
        }
    }

    private static void join(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}", thread.getName());
        }
    }
}
