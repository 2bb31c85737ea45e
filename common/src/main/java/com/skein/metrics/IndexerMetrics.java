package com.skein.metrics;

import com.skein.cursor.CursorManager;
import com.skein.failure.FailureKind;
import com.skein.ingest.EventQueue;
import com.skein.ingest.RejectionReason;
import com.skein.model.IndexingStage;
import com.skein.transport.ConnectionState;
import com.skein.transport.ReconnectionManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;

/**
 * Micrometer meters for the indexer.
 *
 * <p>Counters and the saga timer are registered eagerly; gauges are bound to the live
 * components once they exist.  Tagged counters are looked up through the registry,
 * which caches them per tag set.</p>
 */
public class IndexerMetrics {

    private final MeterRegistry registry;

    private final Counter framesReceived;
    private final Counter framesIndexed;
    private final Counter framesRetried;
    private final Timer sagaDuration;

    public IndexerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.framesReceived = Counter.builder("skein.frames.received")
                .description("Frames read from the relay")
                .register(registry);

        this.framesIndexed = Counter.builder("skein.frames.indexed")
                .description("Frames whose projection was committed to every store")
                .register(registry);

        this.framesRetried = Counter.builder("skein.frames.retried")
                .description("In-place retries of retryable failures")
                .register(registry);

        this.sagaDuration = Timer.builder("skein.saga.duration")
                .description("Time taken by one indexing saga, compensation included")
                .register(registry);
    }

    /** Metrics backed by a private in-memory registry. */
    public static IndexerMetrics inMemory() {
        return new IndexerMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    // ── Counters ─────────────────────────────────────────────────────────

    public void frameReceived() {
        framesReceived.increment();
    }

    public void frameFiltered(RejectionReason reason) {
        Counter.builder("skein.frames.filtered")
                .description("Frames dropped by the event filter")
                .tag("reason", tagValue(reason.name()))
                .tag("kind", tagValue(reason.getFailureKind().name()))
                .register(registry)
                .increment();
    }

    public void frameIndexed() {
        framesIndexed.increment();
    }

    public void frameRetried() {
        framesRetried.increment();
    }

    public void frameDeadLettered(FailureKind kind) {
        Counter.builder("skein.frames.dead_lettered")
                .description("Frames moved to the dead-letter store")
                .tag("kind", tagValue(kind.name()))
                .register(registry)
                .increment();
    }

    public void compensation(IndexingStage stage, boolean succeeded) {
        Counter.builder("skein.saga.compensations")
                .description("Compensating deletes run after a later stage failed")
                .tag("stage", tagValue(stage.name()))
                .tag("result", succeeded ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void deleteFailure(IndexingStage stage) {
        Counter.builder("skein.saga.delete_failures")
                .description("Per-store failures while deleting a record")
                .tag("stage", tagValue(stage.name()))
                .register(registry)
                .increment();
    }

    // ── Timer ────────────────────────────────────────────────────────────

    public Timer.Sample startSaga() {
        return Timer.start(registry);
    }

    public void stopSaga(Timer.Sample sample) {
        sample.stop(sagaDuration);
    }

    // ── Gauges bound to live components ─────────────────────────────────

    public void bindCursor(CursorManager cursorManager) {
        Gauge.builder("skein.cursor.committed", cursorManager, CursorManager::getCommittedCursor)
                .description("Highest sequence with every earlier frame resolved")
                .register(registry);
        Gauge.builder("skein.cursor.lag", cursorManager, CursorManager::lag)
                .description("Highest received sequence minus the committed cursor")
                .register(registry);
    }

    public void bindQueue(EventQueue queue) {
        Gauge.builder("skein.queue.depth", queue, EventQueue::size)
                .description("Frames buffered between the transport and the workers")
                .register(registry);
    }

    public void bindReconnection(ReconnectionManager reconnectionManager) {
        FunctionCounter.builder("skein.relay.reconnect_attempts", reconnectionManager,
                        ReconnectionManager::getFailedAttempts)
                .description("Failed relay connection attempts")
                .register(registry);
        Gauge.builder("skein.relay.connected", reconnectionManager,
                        m -> m.getState() == ConnectionState.CONNECTED ? 1 : 0)
                .description("1 while the relay stream is connected")
                .register(registry);
    }

    private static String tagValue(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
