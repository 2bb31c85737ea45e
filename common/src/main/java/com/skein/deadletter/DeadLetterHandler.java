package com.skein.deadletter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skein.config.PipelineConfig;
import com.skein.cursor.EntitySequenceStore;
import com.skein.dispatch.CommitDispatcher;
import com.skein.failure.Classification;
import com.skein.failure.FailureKind;
import com.skein.failure.SkeinException;
import com.skein.metrics.IndexerMetrics;
import com.skein.model.CommitFrame;
import com.skein.saga.IndexingOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

/**
 * Owns the dead-letter store: frames that failed terminally or ran out of retries land
 * here with their failure, and can later be listed, requeued or purged.
 *
 * <p>After every insert the store depth is compared with the warning and critical
 * thresholds and logged at WARN or ERROR respectively.</p>
 *
 * <p>{@link #requeue(long)} resubmits the stored frame through the dispatcher once, as a
 * synthetic frame that never touches the cursor.  Success removes the entry and records
 * its sequence as applied; failure bumps its retry count.  An entry whose entity has
 * since been applied at the same or a later sequence is superseded: it is removed
 * without being dispatched.</p>
 */
@Slf4j
public class DeadLetterHandler {

    private final DeadLetterStore store;
    private final EntitySequenceStore sequences;
    private final CommitDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final IndexerMetrics metrics;
    private final int warningThreshold;
    private final int criticalThreshold;
    private final Clock clock;

    public DeadLetterHandler(DeadLetterStore store, EntitySequenceStore sequences, CommitDispatcher dispatcher,
                             ObjectMapper objectMapper, IndexerMetrics metrics,
                             PipelineConfig.DeadLetterSection config) {
        this(store, sequences, dispatcher, objectMapper, metrics, config, Clock.systemUTC());
    }

    public DeadLetterHandler(DeadLetterStore store, EntitySequenceStore sequences, CommitDispatcher dispatcher,
                             ObjectMapper objectMapper, IndexerMetrics metrics,
                             PipelineConfig.DeadLetterSection config, Clock clock) {
        this.store = store;
        this.sequences = sequences;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.warningThreshold = config.getWarningThreshold();
        this.criticalThreshold = config.getCriticalThreshold();
        this.clock = clock;
    }

    // ── Writing ──────────────────────────────────────────────────────────

    /**
     * Records a frame as dead-lettered.
     *
     * @param retryCount   in-place retries made before giving up
     * @param firstFailure time of the first failed attempt
     * @return the stored entry, with its id
     */
    public DeadLetterEntry deadLetter(CommitFrame frame, FailureKind kind, Classification classification,
                                      Throwable error, int retryCount, Instant firstFailure) {
        Instant now = clock.instant();
        DeadLetterEntry entry = DeadLetterEntry.builder()
                .sequence(frame.getSequence())
                .repo(frame.getRepo())
                .uri(frame.entityReference().getUri())
                .collection(frame.getCollection())
                .operation(frame.getOperation().wireName())
                .frameJson(serialize(frame))
                .failureKind(kind)
                .classification(classification)
                .errorMessage(describe(error))
                .retryCount(retryCount)
                .firstFailureAt(firstFailure == null ? now : firstFailure)
                .lastFailureAt(now)
                .build();

        long id = store.insert(entry);
        metrics.frameDeadLettered(kind);
        log.warn("Dead-lettered {} id={} kind={} classification={} retries={} error={}",
                frame.describe(), id, kind, classification, retryCount, entry.getErrorMessage());
        checkThresholds();
        return entry.toBuilder().id(id).build();
    }

    private void checkThresholds() {
        long depth = store.count();
        if (depth >= criticalThreshold) {
            log.error("Dead-letter store depth={} reached critical threshold={}", depth, criticalThreshold);
        } else if (depth >= warningThreshold) {
            log.warn("Dead-letter store depth={} reached warning threshold={}", depth, warningThreshold);
        }
    }

    // ── Requeue ──────────────────────────────────────────────────────────

    /**
     * Resubmits one entry through the dispatcher.
     *
     * @throws IllegalArgumentException if no entry has this id
     */
    public IndexingOutcome requeue(long id) {
        DeadLetterEntry entry = store.find(id)
                .orElseThrow(() -> new IllegalArgumentException("No dead-letter entry id=" + id));

        CommitFrame frame = deserialize(entry).toBuilder().synthetic(true).build();
        OptionalLong applied = sequences.lastApplied(frame.entityReference());
        if (applied.isPresent() && applied.getAsLong() >= entry.getSequence()) {
            store.delete(id);
            log.info("Dead-letter id={} {} superseded by applied seq={}, entry removed",
                    id, frame.describe(), applied.getAsLong());
            return IndexingOutcome.nothingToDo(frame.entityReference());
        }

        IndexingOutcome outcome = dispatcher.dispatch(frame);
        if (outcome.isSuccess()) {
            sequences.recordApplied(frame.entityReference(), entry.getSequence());
            store.delete(id);
            log.info("Requeued dead-letter id={} {}: indexed, entry removed", id, frame.describe());
        } else {
            store.recordRetryFailure(id, describe(outcome.getError()), clock.instant());
            log.warn("Requeued dead-letter id={} {} failed again: {}", id, frame.describe(), outcome.describe());
        }
        return outcome;
    }

    // ── Administration ───────────────────────────────────────────────────

    public List<DeadLetterEntry> listEntries(DeadLetterQuery query) {
        return store.list(query);
    }

    public DeadLetterStats stats() {
        return store.stats();
    }

    public long count() {
        return store.count();
    }

    public boolean delete(long id) {
        boolean removed = store.delete(id);
        if (removed) {
            log.info("Deleted dead-letter entry id={}", id);
        }
        return removed;
    }

    public int purgeOlderThan(Duration age) {
        int removed = store.purgeOlderThan(clock.instant().minus(age));
        if (removed > 0) {
            log.info("Purged {} dead-letter entries older than {}", removed, age);
        }
        return removed;
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private String serialize(CommitFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new SkeinException("Could not serialize " + frame.describe() + " for the dead-letter store", e);
        }
    }

    private CommitFrame deserialize(DeadLetterEntry entry) {
        try {
            return objectMapper.readValue(entry.getFrameJson(), CommitFrame.class);
        } catch (JsonProcessingException e) {
            throw new SkeinException("Dead-letter entry id=" + entry.getId() + " holds an unreadable frame", e);
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
