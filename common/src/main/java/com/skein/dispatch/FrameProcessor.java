package com.skein.dispatch;

import com.skein.config.PipelineConfig;
import com.skein.cursor.EntitySequenceStore;
import com.skein.deadletter.DeadLetterHandler;
import com.skein.failure.Classification;
import com.skein.failure.FailureKind;
import com.skein.metrics.IndexerMetrics;
import com.skein.model.CommitFrame;
import com.skein.saga.IndexingOutcome;
import com.skein.transport.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.function.BooleanSupplier;

/**
 * Applies the retry and dead-letter policy around {@link CommitDispatcher#dispatch}.
 *
 * <ul>
 *   <li>Success: {@code INDEXED}, or {@code SKIPPED} when nothing was written.</li>
 *   <li>Terminal failure: dead-lettered at once with the outcome's failure kind.</li>
 *   <li>Retryable failure: retried in place with exponential backoff, up to
 *       {@code maxRetries} times after the first attempt; a frame still failing after
 *       that is dead-lettered as {@link FailureKind#POISON_FRAME} with
 *       {@code retryCount == maxRetries}.</li>
 * </ul>
 *
 * <p>Retries run on the calling lane thread, so later frames of the same lane wait
 * behind the failing one and per-entity order holds.</p>
 *
 * <p>Firehose frames are checked against the {@link EntitySequenceStore}: a frame older
 * than the last one applied to its entity is {@code SKIPPED} without dispatch, and a frame
 * that indexes successfully records its sequence.  Synthetic frames bypass both.</p>
 */
@Slf4j
public class FrameProcessor {

    private final CommitDispatcher dispatcher;
    private final DeadLetterHandler deadLetters;
    private final EntitySequenceStore sequences;
    private final IndexerMetrics metrics;
    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;
    private final Clock clock;

    public FrameProcessor(CommitDispatcher dispatcher, DeadLetterHandler deadLetters, EntitySequenceStore sequences,
                          IndexerMetrics metrics, PipelineConfig.RetrySection retry) {
        this(dispatcher, deadLetters, sequences, metrics, retry, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public FrameProcessor(CommitDispatcher dispatcher, DeadLetterHandler deadLetters, EntitySequenceStore sequences,
                          IndexerMetrics metrics, PipelineConfig.RetrySection retry, Sleeper sleeper, Clock clock) {
        this.dispatcher = dispatcher;
        this.deadLetters = deadLetters;
        this.sequences = sequences;
        this.metrics = metrics;
        this.maxRetries = retry.getMaxRetries();
        this.initialDelay = Duration.ofMillis(retry.getInitialDelayMs());
        this.maxDelay = Duration.ofMillis(retry.getMaxDelayMs());
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Processes one frame to resolution.
     *
     * @throws InterruptedException if interrupted while waiting between retries; the
     *                              frame is then unresolved and will be replayed
     */
    public ProcessingResult process(CommitFrame frame) throws InterruptedException {
        return process(frame, () -> false);
    }

    /**
     * Processes one frame, giving up before a retry wait once {@code halted} returns true.
     * A frame given up on is {@code ABANDONED}: neither indexed nor dead-lettered.
     */
    public ProcessingResult process(CommitFrame frame, BooleanSupplier halted) throws InterruptedException {
        if (isStale(frame)) {
            return new ProcessingResult(ProcessingResult.Status.SKIPPED,
                    IndexingOutcome.nothingToDo(frame.entityReference()), 0);
        }

        Instant firstFailure = null;
        int retries = 0;
        while (true) {
            IndexingOutcome outcome = dispatcher.dispatch(frame);
            if (outcome.isSuccess()) {
                if (!frame.isSynthetic()) {
                    sequences.recordApplied(frame.entityReference(), frame.getSequence());
                }
                if (outcome.getCommittedStages().isEmpty()) {
                    return new ProcessingResult(ProcessingResult.Status.SKIPPED, outcome, retries + 1);
                }
                metrics.frameIndexed();
                if (retries > 0) {
                    log.info("Recovered {} after {} retries", frame.describe(), retries);
                }
                return new ProcessingResult(ProcessingResult.Status.INDEXED, outcome, retries + 1);
            }

            if (firstFailure == null) {
                firstFailure = clock.instant();
            }
            log.warn("Attempt {} failed for {}: {}", retries + 1, frame.describe(), outcome.describe());

            if (outcome.getClassification() == Classification.TERMINAL) {
                deadLetters.deadLetter(frame, outcome.getFailureKind(), outcome.getClassification(),
                        outcome.getError(), retries, firstFailure);
                return new ProcessingResult(ProcessingResult.Status.DEAD_LETTERED, outcome, retries + 1);
            }
            if (retries >= maxRetries) {
                deadLetters.deadLetter(frame, FailureKind.POISON_FRAME, outcome.getClassification(),
                        outcome.getError(), retries, firstFailure);
                return new ProcessingResult(ProcessingResult.Status.DEAD_LETTERED, outcome, retries + 1);
            }

            if (halted.getAsBoolean()) {
                log.warn("Abandoning {} after {} attempts; it replays from the cursor", frame.describe(), retries + 1);
                return new ProcessingResult(ProcessingResult.Status.ABANDONED, outcome, retries + 1);
            }

            Duration delay = retryDelay(retries);
            retries++;
            metrics.frameRetried();
            log.info("Retrying {} in {} ms (retry {}/{})", frame.describe(), delay.toMillis(), retries, maxRetries);
            sleeper.sleep(delay);
        }
    }

    private boolean isStale(CommitFrame frame) {
        if (frame.isSynthetic()) {
            return false;
        }
        OptionalLong last = sequences.lastApplied(frame.entityReference());
        if (last.isPresent() && last.getAsLong() > frame.getSequence()) {
            log.info("Skipping stale {}: seq={} already applied", frame.describe(), last.getAsLong());
            return true;
        }
        return false;
    }

    Duration retryDelay(int retry) {
        long base = initialDelay.toMillis();
        long cap = maxDelay.toMillis();
        int shift = Math.min(retry, 30);
        long delay = base > (cap >> shift) ? cap : Math.min(cap, base << shift);
        return Duration.ofMillis(delay);
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
