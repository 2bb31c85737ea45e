package com.skein.deadletter;

import com.skein.config.PipelineConfig;
import com.skein.failure.Classification;
import com.skein.saga.IndexingOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Periodic job that requeues retryable dead-letter entries, oldest first, and purges
 * entries past the retention period.
 */
@Slf4j
public class DeadLetterSweeper implements Runnable {

    private final DeadLetterHandler handler;
    private final int batchSize;
    private final Duration retention;

    public DeadLetterSweeper(DeadLetterHandler handler, PipelineConfig.DeadLetterSection config) {
        this.handler = handler;
        this.batchSize = config.getSweepBatchSize();
        this.retention = config.getRetentionDays() > 0 ? Duration.ofDays(config.getRetentionDays()) : null;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // the scheduler cancels a task that throws
            log.error("Dead-letter sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One sweep pass.
     *
     * @return number of entries that indexed successfully
     */
    public int sweep() {
        List<DeadLetterEntry> batch = handler.listEntries(DeadLetterQuery.builder()
                .classification(Classification.RETRYABLE)
                .orderBy(DeadLetterQuery.OrderBy.CREATED_AT)
                .ascending(true)
                .limit(batchSize)
                .build());

        int recovered = 0;
        for (DeadLetterEntry entry : batch) {
            IndexingOutcome outcome = handler.requeue(entry.getId());
            if (outcome.isSuccess()) {
                recovered++;
            }
        }
        int purged = retention == null ? 0 : handler.purgeOlderThan(retention);
        if (!batch.isEmpty() || purged > 0) {
            log.info("Dead-letter sweep: requeued={} recovered={} purged={}", batch.size(), recovered, purged);
        }
        return recovered;
    }
}
