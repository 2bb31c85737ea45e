package com.skein.pipeline;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running totals shared by the consumer and the lane workers, read by {@link IndexingStatus}.
 */
class PipelineCounters {

    final AtomicLong framesReceived = new AtomicLong();
    final AtomicLong framesProcessed = new AtomicLong();
    final AtomicLong framesDeadLettered = new AtomicLong();
    final AtomicLong unexpectedErrors = new AtomicLong();
    final AtomicReference<Instant> lastFrameAt = new AtomicReference<>();
}
