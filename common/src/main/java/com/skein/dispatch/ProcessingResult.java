package com.skein.dispatch;

import com.skein.saga.IndexingOutcome;
import lombok.Value;

/**
 * How a frame left the processing path.
 */
@Value
public class ProcessingResult {

    public enum Status {
        /** Written to (or deleted from) the stores. */
        INDEXED,
        /** Moved to the dead-letter store. */
        DEAD_LETTERED,
        /** Resolved without touching any store. */
        SKIPPED,
        /** Given up on between retries because the lane was halted; not resolved. */
        ABANDONED
    }

    Status status;
    IndexingOutcome outcome;
    /** Dispatch attempts made, the first one included. */
    int attempts;
}
