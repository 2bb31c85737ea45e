package com.skein.reindex;

import com.skein.dispatch.ProcessingResult;
import lombok.Value;

/**
 * What a manual reindex request did.
 */
@Value
public class ReindexResult {

    public enum Status {
        /** The current record was written to the stores. */
        INDEXED,
        /** The origin reports the record gone; it was removed from the stores. */
        DELETED,
        /** Processing failed and the frame was dead-lettered. */
        DEAD_LETTERED,
        /** The frame resolved without writing anything (no handler for the kind). */
        SKIPPED,
        /** The reference is malformed or names a collection this indexer does not project. */
        REJECTED,
        /** The record could not be fetched from its origin. */
        FETCH_FAILED
    }

    String uri;
    Status status;
    String message;
    ProcessingResult processing;

    public boolean isSuccess() {
        return status == Status.INDEXED || status == Status.DELETED || status == Status.SKIPPED;
    }

    static ReindexResult of(String uri, Status status, String message) {
        return new ReindexResult(uri, status, message, null);
    }
}
