package com.skein.failure;

/**
 * Outcome taxonomy for frames that did not index cleanly.
 */
public enum FailureKind {

    /** Collection outside the interest set or non-commit event; expected, not an error. */
    FILTERED_OUT,

    /** Malformed frame or record content; can never succeed, never retried. */
    VALIDATION_FAILURE,

    /** A store or network fault before any stage committed; retryable. */
    TRANSIENT_STORE_FAILURE,

    /** A saga stage failed after earlier stages committed; compensated before surfacing. */
    PARTIAL_INDEX_FAILURE,

    /** Retry budget exhausted. */
    POISON_FRAME
}
