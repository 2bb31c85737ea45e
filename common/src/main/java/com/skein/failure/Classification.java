package com.skein.failure;

/**
 * Whether a processing failure is worth another attempt.
 */
public enum Classification {

    /** Connectivity, timeout or resource exhaustion in a store. */
    RETRYABLE,

    /** Malformed content, constraint violation or schema mismatch. */
    TERMINAL
}
