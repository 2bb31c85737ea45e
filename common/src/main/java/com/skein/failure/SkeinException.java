package com.skein.failure;

/**
 * Base class for the indexer's own unchecked exceptions.
 */
public class SkeinException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SkeinException(String message) {
        super(message);
    }

    public SkeinException(String message, Throwable cause) {
        super(message, cause);
    }
}
