package com.skein.failure;

import lombok.Getter;

/**
 * The record content itself is unusable: wrong shape, missing required values, or
 * rejected by a store constraint.  Never retryable.
 */
@Getter
public class RecordValidationException extends SkeinException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public RecordValidationException(String message) {
        this(message, null, null);
    }

    public RecordValidationException(String message, String field) {
        this(message, field, null);
    }

    public RecordValidationException(String message, String field, Throwable cause) {
        super(message, cause);
        this.field = field;
    }
}
