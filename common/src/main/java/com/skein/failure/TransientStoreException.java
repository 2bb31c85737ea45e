package com.skein.failure;

import com.skein.model.IndexingStage;
import lombok.Getter;

/**
 * A store could not be reached or did not answer in time.  Always retryable.
 */
@Getter
public class TransientStoreException extends SkeinException {

    private static final long serialVersionUID = 1L;

    private final IndexingStage stage;

    public TransientStoreException(IndexingStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public TransientStoreException(IndexingStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
