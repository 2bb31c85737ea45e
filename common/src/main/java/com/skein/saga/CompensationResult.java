package com.skein.saga;

import com.skein.model.IndexingStage;
import lombok.Value;

/**
 * Result of undoing one committed stage.
 */
@Value
public class CompensationResult {

    IndexingStage stage;
    boolean succeeded;
    Throwable error;

    public static CompensationResult succeeded(IndexingStage stage) {
        return new CompensationResult(stage, true, null);
    }

    public static CompensationResult failed(IndexingStage stage, Throwable error) {
        return new CompensationResult(stage, false, error);
    }
}
