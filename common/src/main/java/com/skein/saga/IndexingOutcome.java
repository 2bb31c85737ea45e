package com.skein.saga;

import com.skein.failure.Classification;
import com.skein.failure.FailureKind;
import com.skein.model.EntityReference;
import com.skein.model.IndexingStage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of indexing or deleting one entity.
 *
 * <p>On success {@code committedStages} lists every store written.  On failure it lists
 * the stages that had committed before {@code failedStage} failed, all of which were
 * compensated (see {@code compensations}).  {@code failedStage} is {@code null} when the
 * failure happened while deriving the projection.</p>
 *
 * <p>{@code cleanupFailures} collects per-store errors that did not fail the outcome,
 * such as a search-index delete that failed after the relational delete succeeded.</p>
 */
@Value
@Builder
public class IndexingOutcome {

    EntityReference reference;
    boolean success;

    @Singular
    List<IndexingStage> committedStages;

    IndexingStage failedStage;
    Throwable error;
    FailureKind failureKind;
    Classification classification;

    @Singular
    List<CompensationResult> compensations;

    @Singular
    Map<IndexingStage, Throwable> cleanupFailures;

    public static IndexingOutcome success(EntityReference reference, List<IndexingStage> stages) {
        return IndexingOutcome.builder()
                .reference(reference)
                .success(true)
                .committedStages(stages)
                .build();
    }

    /** A frame that resolved without writing anything. */
    public static IndexingOutcome nothingToDo(EntityReference reference) {
        return IndexingOutcome.builder()
                .reference(reference)
                .success(true)
                .build();
    }

    public boolean isRetryable() {
        return !success && classification == Classification.RETRYABLE;
    }

    public boolean isFullyCompensated() {
        return compensations.stream().allMatch(CompensationResult::isSucceeded);
    }

    public String describe() {
        if (success) {
            return "success uri=" + reference + " stages=" + committedStages;
        }
        return "failure uri=" + reference + " kind=" + failureKind + " classification=" + classification
                + " failedStage=" + failedStage + " committed=" + committedStages
                + " error=" + (error == null ? "none" : error.getMessage());
    }
}
