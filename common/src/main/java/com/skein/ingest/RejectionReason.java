package com.skein.ingest;

import com.skein.failure.FailureKind;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why the event filter did not turn a relay message into a commit frame.
 */
@Getter
@RequiredArgsConstructor
public enum RejectionReason {

    NON_COMMIT_EVENT(FailureKind.FILTERED_OUT),
    COLLECTION_NOT_INDEXED(FailureKind.FILTERED_OUT),

    UNDECODABLE_FRAME(FailureKind.VALIDATION_FAILURE),
    MISSING_SEQUENCE(FailureKind.VALIDATION_FAILURE),
    MALFORMED_REPO(FailureKind.VALIDATION_FAILURE),
    MALFORMED_PATH(FailureKind.VALIDATION_FAILURE),
    MALFORMED_COLLECTION(FailureKind.VALIDATION_FAILURE),
    MALFORMED_RKEY(FailureKind.VALIDATION_FAILURE),
    UNKNOWN_OPERATION(FailureKind.VALIDATION_FAILURE),
    MISSING_CID(FailureKind.VALIDATION_FAILURE),
    MISSING_RECORD(FailureKind.VALIDATION_FAILURE);

    private final FailureKind failureKind;

    public boolean isValidationFailure() {
        return failureKind == FailureKind.VALIDATION_FAILURE;
    }
}
