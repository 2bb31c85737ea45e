package com.skein.deadletter;

import com.skein.failure.Classification;
import com.skein.failure.FailureKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A frame taken out of the retry path, with the failure that put it there.
 *
 * <p>{@code frameJson} is the full serialized {@link com.skein.model.CommitFrame}, enough to
 * resubmit it without the relay.</p>
 */
@Value
@Builder(toBuilder = true)
public class DeadLetterEntry {

    long id;
    long sequence;
    String repo;
    String uri;
    String collection;
    String operation;
    String frameJson;
    FailureKind failureKind;
    Classification classification;
    String errorMessage;
    int retryCount;
    Instant firstFailureAt;
    Instant lastFailureAt;
}
