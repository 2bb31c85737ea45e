package com.skein.deadletter;

import com.skein.failure.FailureKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class DeadLetterStats {

    long total;

    @Singular("countByKind")
    Map<FailureKind, Long> countsByKind;

    /** First failure time of the oldest entry; {@code null} when empty. */
    Instant oldest;

    Instant newest;
}
