package com.skein.pipeline;

import com.skein.transport.ConnectionState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time snapshot of the indexer, for health endpoints and logs.
 */
@Value
@Builder
public class IndexingStatus {

    boolean running;
    ConnectionState connectionState;
    boolean sustainedOutage;

    long committedCursor;
    long cursorLag;

    long framesReceived;
    long framesProcessed;
    double framesPerSecond;
    long framesDeadLettered;
    long errors;

    int queueDepth;
    long deadLetterSize;

    Instant lastFrameAt;
    Instant startedAt;
}
