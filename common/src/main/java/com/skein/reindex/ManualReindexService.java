package com.skein.reindex;

import com.skein.dispatch.FrameProcessor;
import com.skein.dispatch.ProcessingResult;
import com.skein.ingest.EventFilter;
import com.skein.model.CommitFrame;
import com.skein.model.CommitOperation;
import com.skein.model.EntityReference;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * Re-indexes a single record on request, outside the firehose.
 *
 * <p>The current record is fetched from its origin and turned into a synthetic frame:
 * an {@code UPDATE} carrying the fetched record, or a {@code DELETE} when the origin
 * reports it gone.  The frame runs through the same {@link FrameProcessor} as firehose
 * traffic, synchronously on the caller's thread, and never moves the cursor.</p>
 *
 * <p>The frame does not go through the queue lanes.  A firehose frame for the same
 * entity may be processed concurrently; both write the record's current state and
 * the last writer wins.</p>
 */
@Slf4j
public class ManualReindexService {

    private final RecordFetcher fetcher;
    private final FrameProcessor processor;
    private final EventFilter filter;

    public ManualReindexService(RecordFetcher fetcher, FrameProcessor processor, EventFilter filter) {
        this.fetcher = fetcher;
        this.processor = processor;
        this.filter = filter;
    }

    public ReindexResult reindex(String atUri) throws InterruptedException {
        EntityReference ref;
        try {
            ref = EntityReference.parse(atUri);
        } catch (IllegalArgumentException e) {
            return ReindexResult.of(atUri, ReindexResult.Status.REJECTED, e.getMessage());
        }
        if (!filter.isInterested(ref.getCollection())) {
            return ReindexResult.of(atUri, ReindexResult.Status.REJECTED,
                    "Collection " + ref.getCollection() + " is not indexed");
        }

        Optional<FetchedRecord> fetched;
        try {
            fetched = fetcher.fetch(ref);
        } catch (IOException e) {
            log.warn("Manual reindex could not fetch {}: {}", atUri, e.getMessage());
            return ReindexResult.of(atUri, ReindexResult.Status.FETCH_FAILED, e.getMessage());
        }

        CommitFrame frame = syntheticFrame(ref, fetched);
        log.info("Manual reindex {}", frame.describe());
        ProcessingResult result = processor.process(frame);
        return new ReindexResult(atUri, statusOf(frame, result), describe(result), result);
    }

    private static CommitFrame syntheticFrame(EntityReference ref, Optional<FetchedRecord> fetched) {
        CommitFrame.CommitFrameBuilder builder = CommitFrame.builder()
                .repo(ref.getRepo())
                .collection(ref.getCollection())
                .rkey(ref.getRkey())
                .synthetic(true);
        if (fetched.isPresent()) {
            builder.operation(CommitOperation.UPDATE)
                    .cid(fetched.get().getCid())
                    .record(fetched.get().getValue());
        } else {
            builder.operation(CommitOperation.DELETE);
        }
        return builder.build();
    }

    private static ReindexResult.Status statusOf(CommitFrame frame, ProcessingResult result) {
        switch (result.getStatus()) {
            case INDEXED:
                return frame.getOperation() == CommitOperation.DELETE
                        ? ReindexResult.Status.DELETED
                        : ReindexResult.Status.INDEXED;
            case DEAD_LETTERED:
                return ReindexResult.Status.DEAD_LETTERED;
            case SKIPPED:
            default:
                return ReindexResult.Status.SKIPPED;
        }
    }

    private static String describe(ProcessingResult result) {
        if (result.getOutcome() == null) {
            return result.getStatus().name();
        }
        return result.getOutcome().describe();
    }
}
