package com.skein.ingest;

import com.skein.metrics.IndexerMetrics;
import com.skein.model.CommitFrame;
import com.skein.model.CommitOperation;
import com.skein.transport.RelayMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw relay messages into validated {@link CommitFrame}s.
 *
 * <p>Checks run cheapest first.  Non-commit events and collections outside the interest
 * set are dropped silently as {@code FILTERED_OUT}; anything in the interest set that is
 * malformed is a {@code VALIDATION_FAILURE}, logged at WARN and never retried.</p>
 *
 * <p>A commit may carry several operations; each is checked on its own and every accepted
 * one becomes a frame sharing the commit's sequence.  Undecodable messages are rejected
 * as validation failures so the stream moves on past them.</p>
 *
 * <p>Interest entries are exact NSIDs or {@code prefix.*} wildcards.</p>
 */
@Slf4j
public class EventFilter {

    static final Pattern DID = Pattern.compile("^did:[a-z]+:[a-zA-Z0-9._:%-]+$");
    static final Pattern NSID = Pattern.compile(
            "^[a-zA-Z][a-zA-Z0-9-]*(\\.[a-zA-Z0-9][a-zA-Z0-9-]*)+\\.[a-zA-Z][a-zA-Z0-9]*$");
    static final Pattern RKEY = Pattern.compile("^[a-zA-Z0-9._:~-]{1,512}$");

    private final Set<String> exact = new HashSet<>();
    private final List<String> prefixes = new ArrayList<>();
    private final IndexerMetrics metrics;

    public EventFilter(Collection<String> collections, IndexerMetrics metrics) {
        for (String entry : collections) {
            if (entry.endsWith(".*")) {
                prefixes.add(entry.substring(0, entry.length() - 1));
            } else {
                exact.add(entry);
            }
        }
        this.metrics = metrics;
        log.info("Event filter: collections={} prefixes={}", exact, prefixes);
    }

    public boolean isInterested(String collection) {
        if (exact.contains(collection)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (collection.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Filters one relay message.  A commit yields one result per operation, in order;
     * any other message, or a commit rejected as a whole, yields a single rejection.
     */
    public List<FilterResult> filter(RelayMessage message) {
        List<FilterResult> results = evaluate(message);
        for (FilterResult result : results) {
            if (!result.isAccepted()) {
                record(result);
            }
        }
        return results;
    }

    private void record(FilterResult result) {
        metrics.frameFiltered(result.getReason());
        if (result.getReason().isValidationFailure()) {
            log.warn("Dropping invalid frame seq={} reason={}: {}",
                    result.getSequence(), result.getReason(), result.getDetail());
        } else if (log.isDebugEnabled()) {
            log.debug("Filtered out seq={} reason={} detail={}",
                    result.getSequence(), result.getReason(), result.getDetail());
        }
    }

    private List<FilterResult> evaluate(RelayMessage message) {
        Long seq = message.getSeq();
        if (message.isUndecodable()) {
            return List.of(FilterResult.rejected(RejectionReason.UNDECODABLE_FRAME, message.getDecodeError(), seq));
        }
        if (!message.isCommit()) {
            return List.of(FilterResult.rejected(RejectionReason.NON_COMMIT_EVENT, message.kind(), seq));
        }
        List<RelayMessage.RepoOp> ops = message.operations();
        if (ops.isEmpty()) {
            return List.of(FilterResult.rejected(RejectionReason.MALFORMED_PATH, "commit without an operation", seq));
        }

        List<FilterResult> results = new ArrayList<>(ops.size());
        for (RelayMessage.RepoOp op : ops) {
            results.add(evaluate(message, op));
        }
        return results;
    }

    private FilterResult evaluate(RelayMessage message, RelayMessage.RepoOp op) {
        Long seq = message.getSeq();
        if (op == null || op.getPath() == null) {
            return FilterResult.rejected(RejectionReason.MALFORMED_PATH, "operation without a path", seq);
        }
        int slash = op.getPath().indexOf('/');
        if (slash <= 0 || slash != op.getPath().lastIndexOf('/')) {
            return FilterResult.rejected(RejectionReason.MALFORMED_PATH, op.getPath(), seq);
        }
        String collection = op.getPath().substring(0, slash);
        String rkey = op.getPath().substring(slash + 1);

        if (!isInterested(collection)) {
            return FilterResult.rejected(RejectionReason.COLLECTION_NOT_INDEXED, collection, seq);
        }

        if (seq == null || seq <= 0) {
            return FilterResult.rejected(RejectionReason.MISSING_SEQUENCE, "seq=" + seq, seq);
        }
        if (message.getRepo() == null || !DID.matcher(message.getRepo()).matches()) {
            return FilterResult.rejected(RejectionReason.MALFORMED_REPO, String.valueOf(message.getRepo()), seq);
        }
        if (!NSID.matcher(collection).matches()) {
            return FilterResult.rejected(RejectionReason.MALFORMED_COLLECTION, collection, seq);
        }
        if (!RKEY.matcher(rkey).matches() || ".".equals(rkey) || "..".equals(rkey)) {
            return FilterResult.rejected(RejectionReason.MALFORMED_RKEY, rkey, seq);
        }

        CommitOperation operation = CommitOperation.fromWire(op.getAction());
        if (operation == null) {
            return FilterResult.rejected(RejectionReason.UNKNOWN_OPERATION, String.valueOf(op.getAction()), seq);
        }
        if (operation.carriesRecord()) {
            if (op.getCid() == null || op.getCid().isBlank()) {
                return FilterResult.rejected(RejectionReason.MISSING_CID, op.getPath(), seq);
            }
            if (op.getRecord() == null || !op.getRecord().isObject()) {
                return FilterResult.rejected(RejectionReason.MISSING_RECORD, op.getPath(), seq);
            }
        }

        return FilterResult.accepted(CommitFrame.builder()
                .repo(message.getRepo())
                .collection(collection)
                .rkey(rkey)
                .operation(operation)
                .cid(operation.carriesRecord() ? op.getCid() : null)
                .record(operation.carriesRecord() ? op.getRecord() : null)
                .sequence(seq)
                .time(message.getTime())
                .build());
    }
}
