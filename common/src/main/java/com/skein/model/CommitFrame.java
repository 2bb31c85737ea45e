package com.skein.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A validated, single-record commit event taken off the firehose.
 *
 * <p>Frames are produced by {@link com.skein.ingest.EventFilter} from raw relay messages,
 * so every instance has a well-formed repository DID, collection NSID and record key,
 * and carries a record body and content hash whenever the operation is a create or update.</p>
 *
 * <p>{@code synthetic} frames are built outside the firehose (manual reindex, dead-letter
 * requeue). Their {@code sequence} is informational only and they never move the cursor.</p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CommitFrame {

    String repo;
    String collection;
    String rkey;
    CommitOperation operation;
    String cid;
    JsonNode record;
    long sequence;
    String time;
    boolean synthetic;

    @JsonIgnore
    public EntityReference entityReference() {
        return EntityReference.of(repo, collection, rkey);
    }

    /** Short context string for log lines. */
    @JsonIgnore
    public String describe() {
        return "seq=" + sequence + " op=" + operation.wireName() + " uri=at://"
                + repo + "/" + collection + "/" + rkey;
    }
}
