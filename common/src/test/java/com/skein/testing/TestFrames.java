package com.skein.testing;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skein.model.CommitFrame;
import com.skein.model.CommitOperation;
import com.skein.transport.RelayMessage;

import java.util.List;

/**
 * Relay messages and frames for tests.
 */
public final class TestFrames {

    public static final String REPO = "did:plc:alice123";
    public static final String COLLECTION = "pub.chive.eprint.submission";

    private TestFrames() {
    }

    public static ObjectNode record(String title) {
        ObjectNode record = JsonNodeFactory.instance.objectNode();
        record.put("$type", COLLECTION);
        record.put("title", title);
        return record;
    }

    public static RelayMessage commit(long seq, String action, String path) {
        return RelayMessage.builder()
                .type(RelayMessage.typeOf(RelayMessage.KIND_COMMIT))
                .seq(seq)
                .repo(REPO)
                .time("2024-05-01T12:00:00Z")
                .op(op(seq, action, path))
                .build();
    }

    /** A commit carrying several operations under one sequence number. */
    public static RelayMessage commit(long seq, RelayMessage.RepoOp... ops) {
        return RelayMessage.builder()
                .type(RelayMessage.typeOf(RelayMessage.KIND_COMMIT))
                .seq(seq)
                .repo(REPO)
                .time("2024-05-01T12:00:00Z")
                .ops(List.of(ops))
                .build();
    }

    public static RelayMessage.RepoOp op(long seq, String action, String path) {
        boolean carriesRecord = !"delete".equals(action);
        return RelayMessage.RepoOp.builder()
                .action(action)
                .path(path)
                .cid(carriesRecord ? "bafyrei" + seq : null)
                .record(carriesRecord ? record("Title " + seq) : null)
                .build();
    }

    public static RelayMessage create(long seq, String rkey) {
        return commit(seq, "create", COLLECTION + "/" + rkey);
    }

    public static RelayMessage identity(long seq) {
        return RelayMessage.builder()
                .type(RelayMessage.typeOf(RelayMessage.KIND_IDENTITY))
                .seq(seq)
                .did(REPO)
                .build();
    }

    public static CommitFrame frame(long seq, String rkey, CommitOperation operation) {
        return CommitFrame.builder()
                .repo(REPO)
                .collection(COLLECTION)
                .rkey(rkey)
                .operation(operation)
                .cid(operation.carriesRecord() ? "bafyrei" + seq : null)
                .record(operation.carriesRecord() ? record("Title " + seq) : null)
                .sequence(seq)
                .time("2024-05-01T12:00:00Z")
                .build();
    }

    public static CommitFrame create(long seq, String rkey, String repo) {
        return frame(seq, rkey, CommitOperation.CREATE).toBuilder().repo(repo).build();
    }
}
