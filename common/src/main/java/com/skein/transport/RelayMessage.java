package com.skein.transport;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A raw frame as it arrives from the relay, before any validation.
 *
 * <p>The {@code $type} discriminator names the event kind, e.g.
 * {@code com.atproto.sync.subscribeRepos#commit}.  Only commit frames carry
 * {@link RepoOp}s, either a list in {@code ops} or a single {@code op}; identity, account
 * and info frames carry just a sequence number and the DID they concern.</p>
 *
 * <p>A frame the transport could not decode arrives as an {@linkplain #undecodable
 * undecodable} message that keeps only its sequence, when that much could be read.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelayMessage {

    public static final String KIND_COMMIT = "commit";
    public static final String KIND_IDENTITY = "identity";
    public static final String KIND_ACCOUNT = "account";
    public static final String KIND_INFO = "info";

    private static final String TYPE_PREFIX = "com.atproto.sync.subscribeRepos#";

    @JsonProperty("$type")
    private String type;

    private Long seq;
    private String repo;
    private String did;
    private String time;
    private RepoOp op;
    private List<RepoOp> ops;

    @JsonIgnore
    private String decodeError;

    public static RelayMessage undecodable(Long seq, String decodeError) {
        return RelayMessage.builder().seq(seq).decodeError(decodeError).build();
    }

    @JsonIgnore
    public boolean isUndecodable() {
        return decodeError != null;
    }

    /**
     * Operations carried by a commit: {@code ops} when present and non-empty, otherwise
     * the single {@code op}, otherwise none.
     */
    @JsonIgnore
    public List<RepoOp> operations() {
        if (ops != null && !ops.isEmpty()) {
            return ops;
        }
        return op == null ? List.of() : List.of(op);
    }

    /**
     * Event kind without the namespace prefix ({@code commit}, {@code identity}, ...).
     * Returns the raw type when it is not in the subscribeRepos namespace.
     */
    @JsonIgnore
    public String kind() {
        if (type == null) {
            return null;
        }
        return type.startsWith(TYPE_PREFIX) ? type.substring(TYPE_PREFIX.length()) : type;
    }

    @JsonIgnore
    public boolean isCommit() {
        return KIND_COMMIT.equals(kind());
    }

    public static String typeOf(String kind) {
        return TYPE_PREFIX + kind;
    }

    /**
     * One repository operation of a commit frame.  {@code path} is {@code collection/rkey}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RepoOp {
        private String action;
        private String path;
        private String cid;
        private JsonNode record;
    }
}
