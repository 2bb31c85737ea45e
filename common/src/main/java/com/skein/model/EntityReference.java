package com.skein.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable identifier of an indexed record, derived from (repository, collection, record key).
 *
 * <p>The same reference is the primary key in every store, which is what makes replaying
 * a frame idempotent: a second write lands on the same row, document and vertex.</p>
 *
 * <ul>
 *   <li>{@link #getUri()}: {@code at://{repo}/{collection}/{rkey}}, used as the relational
 *       key and search document id.</li>
 *   <li>{@link #getKey()}: hex SHA-256 of the URI, used where the store restricts key
 *       characters (graph document keys).</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode(of = {"repo", "collection", "rkey"})
public final class EntityReference implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final String SCHEME = "at://";

    private final String repo;
    private final String collection;
    private final String rkey;
    private final String uri;
    private final String key;

    private EntityReference(String repo, String collection, String rkey) {
        this.repo = repo;
        this.collection = collection;
        this.rkey = rkey;
        this.uri = SCHEME + repo + "/" + collection + "/" + rkey;
        this.key = sha256Hex(uri);
    }

    public static EntityReference of(String repo, String collection, String rkey) {
        if (isBlank(repo) || isBlank(collection) || isBlank(rkey)) {
            throw new IllegalArgumentException("repo, collection and rkey are required: "
                    + repo + "/" + collection + "/" + rkey);
        }
        return new EntityReference(repo, collection, rkey);
    }

    /**
     * Parses a fully-qualified {@code at://repo/collection/rkey} reference.
     *
     * @throws IllegalArgumentException if the value is not a three-segment at-uri
     */
    public static EntityReference parse(String atUri) {
        if (atUri == null || !atUri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Not an at:// reference: " + atUri);
        }
        String[] parts = atUri.substring(SCHEME.length()).split("/", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException(
                    "Expected at://repo/collection/rkey but got: " + atUri);
        }
        return of(parts[0], parts[1], parts[2]);
    }

    @Override
    public String toString() {
        return uri;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
