package com.skein.eprints.projection;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared node collections of the eprint graph and the keys of their vertices.
 */
public final class GraphNodes {

    public static final String TAGS = "tags";
    public static final String FIELDS = "fields";
    public static final String ACTORS = "actors";

    /** Characters ArangoDB accepts in a document key. */
    private static final Pattern VALID_KEY = Pattern.compile("^[a-zA-Z0-9_\\-:.@()+,=;$!*'%]{1,254}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private GraphNodes() {
    }

    /**
     * Normalised form of a free-form tag or keyword: trimmed, lower-cased, inner
     * whitespace collapsed to single hyphens.
     */
    public static String normalizeTag(String tag) {
        return WHITESPACE.matcher(tag.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
    }

    public static String tagKey(String tag) {
        return key(normalizeTag(tag));
    }

    /** Key of a field node: the last path segment of the field's URI. */
    public static String fieldKey(String fieldUri) {
        String trimmed = fieldUri.endsWith("/") ? fieldUri.substring(0, fieldUri.length() - 1) : fieldUri;
        return key(trimmed.substring(trimmed.lastIndexOf('/') + 1));
    }

    public static String actorKey(String did) {
        return key(did);
    }

    /** {@code value} itself when it is a valid key, otherwise its SHA-256 hex. */
    static String key(String value) {
        if (VALID_KEY.matcher(value).matches()) {
            return value;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
