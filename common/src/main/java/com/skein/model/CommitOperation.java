package com.skein.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Repository operation carried by a commit frame.
 */
public enum CommitOperation {

    CREATE,
    UPDATE,
    DELETE;

    /** Whether the operation carries a record body. */
    public boolean carriesRecord() {
        return this != DELETE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the relay's lower-case action name.
     *
     * @return the operation, or {@code null} when the name is not a known action
     */
    @JsonCreator
    public static CommitOperation fromWire(String value) {
        if (value == null) {
            return null;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "create":
                return CREATE;
            case "update":
                return UPDATE;
            case "delete":
                return DELETE;
            default:
                return null;
        }
    }
}
