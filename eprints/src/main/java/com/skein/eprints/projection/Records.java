package com.skein.eprints.projection;

import com.skein.failure.RecordValidationException;
import com.skein.model.EntityReference;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field checks shared by the projectors.  Every failure is a
 * {@link RecordValidationException} naming the offending field.
 */
final class Records {

    private static final Pattern DID = Pattern.compile("^did:[a-z]+:[a-zA-Z0-9._:%-]+$");

    private Records() {
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new RecordValidationException("Missing required field " + field, field);
        }
        return value;
    }

    static Instant requireTime(Instant value, String field) {
        if (value == null) {
            throw new RecordValidationException("Missing required field " + field, field);
        }
        return value;
    }

    static String requireDid(String value, String field) {
        requireText(value, field);
        if (!DID.matcher(value).matches()) {
            throw new RecordValidationException("Field " + field + " is not a DID: " + value, field);
        }
        return value;
    }

    static EntityReference requireReference(String atUri, String field) {
        requireText(atUri, field);
        try {
            return EntityReference.parse(atUri);
        } catch (IllegalArgumentException e) {
            throw new RecordValidationException("Field " + field + " is not an at-uri: " + atUri, field, e);
        }
    }

    static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }
}
