package com.skein.eprints.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Typed form of a {@code pub.chive.review.comment} record.  {@code parent} is set for
 * replies; {@code lineNumber} and {@code target} for inline comments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReviewComment {

    private StrongRef subject;
    private String text;
    private String reviewType;
    private String parent;
    private Integer lineNumber;

    /** Text span selector, kept as-is. */
    private JsonNode target;

    private Instant createdAt;
}
