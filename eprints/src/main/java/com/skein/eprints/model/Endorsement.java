package com.skein.eprints.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * Typed form of a {@code pub.chive.review.endorsement} record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Endorsement {

    public static final Set<String> TYPES = Set.of("methods", "results", "overall");

    private StrongRef subject;
    private String endorsementType;
    private String comment;
    private Instant createdAt;
}
