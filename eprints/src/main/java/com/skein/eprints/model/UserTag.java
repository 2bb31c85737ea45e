package com.skein.eprints.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Typed form of a {@code pub.chive.eprint.userTag} (or legacy {@code pub.chive.eprint.tag})
 * record: one user attaching one free-form tag to one eprint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserTag {

    private String eprintUri;
    private String tag;
    private Instant createdAt;
}
