package com.skein.eprints.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed form of a {@code pub.chive.actor.profile} record.  Every account has at most
 * one, stored under the record key {@code self}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActorProfile {

    public static final String RKEY = "self";

    private String displayName;
    private String bio;

    /** Blob reference of the avatar image: {@code {"ref": {"$link": cid}, ...}}. */
    private JsonNode avatarBlobRef;

    private String orcid;

    @Builder.Default
    private List<String> affiliations = new ArrayList<>();

    @Builder.Default
    private List<String> fieldIds = new ArrayList<>();

    public String avatarCid() {
        if (avatarBlobRef == null) {
            return null;
        }
        JsonNode link = avatarBlobRef.path("ref").path("$link");
        return link.isTextual() ? link.asText() : null;
    }
}
