package com.skein.eprints.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed form of a {@code pub.chive.eprint.submission} record.
 *
 * <p>The abstract is rich text: a list of items that are either plain text runs
 * ({@code {"text": ...}}) or references to knowledge-graph nodes ({@code {"label": ...}}).
 * {@code abstractPlainText}, when the author's client supplied it, wins over the
 * flattened items.</p>
 *
 * <p>Unknown properties are ignored so newer clients can add fields without the
 * record being rejected.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class EprintSubmission {

    private String title;

    @JsonProperty("abstract")
    @Builder.Default
    private List<JsonNode> abstractItems = new ArrayList<>();

    private String abstractPlainText;

    /** Blob reference of the uploaded document. */
    private JsonNode document;

    @Builder.Default
    private List<EprintAuthor> authors = new ArrayList<>();

    private String submittedBy;
    private String paperDid;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Builder.Default
    private List<String> fieldUris = new ArrayList<>();

    @Builder.Default
    private List<String> topicUris = new ArrayList<>();

    private Integer version;
    private String previousVersion;
    private String licenseSlug;
    private String publicationStatusSlug;
    private String paperTypeSlug;
    private Instant createdAt;

    /**
     * The abstract as plain text.
     */
    public String plainAbstract() {
        if (abstractPlainText != null && !abstractPlainText.isBlank()) {
            return abstractPlainText;
        }
        if (abstractItems == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode item : abstractItems) {
            JsonNode run = item.hasNonNull("text") ? item.get("text") : item.get("label");
            if (run != null && run.isTextual()) {
                text.append(run.asText());
            }
        }
        return text.toString().trim();
    }
}
