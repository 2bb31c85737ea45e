package com.skein.eprints.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One contributor listed on a submission.  Authors without an account on the network
 * carry a name but no {@code did}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class EprintAuthor {

    private String did;
    private String name;
    private String orcid;
    private Integer order;
    private boolean correspondingAuthor;
}
