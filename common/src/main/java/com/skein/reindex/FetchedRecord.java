package com.skein.reindex;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Current version of a record as reported by its origin.
 */
@Value
public class FetchedRecord {

    String cid;
    JsonNode value;
}
