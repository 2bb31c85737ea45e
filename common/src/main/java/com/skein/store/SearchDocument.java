package com.skein.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Search-oriented projection of a record.  The store adds {@code uri}, {@code repo} and
 * {@code collection} from the entity reference.
 */
@Value
@Builder
public class SearchDocument {

    @Singular
    Map<String, Object> fields;
}
