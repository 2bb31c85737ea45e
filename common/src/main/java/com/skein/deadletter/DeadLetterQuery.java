package com.skein.deadletter;

import com.skein.failure.Classification;
import com.skein.failure.FailureKind;
import lombok.Builder;
import lombok.Value;

/**
 * Filters and paging for listing dead-letter entries.  Unset filters match everything.
 */
@Value
@Builder
public class DeadLetterQuery {

    public enum OrderBy {
        CREATED_AT("created_at"),
        SEQUENCE("seq"),
        RETRY_COUNT("retry_count");

        private final String column;

        OrderBy(String column) {
            this.column = column;
        }

        public String column() {
            return column;
        }
    }

    FailureKind failureKind;
    Classification classification;
    String repo;

    @Builder.Default
    OrderBy orderBy = OrderBy.CREATED_AT;

    @Builder.Default
    boolean ascending = false;

    @Builder.Default
    int limit = 50;

    @Builder.Default
    int offset = 0;

    public static DeadLetterQuery all() {
        return DeadLetterQuery.builder().build();
    }
}
