package com.skein.deadletter;

import com.skein.failure.Classification;
import com.skein.failure.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcDeadLetterStoreTest {

    private static final String SELECT = "SELECT id, seq, repo_did, uri, collection, operation, event_data, "
            + "error_type, classification, error_message, retry_count, created_at, last_retry_at FROM firehose_dlq";

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcDeadLetterStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcDeadLetterStore(jdbcTemplate);
    }

    @Nested
    @DisplayName("list")
    class ListEntries {

        @Test
        @DisplayName("without filters orders newest first with paging")
        void defaultQuery() {
            assertThat(store.list(DeadLetterQuery.all())).isEmpty();

            verify(jdbcTemplate).query(eq(SELECT + " WHERE 1=1 ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?"),
                    ArgumentMatchers.<RowMapper<DeadLetterEntry>>any(), eq(50), eq(0));
        }

        @Test
        @DisplayName("binds every filter as a parameter in a fixed order")
        void allFilters() {
            DeadLetterQuery query = DeadLetterQuery.builder()
                    .failureKind(FailureKind.TRANSIENT_STORE_FAILURE)
                    .classification(Classification.RETRYABLE)
                    .repo("did:plc:alice")
                    .orderBy(DeadLetterQuery.OrderBy.SEQUENCE)
                    .ascending(true)
                    .limit(10)
                    .offset(20)
                    .build();

            store.list(query);

            verify(jdbcTemplate).query(eq(SELECT + " WHERE 1=1 AND error_type = ? AND classification = ? "
                            + "AND repo_did = ? ORDER BY seq ASC, id ASC LIMIT ? OFFSET ?"),
                    ArgumentMatchers.<RowMapper<DeadLetterEntry>>any(),
                    eq("TRANSIENT_STORE_FAILURE"), eq("RETRYABLE"), eq("did:plc:alice"), eq(10), eq(20));
        }
    }

    @Test
    @DisplayName("a failed retry bumps the counter and keeps the newest error")
    void recordsRetryFailure() {
        Instant failedAt = Instant.parse("2024-05-01T00:00:00Z");

        store.recordRetryFailure(7L, "search index down", failedAt);

        verify(jdbcTemplate).update("UPDATE firehose_dlq SET retry_count = retry_count + 1, error_message = ?, "
                + "last_retry_at = ? WHERE id = ?", "search index down", Timestamp.from(failedAt), 7L);
    }

    @Test
    @DisplayName("delete reports whether a row was removed")
    void deleteReportsRemoval() {
        when(jdbcTemplate.update("DELETE FROM firehose_dlq WHERE id = ?", 3L)).thenReturn(1);

        assertThat(store.delete(3L)).isTrue();
    }

    @Test
    @DisplayName("delete of an unknown id reports nothing removed")
    void deleteUnknownId() {
        when(jdbcTemplate.update("DELETE FROM firehose_dlq WHERE id = ?", 4L)).thenReturn(0);

        assertThat(store.delete(4L)).isFalse();
    }

    @Test
    @DisplayName("count treats a null result as an empty table")
    void countHandlesNull() {
        when(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM firehose_dlq", Long.class)).thenReturn(null);

        assertThat(store.count()).isZero();
    }

    @Test
    @DisplayName("insert fails loudly when the database returns no id")
    void insertWithoutId() {
        when(jdbcTemplate.queryForObject(eq(JdbcDeadLetterStore.INSERT_SQL), eq(Long.class), any(Object[].class)))
                .thenReturn(null);
        DeadLetterEntry entry = DeadLetterEntry.builder()
                .sequence(12L)
                .repo("did:plc:alice")
                .uri("at://did:plc:alice/org.example.paper/p1")
                .collection("org.example.paper")
                .operation("create")
                .frameJson("{}")
                .failureKind(FailureKind.TRANSIENT_STORE_FAILURE)
                .classification(Classification.RETRYABLE)
                .errorMessage("boom")
                .firstFailureAt(Instant.EPOCH)
                .lastFailureAt(Instant.EPOCH)
                .build();

        assertThatThrownBy(() -> store.insert(entry))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no id");
    }

    @Test
    @DisplayName("purge deletes by creation time")
    void purgesByCreationTime() {
        Instant cutoff = Instant.parse("2024-01-01T00:00:00Z");
        when(jdbcTemplate.update("DELETE FROM firehose_dlq WHERE created_at < ?", Timestamp.from(cutoff)))
                .thenReturn(5);

        assertThat(store.purgeOlderThan(cutoff)).isEqualTo(5);
    }
}
