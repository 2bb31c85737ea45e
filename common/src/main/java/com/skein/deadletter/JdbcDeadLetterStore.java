package com.skein.deadletter;

import com.skein.failure.Classification;
import com.skein.failure.FailureKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Dead-letter entries in the {@code firehose_dlq} table.
 */
@Slf4j
public class JdbcDeadLetterStore implements DeadLetterStore {

    private static final String COLUMNS = "id, seq, repo_did, uri, collection, operation, event_data, "
            + "error_type, classification, error_message, retry_count, created_at, last_retry_at";

    static final String INSERT_SQL = "INSERT INTO firehose_dlq (seq, repo_did, uri, collection, operation, "
            + "event_data, error_type, classification, error_message, retry_count, created_at, last_retry_at) "
            + "VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?) RETURNING id";

    private static final RowMapper<DeadLetterEntry> ROW_MAPPER = (rs, rowNum) -> DeadLetterEntry.builder()
            .id(rs.getLong("id"))
            .sequence(rs.getLong("seq"))
            .repo(rs.getString("repo_did"))
            .uri(rs.getString("uri"))
            .collection(rs.getString("collection"))
            .operation(rs.getString("operation"))
            .frameJson(rs.getString("event_data"))
            .failureKind(FailureKind.valueOf(rs.getString("error_type")))
            .classification(Classification.valueOf(rs.getString("classification")))
            .errorMessage(rs.getString("error_message"))
            .retryCount(rs.getInt("retry_count"))
            .firstFailureAt(toInstant(rs.getTimestamp("created_at")))
            .lastFailureAt(toInstant(rs.getTimestamp("last_retry_at")))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcDeadLetterStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long insert(DeadLetterEntry entry) {
        Long id = jdbcTemplate.queryForObject(INSERT_SQL, Long.class,
                entry.getSequence(),
                entry.getRepo(),
                entry.getUri(),
                entry.getCollection(),
                entry.getOperation(),
                entry.getFrameJson(),
                entry.getFailureKind().name(),
                entry.getClassification().name(),
                entry.getErrorMessage(),
                entry.getRetryCount(),
                Timestamp.from(entry.getFirstFailureAt()),
                Timestamp.from(entry.getLastFailureAt()));
        if (id == null) {
            throw new IllegalStateException("Insert into firehose_dlq returned no id");
        }
        return id;
    }

    @Override
    public Optional<DeadLetterEntry> find(long id) {
        List<DeadLetterEntry> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM firehose_dlq WHERE id = ?", ROW_MAPPER, id);
        return rows.stream().findFirst();
    }

    @Override
    public List<DeadLetterEntry> list(DeadLetterQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM firehose_dlq WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (query.getFailureKind() != null) {
            sql.append(" AND error_type = ?");
            args.add(query.getFailureKind().name());
        }
        if (query.getClassification() != null) {
            sql.append(" AND classification = ?");
            args.add(query.getClassification().name());
        }
        if (query.getRepo() != null) {
            sql.append(" AND repo_did = ?");
            args.add(query.getRepo());
        }
        // column comes from the OrderBy enum, never from caller input
        String direction = query.isAscending() ? "ASC" : "DESC";
        sql.append(" ORDER BY ").append(query.getOrderBy().column()).append(' ').append(direction)
                .append(", id ").append(direction)
                .append(" LIMIT ? OFFSET ?");
        args.add(query.getLimit());
        args.add(query.getOffset());
        return jdbcTemplate.query(sql.toString(), ROW_MAPPER, args.toArray());
    }

    @Override
    public void recordRetryFailure(long id, String errorMessage, Instant failedAt) {
        jdbcTemplate.update("UPDATE firehose_dlq SET retry_count = retry_count + 1, error_message = ?, "
                + "last_retry_at = ? WHERE id = ?", errorMessage, Timestamp.from(failedAt), id);
    }

    @Override
    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM firehose_dlq WHERE id = ?", id) > 0;
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM firehose_dlq", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public DeadLetterStats stats() {
        DeadLetterStats.DeadLetterStatsBuilder builder = DeadLetterStats.builder();
        long[] total = {0L};
        Instant[] bounds = {null, null};
        jdbcTemplate.query("SELECT error_type, COUNT(*) AS n, MIN(created_at) AS oldest, MAX(created_at) AS newest "
                + "FROM firehose_dlq GROUP BY error_type", rs -> {
            long n = rs.getLong("n");
            builder.countByKind(FailureKind.valueOf(rs.getString("error_type")), n);
            total[0] += n;
            Instant oldest = toInstant(rs.getTimestamp("oldest"));
            Instant newest = toInstant(rs.getTimestamp("newest"));
            if (bounds[0] == null || (oldest != null && oldest.isBefore(bounds[0]))) {
                bounds[0] = oldest;
            }
            if (bounds[1] == null || (newest != null && newest.isAfter(bounds[1]))) {
                bounds[1] = newest;
            }
        });
        return builder.total(total[0]).oldest(bounds[0]).newest(bounds[1]).build();
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int removed = jdbcTemplate.update("DELETE FROM firehose_dlq WHERE created_at < ?", Timestamp.from(cutoff));
        log.info("Purged {} dead-letter entries older than {}", removed, cutoff);
        return removed;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
