package com.skein.cursor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.OptionalLong;

/**
 * Cursor persisted in {@code firehose_cursor(service_name, seq, updated_at)}.
 */
@Slf4j
public class JdbcCursorStore implements CursorStore {

    static final String SELECT_SQL = "SELECT seq FROM firehose_cursor WHERE service_name = ?";

    static final String UPSERT_SQL =
            "INSERT INTO firehose_cursor (service_name, seq, updated_at) VALUES (?, ?, now()) "
                    + "ON CONFLICT (service_name) DO UPDATE "
                    + "SET seq = GREATEST(firehose_cursor.seq, EXCLUDED.seq), updated_at = now()";

    private final JdbcTemplate jdbcTemplate;

    public JdbcCursorStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public OptionalLong load(String serviceName) {
        List<Long> rows = jdbcTemplate.queryForList(SELECT_SQL, Long.class, serviceName);
        if (rows.isEmpty() || rows.get(0) == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(rows.get(0));
    }

    @Override
    public void save(String serviceName, long seq) {
        jdbcTemplate.update(UPSERT_SQL, serviceName, seq);
        log.debug("Persisted cursor service={} seq={}", serviceName, seq);
    }
}
