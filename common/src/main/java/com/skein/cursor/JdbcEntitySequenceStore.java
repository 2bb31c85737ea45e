package com.skein.cursor;

import com.skein.model.EntityReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.OptionalLong;

/**
 * Entity sequences persisted in {@code entity_sequence(uri, seq, updated_at)}.
 */
@Slf4j
public class JdbcEntitySequenceStore implements EntitySequenceStore {

    static final String SELECT_SQL = "SELECT seq FROM entity_sequence WHERE uri = ?";

    static final String UPSERT_SQL =
            "INSERT INTO entity_sequence (uri, seq, updated_at) VALUES (?, ?, now()) "
                    + "ON CONFLICT (uri) DO UPDATE "
                    + "SET seq = GREATEST(entity_sequence.seq, EXCLUDED.seq), updated_at = now()";

    private final JdbcTemplate jdbcTemplate;

    public JdbcEntitySequenceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public OptionalLong lastApplied(EntityReference ref) {
        List<Long> rows = jdbcTemplate.queryForList(SELECT_SQL, Long.class, ref.getUri());
        if (rows.isEmpty() || rows.get(0) == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(rows.get(0));
    }

    @Override
    public void recordApplied(EntityReference ref, long seq) {
        jdbcTemplate.update(UPSERT_SQL, ref.getUri(), seq);
        log.debug("Recorded applied seq={} uri={}", seq, ref.getUri());
    }
}
