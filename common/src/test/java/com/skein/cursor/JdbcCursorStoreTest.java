package com.skein.cursor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcCursorStoreTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcCursorStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcCursorStore(jdbcTemplate);
    }

    @Test
    @DisplayName("loads the persisted sequence for the service")
    void loadsSequence() {
        when(jdbcTemplate.queryForList(JdbcCursorStore.SELECT_SQL, Long.class, "eprints")).thenReturn(List.of(42L));

        assertThat(store.load("eprints")).hasValue(42L);
    }

    @Test
    @DisplayName("an unknown service has no cursor")
    void missingRowIsEmpty() {
        when(jdbcTemplate.queryForList(JdbcCursorStore.SELECT_SQL, Long.class, "eprints")).thenReturn(List.of());

        assertThat(store.load("eprints")).isEmpty();
    }

    @Test
    @DisplayName("a null seq column is treated as no cursor")
    void nullSequenceIsEmpty() {
        when(jdbcTemplate.queryForList(JdbcCursorStore.SELECT_SQL, Long.class, "eprints"))
                .thenReturn(Collections.singletonList(null));

        assertThat(store.load("eprints")).isEmpty();
    }

    @Test
    @DisplayName("save upserts and never moves the stored cursor backwards")
    void saveKeepsMaximum() {
        store.save("eprints", 7L);

        verify(jdbcTemplate).update(JdbcCursorStore.UPSERT_SQL, "eprints", 7L);
        assertThat(JdbcCursorStore.UPSERT_SQL)
                .contains("ON CONFLICT (service_name) DO UPDATE")
                .contains("GREATEST(firehose_cursor.seq, EXCLUDED.seq)");
    }
}
