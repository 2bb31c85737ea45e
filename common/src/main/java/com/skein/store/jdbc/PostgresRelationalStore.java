package com.skein.store.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skein.failure.RecordValidationException;
import com.skein.model.EntityReference;
import com.skein.store.RelationalRow;
import com.skein.store.RelationalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * PostgreSQL relational index.  Each collection maps to one table keyed by {@code uri}.
 *
 * <p>Upserts are {@code INSERT ... ON CONFLICT (uri) DO UPDATE}, so replaying a frame
 * rewrites the same row.  Map, collection and JSON-tree values are bound as
 * {@code jsonb}.  Table and column names are checked against a strict identifier pattern
 * before they reach SQL.</p>
 */
@Slf4j
public class PostgresRelationalStore implements RelationalStore {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");
    static final String KEY_COLUMN = "uri";

    private final JdbcTemplate jdbcTemplate;
    private final Map<String, String> tablesByCollection;
    private final ObjectMapper objectMapper;

    public PostgresRelationalStore(JdbcTemplate jdbcTemplate, Map<String, String> tablesByCollection,
                                   ObjectMapper objectMapper) {
        tablesByCollection.values().forEach(t -> requireIdentifier(t, "table"));
        this.jdbcTemplate = jdbcTemplate;
        this.tablesByCollection = Map.copyOf(tablesByCollection);
        this.objectMapper = objectMapper;
    }

    @Override
    public void upsert(EntityReference ref, RelationalRow row) {
        String table = tableFor(ref);
        Map<String, Object> columns = row.getColumns();

        StringJoiner names = new StringJoiner(", ").add(KEY_COLUMN);
        StringJoiner placeholders = new StringJoiner(", ").add("?");
        StringJoiner updates = new StringJoiner(", ");
        List<Object> args = new ArrayList<>(columns.size() + 1);
        args.add(ref.getUri());

        for (Map.Entry<String, Object> column : columns.entrySet()) {
            String name = requireIdentifier(column.getKey(), "column");
            if (KEY_COLUMN.equals(name)) {
                continue;
            }
            Object value = column.getValue();
            names.add(name);
            placeholders.add(isJson(value) ? "?::jsonb" : "?");
            updates.add(name + " = EXCLUDED." + name);
            args.add(toSqlValue(name, value));
        }
        updates.add("indexed_at = now()");

        String sql = "INSERT INTO " + table + " (" + names + ") VALUES (" + placeholders + ") "
                + "ON CONFLICT (" + KEY_COLUMN + ") DO UPDATE SET " + updates;
        jdbcTemplate.update(sql, args.toArray());
        log.debug("Upserted table={} uri={}", table, ref.getUri());
    }

    @Override
    public void delete(EntityReference ref) {
        String table = tableFor(ref);
        int removed = jdbcTemplate.update("DELETE FROM " + table + " WHERE " + KEY_COLUMN + " = ?", ref.getUri());
        log.debug("Deleted table={} uri={} rows={}", table, ref.getUri(), removed);
    }

    String tableFor(EntityReference ref) {
        String table = tablesByCollection.get(ref.getCollection());
        if (table == null) {
            throw new IllegalArgumentException("No table mapped for collection " + ref.getCollection());
        }
        return table;
    }

    private Object toSqlValue(String column, Object value) {
        if (isJson(value)) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new RecordValidationException("Column " + column + " is not serializable as JSON", column, e);
            }
        }
        if (value instanceof Instant) {
            return Timestamp.from((Instant) value);
        }
        return value;
    }

    private static boolean isJson(Object value) {
        return value instanceof Map || value instanceof Collection || value instanceof JsonNode;
    }

    private static String requireIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " name: " + name);
        }
        return name;
    }
}
