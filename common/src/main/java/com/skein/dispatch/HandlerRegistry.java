package com.skein.dispatch;

import com.skein.model.CommitOperation;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps (record kind, operation) to the handler that indexes it.
 *
 * <p>Populated once at startup by the domain module and read-only afterwards.</p>
 */
@Slf4j
public class HandlerRegistry {

    private final Map<String, RecordKind> kinds = new LinkedHashMap<>();
    private final Map<RecordKind, Map<CommitOperation, RecordHandler<?>>> handlers = new LinkedHashMap<>();

    /**
     * Registers {@code handler} for creates and updates of {@code kind}.
     *
     * @throws IllegalArgumentException if {@code type} is not the kind's record class
     */
    public <R> HandlerRegistry onUpsert(RecordKind kind, Class<R> type, RecordHandler<R> handler) {
        if (!kind.getRecordClass().equals(type)) {
            throw new IllegalArgumentException("Kind " + kind + " decodes to "
                    + kind.getRecordClass().getName() + ", not " + type.getName());
        }
        register(kind, CommitOperation.CREATE, handler);
        return register(kind, CommitOperation.UPDATE, handler);
    }

    public HandlerRegistry onDelete(RecordKind kind, RecordHandler<Object> handler) {
        return register(kind, CommitOperation.DELETE, handler);
    }

    public HandlerRegistry register(RecordKind kind, CommitOperation operation, RecordHandler<?> handler) {
        RecordKind existing = kinds.putIfAbsent(kind.getCollection(), kind);
        if (existing != null && existing != kind) {
            throw new IllegalStateException("Collection " + kind.getCollection()
                    + " already registered to " + existing);
        }
        RecordHandler<?> previous = handlers
                .computeIfAbsent(kind, k -> new EnumMap<>(CommitOperation.class))
                .put(operation, handler);
        if (previous != null) {
            throw new IllegalStateException("Duplicate handler for " + kind + " " + operation);
        }
        log.info("Registered handler collection={} op={}", kind.getCollection(), operation.wireName());
        return this;
    }

    public Optional<RecordKind> kindFor(String collection) {
        return Optional.ofNullable(kinds.get(collection));
    }

    public Optional<RecordHandler<?>> handlerFor(RecordKind kind, CommitOperation operation) {
        Map<CommitOperation, RecordHandler<?>> byOp = handlers.get(kind);
        return byOp == null ? Optional.empty() : Optional.ofNullable(byOp.get(operation));
    }

    public Set<String> collections() {
        return Collections.unmodifiableSet(kinds.keySet());
    }
}
