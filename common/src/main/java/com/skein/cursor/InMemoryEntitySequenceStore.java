package com.skein.cursor;

import com.skein.model.EntityReference;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local entity sequences, for tests and dry runs.
 */
public class InMemoryEntitySequenceStore implements EntitySequenceStore {

    private final Map<String, Long> sequences = new ConcurrentHashMap<>();

    @Override
    public OptionalLong lastApplied(EntityReference ref) {
        Long value = sequences.get(ref.getUri());
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    @Override
    public void recordApplied(EntityReference ref, long seq) {
        sequences.merge(ref.getUri(), seq, Math::max);
    }
}
