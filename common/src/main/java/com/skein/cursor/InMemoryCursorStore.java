package com.skein.cursor;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local cursor store, for tests and dry runs.
 */
public class InMemoryCursorStore implements CursorStore {

    private final Map<String, Long> cursors = new ConcurrentHashMap<>();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public OptionalLong load(String serviceName) {
        Long value = cursors.get(serviceName);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    @Override
    public void save(String serviceName, long seq) {
        cursors.merge(serviceName, seq, Math::max);
        saves.incrementAndGet();
    }

    /** Number of {@link #save} calls so far. */
    public int getSaveCount() {
        return saves.get();
    }
}
