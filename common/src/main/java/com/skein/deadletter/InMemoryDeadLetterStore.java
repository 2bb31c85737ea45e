package com.skein.deadletter;

import com.skein.failure.FailureKind;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local dead-letter store, for tests and dry runs.
 */
public class InMemoryDeadLetterStore implements DeadLetterStore {

    private final ConcurrentSkipListMap<Long, DeadLetterEntry> entries = new ConcurrentSkipListMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public long insert(DeadLetterEntry entry) {
        long id = ids.incrementAndGet();
        entries.put(id, entry.toBuilder().id(id).build());
        return id;
    }

    @Override
    public Optional<DeadLetterEntry> find(long id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public List<DeadLetterEntry> list(DeadLetterQuery query) {
        Comparator<DeadLetterEntry> order = comparatorFor(query.getOrderBy());
        if (!query.isAscending()) {
            order = order.reversed();
        }
        return entries.values().stream()
                .filter(e -> query.getFailureKind() == null || e.getFailureKind() == query.getFailureKind())
                .filter(e -> query.getClassification() == null || e.getClassification() == query.getClassification())
                .filter(e -> query.getRepo() == null || Objects.equals(e.getRepo(), query.getRepo()))
                .sorted(order.thenComparingLong(DeadLetterEntry::getId))
                .skip(query.getOffset())
                .limit(query.getLimit())
                .collect(Collectors.toList());
    }

    private static Comparator<DeadLetterEntry> comparatorFor(DeadLetterQuery.OrderBy orderBy) {
        switch (orderBy) {
            case SEQUENCE:
                return Comparator.comparingLong(DeadLetterEntry::getSequence);
            case RETRY_COUNT:
                return Comparator.comparingInt(DeadLetterEntry::getRetryCount);
            case CREATED_AT:
            default:
                return Comparator.comparing(DeadLetterEntry::getFirstFailureAt);
        }
    }

    @Override
    public void recordRetryFailure(long id, String errorMessage, Instant failedAt) {
        entries.computeIfPresent(id, (k, e) -> e.toBuilder()
                .retryCount(e.getRetryCount() + 1)
                .errorMessage(errorMessage)
                .lastFailureAt(failedAt)
                .build());
    }

    @Override
    public boolean delete(long id) {
        return entries.remove(id) != null;
    }

    @Override
    public long count() {
        return entries.size();
    }

    @Override
    public DeadLetterStats stats() {
        Map<FailureKind, Long> byKind = new EnumMap<>(FailureKind.class);
        Instant oldest = null;
        Instant newest = null;
        for (DeadLetterEntry e : entries.values()) {
            byKind.merge(e.getFailureKind(), 1L, Long::sum);
            if (oldest == null || e.getFirstFailureAt().isBefore(oldest)) {
                oldest = e.getFirstFailureAt();
            }
            if (newest == null || e.getFirstFailureAt().isAfter(newest)) {
                newest = e.getFirstFailureAt();
            }
        }
        return DeadLetterStats.builder()
                .total(entries.size())
                .countsByKind(byKind)
                .oldest(oldest)
                .newest(newest)
                .build();
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        for (DeadLetterEntry e : entries.values()) {
            if (e.getFirstFailureAt().isBefore(cutoff) && entries.remove(e.getId()) != null) {
                removed++;
            }
        }
        return removed;
    }
}
