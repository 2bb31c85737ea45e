package com.skein.saga;

import com.skein.failure.Classification;
import com.skein.failure.ErrorClassifier;
import com.skein.failure.FailureKind;
import com.skein.metrics.IndexerMetrics;
import com.skein.model.EntityReference;
import com.skein.model.IndexingStage;
import com.skein.store.GraphStore;
import com.skein.store.RelationalStore;
import com.skein.store.SearchStore;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

/**
 * Writes one record's projection into the relational, search and graph stores as an
 * ordered saga.
 *
 * <h3>Index</h3>
 * <ol>
 *   <li>Derive the {@link IndexProjection} once.  A failure here touches no store.</li>
 *   <li>Upsert the relational row.  On failure, stop; nothing to undo.</li>
 *   <li>Upsert the search document.  On failure, delete the relational row.</li>
 *   <li>If the projection carries graph data, upsert it.  On failure, delete the search
 *       document, then the relational row.</li>
 * </ol>
 * <p>Compensation walks the committed stages in exact reverse.  It is best-effort: a
 * failed compensating delete is logged, counted and recorded in the outcome, and the
 * next replay of the frame overwrites the leftover idempotently.</p>
 *
 * <h3>Delete</h3>
 * <p>Relational first, then search, then graph.  Every store is attempted even when an
 * earlier one fails.  Only a relational failure fails the outcome, since that row is
 * what says the entity is indexed; a retry then replays the whole (idempotent) delete.
 * Search and graph leftovers are logged and counted as cleanup failures.</p>
 *
 * <p>Store exceptions never escape: every path returns a classified {@link IndexingOutcome}.</p>
 */
@Slf4j
public class IndexingSaga {

    private final RelationalStore relationalStore;
    private final SearchStore searchStore;
    private final GraphStore graphStore;
    private final ErrorClassifier classifier;
    private final IndexerMetrics metrics;

    public IndexingSaga(RelationalStore relationalStore, SearchStore searchStore, GraphStore graphStore,
                        ErrorClassifier classifier, IndexerMetrics metrics) {
        this.relationalStore = relationalStore;
        this.searchStore = searchStore;
        this.graphStore = graphStore;
        this.classifier = classifier;
        this.metrics = metrics;
    }

    // ── Index ────────────────────────────────────────────────────────────

    public IndexingOutcome index(EntityReference ref, Projector projector) {
        Timer.Sample sample = metrics.startSaga();
        try {
            return runIndex(ref, projector);
        } finally {
            metrics.stopSaga(sample);
        }
    }

    private IndexingOutcome runIndex(EntityReference ref, Projector projector) {
        IndexProjection projection;
        try {
            projection = projector.project();
        } catch (Exception e) {
            log.warn("Projection failed uri={}: {}", ref, e.getMessage());
            return failure(ref, null, e, List.of(), List.of(), Map.of());
        }

        List<IndexingStage> committed = new ArrayList<>(3);
        IndexingStage stage = IndexingStage.RELATIONAL;
        try {
            relationalStore.upsert(ref, projection.getRelational());
            committed.add(IndexingStage.RELATIONAL);

            stage = IndexingStage.SEARCH;
            searchStore.upsert(ref, projection.getSearch());
            committed.add(IndexingStage.SEARCH);

            if (projection.hasGraph()) {
                stage = IndexingStage.GRAPH;
                graphStore.upsert(ref, projection.getGraph());
                committed.add(IndexingStage.GRAPH);
            }
        } catch (RuntimeException e) {
            log.warn("Stage failed uri={} stage={} committed={}: {}", ref, stage, committed, e.getMessage());
            List<CompensationResult> compensations = compensate(ref, committed, e);
            return failure(ref, stage, e, committed, compensations, Map.of());
        }

        log.debug("Indexed uri={} stages={}", ref, committed);
        return IndexingOutcome.success(ref, committed);
    }

    private List<CompensationResult> compensate(EntityReference ref, List<IndexingStage> committed,
                                                RuntimeException original) {
        List<CompensationResult> results = new ArrayList<>(committed.size());
        ListIterator<IndexingStage> it = committed.listIterator(committed.size());
        while (it.hasPrevious()) {
            IndexingStage stage = it.previous();
            try {
                deleteFrom(stage, ref);
                metrics.compensation(stage, true);
                results.add(CompensationResult.succeeded(stage));
                log.info("Compensated uri={} stage={}", ref, stage);
            } catch (RuntimeException e) {
                metrics.compensation(stage, false);
                results.add(CompensationResult.failed(stage, e));
                log.error("Compensation failed uri={} stage={} originalError={} compensationError={}",
                        ref, stage, original.getMessage(), e.getMessage(), e);
            }
        }
        return results;
    }

    // ── Delete ───────────────────────────────────────────────────────────

    public IndexingOutcome delete(EntityReference ref) {
        Timer.Sample sample = metrics.startSaga();
        try {
            return runDelete(ref);
        } finally {
            metrics.stopSaga(sample);
        }
    }

    private IndexingOutcome runDelete(EntityReference ref) {
        List<IndexingStage> deleted = new ArrayList<>(3);
        Map<IndexingStage, Throwable> cleanupFailures = new EnumMap<>(IndexingStage.class);
        RuntimeException relationalError = null;

        for (IndexingStage stage : IndexingStage.values()) {
            try {
                deleteFrom(stage, ref);
                deleted.add(stage);
            } catch (RuntimeException e) {
                metrics.deleteFailure(stage);
                log.warn("Delete failed uri={} stage={}: {}", ref, stage, e.getMessage());
                if (stage == IndexingStage.RELATIONAL) {
                    relationalError = e;
                } else {
                    cleanupFailures.put(stage, e);
                }
            }
        }

        if (relationalError != null) {
            return failure(ref, IndexingStage.RELATIONAL, relationalError, deleted, List.of(), cleanupFailures);
        }
        log.debug("Deleted uri={} stores={} leftovers={}", ref, deleted, cleanupFailures.keySet());
        return IndexingOutcome.builder()
                .reference(ref)
                .success(true)
                .committedStages(deleted)
                .cleanupFailures(cleanupFailures)
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private void deleteFrom(IndexingStage stage, EntityReference ref) {
        switch (stage) {
            case RELATIONAL:
                relationalStore.delete(ref);
                break;
            case SEARCH:
                searchStore.delete(ref);
                break;
            case GRAPH:
                graphStore.delete(ref);
                break;
            default:
                throw new IllegalStateException("Unknown stage " + stage);
        }
    }

    private IndexingOutcome failure(EntityReference ref, IndexingStage failedStage, Throwable error,
                                    List<IndexingStage> committed, List<CompensationResult> compensations,
                                    Map<IndexingStage, Throwable> cleanupFailures) {
        Classification classification = classifier.classify(error);
        return IndexingOutcome.builder()
                .reference(ref)
                .success(false)
                .failedStage(failedStage)
                .error(error)
                .classification(classification)
                .failureKind(failureKindOf(classification, committed))
                .committedStages(committed)
                .compensations(compensations)
                .cleanupFailures(cleanupFailures)
                .build();
    }

    static FailureKind failureKindOf(Classification classification, List<IndexingStage> committed) {
        if (classification == Classification.TERMINAL) {
            return FailureKind.VALIDATION_FAILURE;
        }
        return committed.isEmpty() ? FailureKind.TRANSIENT_STORE_FAILURE : FailureKind.PARTIAL_INDEX_FAILURE;
    }
}
