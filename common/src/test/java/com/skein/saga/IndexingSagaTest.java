package com.skein.saga;

import com.skein.failure.Classification;
import com.skein.failure.ErrorClassifier;
import com.skein.failure.FailureKind;
import com.skein.failure.RecordValidationException;
import com.skein.metrics.IndexerMetrics;
import com.skein.model.EntityReference;
import com.skein.model.IndexingStage;
import com.skein.store.GraphMutation;
import com.skein.store.RelationalRow;
import com.skein.store.SearchDocument;
import com.skein.testing.InMemoryStores;
import com.skein.testing.TestDomain;
import com.skein.testing.TestFrames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IndexingSagaTest {

    private final InMemoryStores stores = new InMemoryStores();
    private final IndexerMetrics metrics = IndexerMetrics.inMemory();
    private final IndexingSaga saga = new IndexingSaga(stores.relational(), stores.search(), stores.graphStore(),
            new ErrorClassifier(), metrics);
    private final EntityReference ref = EntityReference.of(TestFrames.REPO, TestFrames.COLLECTION, "e1");
    private final String uri = ref.getUri();

    private Projector titled(String title) {
        return () -> TestDomain.project(ref, TestFrames.record(title));
    }

    private double compensations(IndexingStage stage, String result) {
        return metrics.getRegistry().get("skein.saga.compensations")
                .tag("stage", stage.name().toLowerCase())
                .tag("result", result)
                .counter().count();
    }

    @Nested
    @DisplayName("Index")
    class Index {

        @Test
        void writesAllThreeStoresInOrder() {
            IndexingOutcome outcome = saga.index(ref, titled("First"));

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getCommittedStages())
                    .containsExactly(IndexingStage.RELATIONAL, IndexingStage.SEARCH, IndexingStage.GRAPH);
            assertThat(stores.calls()).containsExactly(
                    "upsert:RELATIONAL:" + uri, "upsert:SEARCH:" + uri, "upsert:GRAPH:" + uri);
        }

        @Test
        @DisplayName("A projection without graph data skips the graph stage")
        void skipsEmptyGraph() {
            IndexingOutcome outcome = saga.index(ref, () -> IndexProjection.builder()
                    .relational(RelationalRow.builder().column("title", "x").build())
                    .search(SearchDocument.builder().field("title", "x").build())
                    .graph(GraphMutation.builder().build())
                    .build());

            assertThat(outcome.getCommittedStages()).containsExactly(IndexingStage.RELATIONAL, IndexingStage.SEARCH);
            assertThat(stores.graph()).isEmpty();
        }

        @Test
        @DisplayName("Search failure removes the relational row it followed")
        void searchFailureCompensatesRelational() {
            stores.failUpserts(IndexingStage.SEARCH, 1);

            IndexingOutcome outcome = saga.index(ref, titled("First"));

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getFailedStage()).isEqualTo(IndexingStage.SEARCH);
            assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.PARTIAL_INDEX_FAILURE);
            assertThat(outcome.getClassification()).isEqualTo(Classification.RETRYABLE);
            assertThat(outcome.isFullyCompensated()).isTrue();
            assertThat(stores.rows()).doesNotContainKey(uri);
            assertThat(stores.calls()).containsExactly(
                    "upsert:RELATIONAL:" + uri, "upsert:SEARCH:" + uri, "delete:RELATIONAL:" + uri);
            assertThat(compensations(IndexingStage.RELATIONAL, "success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Graph failure compensates search, then relational")
        void graphFailureCompensatesInReverse() {
            stores.failUpserts(IndexingStage.GRAPH, 1);

            IndexingOutcome outcome = saga.index(ref, titled("First"));

            assertThat(outcome.getFailedStage()).isEqualTo(IndexingStage.GRAPH);
            assertThat(outcome.getCompensations()).extracting(CompensationResult::getStage)
                    .containsExactly(IndexingStage.SEARCH, IndexingStage.RELATIONAL);
            assertThat(stores.calls()).endsWith("delete:SEARCH:" + uri, "delete:RELATIONAL:" + uri);
            assertThat(stores.rows()).isEmpty();
            assertThat(stores.documents()).isEmpty();
        }

        @Test
        @DisplayName("Relational failure has nothing to compensate")
        void relationalFailure() {
            stores.failUpserts(IndexingStage.RELATIONAL, 1);

            IndexingOutcome outcome = saga.index(ref, titled("First"));

            assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.TRANSIENT_STORE_FAILURE);
            assertThat(outcome.getCompensations()).isEmpty();
            assertThat(stores.calls()).containsExactly("upsert:RELATIONAL:" + uri);
        }

        @Test
        @DisplayName("A failed compensation is recorded, never thrown")
        void compensationFailureIsReported() {
            stores.failUpserts(IndexingStage.GRAPH, 1).failDeletes(IndexingStage.SEARCH, 1);

            IndexingOutcome outcome = saga.index(ref, titled("First"));

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.isFullyCompensated()).isFalse();
            assertThat(outcome.getCompensations()).extracting(CompensationResult::isSucceeded)
                    .containsExactly(false, true);
            assertThat(stores.rows()).isEmpty();
            assertThat(compensations(IndexingStage.SEARCH, "failure")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A projection that rejects the record touches no store")
        void projectionFailureIsTerminal() {
            IndexingOutcome outcome = saga.index(ref, () -> {
                throw new RecordValidationException("title is required", "title");
            });

            assertThat(outcome.getClassification()).isEqualTo(Classification.TERMINAL);
            assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.VALIDATION_FAILURE);
            assertThat(outcome.getFailedStage()).isNull();
            assertThat(stores.calls()).isEmpty();
        }

        @Test
        @DisplayName("Replaying the same projection leaves identical state")
        void idempotentReplay() {
            saga.index(ref, titled("Same"));
            Map<String, RelationalRow> rows = Map.copyOf(stores.rows());
            Map<String, SearchDocument> documents = Map.copyOf(stores.documents());
            Map<String, GraphMutation> graph = Map.copyOf(stores.graph());

            saga.index(ref, titled("Same"));

            assertThat(stores.rows()).isEqualTo(rows);
            assertThat(stores.documents()).isEqualTo(documents);
            assertThat(stores.graph()).isEqualTo(graph);
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        void removesFromAllStoresInOrder() {
            saga.index(ref, titled("First"));

            IndexingOutcome outcome = saga.delete(ref);

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(stores.calls()).endsWith(
                    "delete:RELATIONAL:" + uri, "delete:SEARCH:" + uri, "delete:GRAPH:" + uri);
            assertThat(stores.rows()).isEmpty();
            assertThat(stores.documents()).isEmpty();
            assertThat(stores.graph()).isEmpty();
        }

        @Test
        @DisplayName("Search and graph leftovers do not fail the delete")
        void bestEffortCleanup() {
            saga.index(ref, titled("First"));
            stores.failDeletes(IndexingStage.GRAPH, 1);

            IndexingOutcome outcome = saga.delete(ref);

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getCleanupFailures()).containsOnlyKeys(IndexingStage.GRAPH);
            assertThat(outcome.getCommittedStages()).containsExactly(IndexingStage.RELATIONAL, IndexingStage.SEARCH);
            assertThat(stores.graph()).containsKey(uri);
        }

        @Test
        @DisplayName("A relational failure fails the delete after still trying the other stores")
        void relationalFailureFailsDelete() {
            saga.index(ref, titled("First"));
            stores.failDeletes(IndexingStage.RELATIONAL, 1);

            IndexingOutcome outcome = saga.delete(ref);

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.isRetryable()).isTrue();
            assertThat(outcome.getFailedStage()).isEqualTo(IndexingStage.RELATIONAL);
            assertThat(stores.documents()).isEmpty();
            assertThat(stores.graph()).isEmpty();
        }
    }
}
