package com.skein.reindex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skein.config.ObjectMappers;
import com.skein.config.PipelineConfig;
import com.skein.cursor.InMemoryEntitySequenceStore;
import com.skein.deadletter.DeadLetterHandler;
import com.skein.deadletter.InMemoryDeadLetterStore;
import com.skein.dispatch.CommitDispatcher;
import com.skein.dispatch.FrameProcessor;
import com.skein.dispatch.HandlerRegistry;
import com.skein.failure.ErrorClassifier;
import com.skein.ingest.EventFilter;
import com.skein.metrics.IndexerMetrics;
import com.skein.model.EntityReference;
import com.skein.model.IndexingStage;
import com.skein.saga.IndexingSaga;
import com.skein.testing.InMemoryStores;
import com.skein.testing.TestDomain;
import com.skein.testing.TestFrames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ManualReindexServiceTest {

    private static final EntityReference REF = EntityReference.of(TestFrames.REPO, TestFrames.COLLECTION, "3kabc");

    @Mock
    private RecordFetcher fetcher;

    private final InMemoryStores stores = new InMemoryStores();
    private final InMemoryDeadLetterStore deadLetters = new InMemoryDeadLetterStore();
    private final InMemoryEntitySequenceStore sequences = new InMemoryEntitySequenceStore();
    private ManualReindexService service;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = ObjectMappers.create();
        ErrorClassifier classifier = new ErrorClassifier();
        IndexerMetrics metrics = IndexerMetrics.inMemory();
        HandlerRegistry registry = new HandlerRegistry();
        IndexingSaga saga = new IndexingSaga(stores.relational(), stores.search(), stores.graphStore(),
                classifier, metrics);
        new TestDomain().registerHandlers(registry, saga, stores.graphStore());
        CommitDispatcher dispatcher = new CommitDispatcher(registry, mapper, classifier);
        DeadLetterHandler deadLetterHandler = new DeadLetterHandler(deadLetters, sequences, dispatcher, mapper,
                metrics, new PipelineConfig.DeadLetterSection());
        PipelineConfig.RetrySection retry = new PipelineConfig.RetrySection();
        retry.setMaxRetries(1);
        FrameProcessor processor = new FrameProcessor(dispatcher, deadLetterHandler, sequences, metrics, retry,
                d -> { }, Clock.systemUTC());
        service = new ManualReindexService(fetcher, processor,
                new EventFilter(List.of(TestFrames.COLLECTION), metrics));
    }

    @Test
    @DisplayName("A record the origin still has is indexed as an update")
    void indexesFetchedRecord() throws Exception {
        when(fetcher.fetch(REF)).thenReturn(Optional.of(new FetchedRecord("bafyfresh", TestFrames.record("Fresh"))));

        ReindexResult result = service.reindex(REF.getUri());

        assertThat(result.getStatus()).isEqualTo(ReindexResult.Status.INDEXED);
        assertThat(result.isSuccess()).isTrue();
        assertThat(TestDomain.relationalTitle(stores, REF.getUri())).isEqualTo("Fresh");
        assertThat(TestDomain.searchTitle(stores, REF.getUri())).isEqualTo("Fresh");
    }

    @Test
    @DisplayName("A record the origin no longer has is removed from every store")
    void deletesMissingRecord() throws Exception {
        when(fetcher.fetch(REF)).thenReturn(Optional.of(new FetchedRecord("bafyold", TestFrames.record("Old"))));
        service.reindex(REF.getUri());
        when(fetcher.fetch(REF)).thenReturn(Optional.empty());

        ReindexResult result = service.reindex(REF.getUri());

        assertThat(result.getStatus()).isEqualTo(ReindexResult.Status.DELETED);
        assertThat(stores.rows()).isEmpty();
        assertThat(stores.documents()).isEmpty();
        assertThat(stores.graph()).isEmpty();
    }

    @Test
    void malformedUriIsRejected() throws Exception {
        ReindexResult result = service.reindex("https://example.com/not-an-at-uri");

        assertThat(result.getStatus()).isEqualTo(ReindexResult.Status.REJECTED);
        verifyNoInteractions(fetcher);
    }

    @Test
    void uninterestingCollectionIsRejected() throws Exception {
        ReindexResult result = service.reindex("at://" + TestFrames.REPO + "/app.bsky.feed.post/3kxyz");

        assertThat(result.getStatus()).isEqualTo(ReindexResult.Status.REJECTED);
        assertThat(result.getMessage()).contains("app.bsky.feed.post");
        verifyNoInteractions(fetcher);
    }

    @Test
    void unreachableOriginIsReported() throws Exception {
        when(fetcher.fetch(any())).thenThrow(new IOException("connection refused"));

        ReindexResult result = service.reindex(REF.getUri());

        assertThat(result.getStatus()).isEqualTo(ReindexResult.Status.FETCH_FAILED);
        assertThat(result.isSuccess()).isFalse();
        assertThat(stores.calls()).isEmpty();
    }

    @Test
    @DisplayName("A reindex that keeps failing is dead-lettered like firehose traffic")
    void persistentFailureIsDeadLettered() throws Exception {
        when(fetcher.fetch(REF)).thenReturn(Optional.of(new FetchedRecord("bafy", TestFrames.record("X"))));
        stores.failUpserts(IndexingStage.SEARCH, Integer.MAX_VALUE);

        ReindexResult result = service.reindex(REF.getUri());

        assertThat(result.getStatus()).isEqualTo(ReindexResult.Status.DEAD_LETTERED);
        assertThat(deadLetters.count()).isEqualTo(1);
        assertThat(stores.rows()).isEmpty();
    }
}
