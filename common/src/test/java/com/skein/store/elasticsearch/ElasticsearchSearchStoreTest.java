package com.skein.store.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorResponse;
import co.elastic.clients.elasticsearch.core.DeleteResponse;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.util.ObjectBuilder;
import com.skein.failure.TransientStoreException;
import com.skein.model.EntityReference;
import com.skein.model.IndexingStage;
import com.skein.store.SearchDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings({"unchecked", "rawtypes"})
class ElasticsearchSearchStoreTest {

    private static final EntityReference PAPER = EntityReference.of("did:plc:alice", "org.example.paper", "p1");

    @Mock
    private ElasticsearchClient client;

    @Mock
    private IndexResponse indexResponse;

    @Mock
    private DeleteResponse deleteResponse;

    private ElasticsearchSearchStore store;

    @BeforeEach
    void setUp() {
        store = new ElasticsearchSearchStore(client, "records");
    }

    private static ElasticsearchException errorWithStatus(int status) {
        return new ElasticsearchException("delete", ErrorResponse.of(r -> r
                .status(status)
                .error(e -> e.type(status == 404 ? "not_found" : "internal_error").reason("test"))));
    }

    @Nested
    @DisplayName("upsert")
    class Upsert {

        @Test
        @DisplayName("indexes the document under the uri with the reference fields added")
        void indexesByUri() throws IOException {
            when(client.index(any(Function.class))).thenReturn(indexResponse);

            store.upsert(PAPER, SearchDocument.builder().field("title", "Lattices").build());

            ArgumentCaptor<Function> captor = ArgumentCaptor.forClass(Function.class);
            verify(client).index(captor.capture());
            IndexRequest<Object> request = ((ObjectBuilder<IndexRequest<Object>>) captor.getValue()
                    .apply(new IndexRequest.Builder<Object>())).build();
            assertThat(request.index()).isEqualTo("records");
            assertThat(request.id()).isEqualTo(PAPER.getUri());
            assertThat((Map<String, Object>) request.document())
                    .containsEntry("title", "Lattices")
                    .containsEntry("uri", PAPER.getUri())
                    .containsEntry("repo", "did:plc:alice")
                    .containsEntry("collection", "org.example.paper");
        }

        @Test
        @DisplayName("an unreachable cluster is a transient search failure")
        void ioFailureIsTransient() throws IOException {
            when(client.index(any(Function.class))).thenThrow(new IOException("connection refused"));

            assertThatThrownBy(() -> store.upsert(PAPER, SearchDocument.builder().build()))
                    .isInstanceOf(TransientStoreException.class)
                    .satisfies(e -> assertThat(((TransientStoreException) e).getStage())
                            .isEqualTo(IndexingStage.SEARCH));
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("removes the document by uri")
        void deletesDocument() throws IOException {
            when(client.delete(any(Function.class))).thenReturn(deleteResponse);

            store.delete(PAPER);

            verify(client).delete(any(Function.class));
        }

        @Test
        @DisplayName("a missing document counts as deleted")
        void notFoundIsIgnored() throws IOException {
            when(client.delete(any(Function.class))).thenThrow(errorWithStatus(404));

            assertThatCode(() -> store.delete(PAPER)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("other error statuses propagate")
        void serverErrorPropagates() throws IOException {
            when(client.delete(any(Function.class))).thenThrow(errorWithStatus(500));

            assertThatThrownBy(() -> store.delete(PAPER))
                    .isInstanceOf(ElasticsearchException.class)
                    .satisfies(e -> assertThat(((ElasticsearchException) e).status()).isEqualTo(500));
        }

        @Test
        @DisplayName("an unreachable cluster is a transient search failure")
        void ioFailureIsTransient() throws IOException {
            when(client.delete(any(Function.class))).thenThrow(new IOException("timeout"));

            assertThatThrownBy(() -> store.delete(PAPER))
                    .isInstanceOf(TransientStoreException.class)
                    .hasMessageContaining(PAPER.getUri());
        }
    }
}
