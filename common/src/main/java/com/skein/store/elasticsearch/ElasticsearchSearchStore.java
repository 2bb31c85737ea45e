package com.skein.store.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch.core.DeleteResponse;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.skein.config.ElasticsearchConfig;
import com.skein.failure.TransientStoreException;
import com.skein.model.EntityReference;
import com.skein.model.IndexingStage;
import com.skein.store.SearchDocument;
import com.skein.store.SearchStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Search index backed by Elasticsearch, one document per entity with the entity URI as
 * document id.
 *
 * <p>Indexing the same document twice overwrites it, and deleting a missing document
 * is a no-op, so both operations are safe to replay.  I/O failures surface as
 * {@link TransientStoreException}; HTTP errors keep their
 * {@link ElasticsearchException} so the classifier can read the status.</p>
 */
@Slf4j
public class ElasticsearchSearchStore implements SearchStore, Closeable {

    private final ElasticsearchClient client;
    private final RestClient restClient;
    private final String index;

    public ElasticsearchSearchStore(ElasticsearchConfig config) {
        HttpHost[] hosts = config.getHosts().stream()
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
            builder.setHttpClientConfigCallback(hcb ->
                    hcb.setDefaultCredentialsProvider(credentialsProvider));
        }

        this.restClient = builder.build();
        this.client = new ElasticsearchClient(new RestClientTransport(restClient, new JacksonJsonpMapper()));
        this.index = config.getIndex();
    }

    ElasticsearchSearchStore(ElasticsearchClient client, String index) {
        this.client = client;
        this.restClient = null;
        this.index = index;
    }

    @Override
    public void upsert(EntityReference ref, SearchDocument document) {
        Map<String, Object> source = new LinkedHashMap<>(document.getFields());
        source.put("uri", ref.getUri());
        source.put("repo", ref.getRepo());
        source.put("collection", ref.getCollection());
        try {
            IndexResponse response = client.index(i -> i
                    .index(index)
                    .id(ref.getUri())
                    .document(source));
            log.debug("Indexed search document index={} id={} result={}", index, ref.getUri(), response.result());
        } catch (IOException e) {
            throw new TransientStoreException(IndexingStage.SEARCH,
                    "Search index unreachable while indexing " + ref.getUri(), e);
        }
    }

    @Override
    public void delete(EntityReference ref) {
        try {
            DeleteResponse response = client.delete(d -> d.index(index).id(ref.getUri()));
            log.debug("Deleted search document index={} id={} result={}", index, ref.getUri(), response.result());
        } catch (ElasticsearchException e) {
            if (e.status() != 404) {
                throw e;
            }
            log.debug("Search document already absent index={} id={}", index, ref.getUri());
        } catch (IOException e) {
            throw new TransientStoreException(IndexingStage.SEARCH,
                    "Search index unreachable while deleting " + ref.getUri(), e);
        }
    }

    /**
     * Creates the index with default mappings if it does not exist yet.
     */
    public void ensureIndex() throws IOException {
        boolean exists = client.indices().exists(e -> e.index(index)).value();
        if (!exists) {
            client.indices().create(c -> c.index(index));
            log.info("Created search index={}", index);
        }
    }

    @Override
    public void close() throws IOException {
        if (restClient != null) {
            restClient.close();
        }
    }
}
