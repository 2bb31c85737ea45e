package com.skein.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skein.cursor.CursorManager;
import com.skein.cursor.CursorStore;
import com.skein.cursor.EntitySequenceStore;
import com.skein.cursor.JdbcEntitySequenceStore;
import com.skein.cursor.JdbcCursorStore;
import com.skein.deadletter.DeadLetterHandler;
import com.skein.deadletter.DeadLetterStore;
import com.skein.deadletter.JdbcDeadLetterStore;
import com.skein.dispatch.CommitDispatcher;
import com.skein.dispatch.FrameProcessor;
import com.skein.dispatch.HandlerRegistry;
import com.skein.dispatch.IndexingDomain;
import com.skein.failure.ErrorClassifier;
import com.skein.ingest.EventFilter;
import com.skein.ingest.EventQueue;
import com.skein.metrics.IndexerMetrics;
import com.skein.pipeline.IndexingService;
import com.skein.reindex.ManualReindexService;
import com.skein.reindex.RecordFetcher;
import com.skein.reindex.XrpcRecordFetcher;
import com.skein.saga.IndexingSaga;
import com.skein.store.GraphStore;
import com.skein.store.RelationalStore;
import com.skein.store.SearchStore;
import com.skein.store.arangodb.ArangoGraphStore;
import com.skein.store.elasticsearch.ElasticsearchSearchStore;
import com.skein.store.jdbc.DataSourceFactory;
import com.skein.store.jdbc.PostgresRelationalStore;
import com.skein.store.jdbc.SchemaInitializer;
import com.skein.transport.ReconnectionManager;
import com.skein.transport.RelayTransport;
import com.skein.transport.WebSocketRelayTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.List;

/**
 * Spring configuration that wires the indexing engine.
 *
 * <p>The host application supplies one {@link IndexingDomain} bean.  Store and transport
 * beans back off when the application defines its own, which is how tests swap in
 * in-memory stores.  The PostgreSQL-backed beans are only created when
 * {@code skein.postgres.url} is set.</p>
 *
 * <p>The {@link IndexingService} is created stopped; the host calls {@code start()}.
 * It is stopped when the context closes.</p>
 */
@Configuration
@EnableConfigurationProperties(PipelineConfig.class)
public class SkeinPipelineAutoConfiguration {

    // ── Shared infrastructure ────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper skeinObjectMapper() {
        return ObjectMappers.create();
    }

    @Bean
    @ConditionalOnMissingBean
    public IndexerMetrics indexerMetrics(ObjectProvider<MeterRegistry> registry) {
        return new IndexerMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    // ── PostgreSQL ───────────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean(DataSource.class)
    @ConditionalOnProperty(prefix = "skein.postgres", name = "url")
    public DataSource skeinDataSource(PipelineConfig config) {
        return DataSourceFactory.create(config.getPostgres());
    }

    @Bean
    @ConditionalOnBean(DataSource.class)
    public JdbcTemplate skeinJdbcTemplate(DataSource dataSource, PipelineConfig config) {
        new SchemaInitializer(dataSource, config.getPostgres().getSchemaResource()).initialize();
        return new JdbcTemplate(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JdbcTemplate.class)
    public RelationalStore relationalStore(JdbcTemplate jdbcTemplate, IndexingDomain domain, ObjectMapper objectMapper) {
        return new PostgresRelationalStore(jdbcTemplate, domain.tablesByCollection(), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JdbcTemplate.class)
    public CursorStore cursorStore(JdbcTemplate jdbcTemplate) {
        return new JdbcCursorStore(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JdbcTemplate.class)
    public EntitySequenceStore entitySequenceStore(JdbcTemplate jdbcTemplate) {
        return new JdbcEntitySequenceStore(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JdbcTemplate.class)
    public DeadLetterStore deadLetterStore(JdbcTemplate jdbcTemplate) {
        return new JdbcDeadLetterStore(jdbcTemplate);
    }

    // ── Search and graph ─────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public SearchStore searchStore(PipelineConfig config) {
        return new ElasticsearchSearchStore(config.getElasticsearch());
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphStore graphStore(PipelineConfig config, IndexingDomain domain) {
        return new ArangoGraphStore(config.getArangodb(), domain.graphNodeCollections());
    }

    // ── Engine ───────────────────────────────────────────────────────────

    @Bean
    public IndexingSaga indexingSaga(RelationalStore relationalStore, SearchStore searchStore, GraphStore graphStore,
                                     ErrorClassifier classifier, IndexerMetrics metrics) {
        return new IndexingSaga(relationalStore, searchStore, graphStore, classifier, metrics);
    }

    @Bean
    public HandlerRegistry handlerRegistry(IndexingDomain domain, IndexingSaga saga, GraphStore graphStore) {
        HandlerRegistry registry = new HandlerRegistry();
        domain.registerHandlers(registry, saga, graphStore);
        return registry;
    }

    @Bean
    public CommitDispatcher commitDispatcher(HandlerRegistry registry, ObjectMapper objectMapper,
                                             ErrorClassifier classifier) {
        return new CommitDispatcher(registry, objectMapper, classifier);
    }

    @Bean
    public DeadLetterHandler deadLetterHandler(DeadLetterStore store, EntitySequenceStore sequences,
                                               CommitDispatcher dispatcher, ObjectMapper objectMapper,
                                               IndexerMetrics metrics, PipelineConfig config) {
        return new DeadLetterHandler(store, sequences, dispatcher, objectMapper, metrics, config.getDeadLetter());
    }

    @Bean
    public FrameProcessor frameProcessor(CommitDispatcher dispatcher, DeadLetterHandler deadLetterHandler,
                                         EntitySequenceStore sequences, IndexerMetrics metrics,
                                         PipelineConfig config) {
        return new FrameProcessor(dispatcher, deadLetterHandler, sequences, metrics, config.getRetry());
    }

    @Bean
    public EventFilter eventFilter(PipelineConfig config, HandlerRegistry registry, IndexerMetrics metrics) {
        List<String> collections = config.getCollections().isEmpty()
                ? List.copyOf(registry.collections())
                : config.getCollections();
        return new EventFilter(collections, metrics);
    }

    @Bean
    public EventQueue eventQueue(PipelineConfig config) {
        return new EventQueue(config.getQueue().getCapacity(), config.getQueue().getLanes());
    }

    @Bean
    public CursorManager cursorManager(CursorStore cursorStore, PipelineConfig config) {
        return new CursorManager(cursorStore, config.getCursor());
    }

    @Bean
    public ReconnectionManager reconnectionManager(PipelineConfig config) {
        return new ReconnectionManager(config.getReconnect());
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayTransport relayTransport(PipelineConfig config, ObjectMapper objectMapper) {
        return new WebSocketRelayTransport(config.getRelay(), objectMapper);
    }

    @Bean(destroyMethod = "stop")
    public IndexingService indexingService(PipelineConfig config, RelayTransport transport,
                                           ReconnectionManager reconnection, EventFilter filter, EventQueue queue,
                                           CursorManager cursor, FrameProcessor processor,
                                           DeadLetterHandler deadLetters, IndexerMetrics metrics) {
        return new IndexingService(config, transport, reconnection, filter, queue, cursor, processor,
                deadLetters, metrics);
    }

    // ── Manual reindex ───────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "skein.reindex", name = "record-source-url")
    public RecordFetcher recordFetcher(PipelineConfig config, ObjectMapper objectMapper) {
        return new XrpcRecordFetcher(config.getReindex(), objectMapper);
    }

    @Bean
    @ConditionalOnBean(RecordFetcher.class)
    public ManualReindexService manualReindexService(RecordFetcher fetcher, FrameProcessor processor,
                                                     EventFilter filter) {
        return new ManualReindexService(fetcher, processor, filter);
    }
}
