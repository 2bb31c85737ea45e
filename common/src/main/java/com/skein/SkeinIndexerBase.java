package com.skein;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skein.config.ObjectMappers;
import com.skein.config.PipelineConfig;
import com.skein.cursor.CursorManager;
import com.skein.cursor.JdbcCursorStore;
import com.skein.cursor.JdbcEntitySequenceStore;
import com.skein.deadletter.DeadLetterHandler;
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
import com.skein.saga.IndexingSaga;
import com.skein.store.arangodb.ArangoGraphStore;
import com.skein.store.elasticsearch.ElasticsearchSearchStore;
import com.skein.store.jdbc.DataSourceFactory;
import com.skein.store.jdbc.PostgresRelationalStore;
import com.skein.store.jdbc.SchemaInitializer;
import com.skein.transport.ReconnectionManager;
import com.skein.transport.WebSocketRelayTransport;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Abstract base for domain-specific indexer processes run without a Spring context.
 *
 * <p>Subclasses provide the default config resource and their {@link IndexingDomain};
 * the engine itself is generic and driven by the YAML configuration.</p>
 *
 * <p>Usage in a domain module:
 * <pre>
 *   public class EprintsIndexer extends SkeinIndexerBase {
 *       protected String getDefaultConfigResource() { return "pipeline-config.yaml"; }
 *       protected IndexingDomain createDomain(PipelineConfig c) { return new EprintsDomain(); }
 *       public static void main(String[] args) throws Exception { new EprintsIndexer().run(args); }
 *   }
 * </pre>
 */
@Slf4j
public abstract class SkeinIndexerBase {

    /**
     * Classpath resource loaded when no command-line config path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    /**
     * The record kinds, tables and handlers of this indexer.
     */
    protected abstract IndexingDomain createDomain(PipelineConfig config);

    /**
     * Runs the indexer until the JVM is asked to shut down.
     *
     * @param args optional single argument: path to a YAML config file
     */
    public void run(String[] args) throws Exception {
        // ── Load configuration ───────────────────────────────────────────
        PipelineConfig config;
        if (args.length > 0) {
            log.info("Loading configuration from file: {}", args[0]);
            config = PipelineConfig.load(args[0]);
        } else {
            String resource = getDefaultConfigResource();
            log.info("Loading configuration from classpath: {}", resource);
            config = PipelineConfig.loadFromClasspath(resource);
        }
        log.info("Relay: {}", config.getRelayUrl());
        log.info("Lanes: {} queue capacity: {}", config.getQueue().getLanes(), config.getQueue().getCapacity());

        // ── Stores ───────────────────────────────────────────────────────
        IndexingDomain domain = createDomain(config);
        ObjectMapper objectMapper = ObjectMappers.create();
        IndexerMetrics metrics = IndexerMetrics.inMemory();
        ErrorClassifier classifier = new ErrorClassifier();

        HikariDataSource dataSource = DataSourceFactory.create(config.getPostgres());
        new SchemaInitializer(dataSource, config.getPostgres().getSchemaResource()).initialize();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

        ElasticsearchSearchStore searchStore = new ElasticsearchSearchStore(config.getElasticsearch());
        searchStore.ensureIndex();
        ArangoGraphStore graphStore = new ArangoGraphStore(config.getArangodb(), domain.graphNodeCollections());

        IndexingSaga saga = new IndexingSaga(
                new PostgresRelationalStore(jdbcTemplate, domain.tablesByCollection(), objectMapper),
                searchStore, graphStore, classifier, metrics);

        // ── Engine ───────────────────────────────────────────────────────
        HandlerRegistry registry = new HandlerRegistry();
        domain.registerHandlers(registry, saga, graphStore);
        CommitDispatcher dispatcher = new CommitDispatcher(registry, objectMapper, classifier);
        JdbcEntitySequenceStore sequences = new JdbcEntitySequenceStore(jdbcTemplate);
        DeadLetterHandler deadLetters = new DeadLetterHandler(new JdbcDeadLetterStore(jdbcTemplate), sequences,
                dispatcher, objectMapper, metrics, config.getDeadLetter());
        FrameProcessor processor = new FrameProcessor(dispatcher, deadLetters, sequences, metrics,
                config.getRetry());

        List<String> collections = config.getCollections().isEmpty()
                ? List.copyOf(registry.collections())
                : config.getCollections();

        IndexingService service = new IndexingService(config,
                new WebSocketRelayTransport(config.getRelay(), objectMapper),
                new ReconnectionManager(config.getReconnect()),
                new EventFilter(collections, metrics),
                new EventQueue(config.getQueue().getCapacity(), config.getQueue().getLanes()),
                new CursorManager(new JdbcCursorStore(jdbcTemplate), config.getCursor()),
                processor, deadLetters, metrics);

        // ── Run until shutdown ───────────────────────────────────────────
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            try {
                service.stop();
                searchStore.close();
                graphStore.close();
                dataSource.close();
            } catch (Exception e) {
                log.error("Error during shutdown", e);
            } finally {
                stopped.countDown();
            }
        }, "skein-shutdown"));

        service.start();
        stopped.await();
    }
}
