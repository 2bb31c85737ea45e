package com.skein.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level indexer configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * from {@code application.yaml} under the {@code skein.*} prefix.  The static
 * {@link #load(String)} and {@link #loadFromClasspath(String)} helpers cover standalone
 * and test usage outside a Spring context; both read the same YAML shape, rooted at
 * {@code skein:}.</p>
 */
@Data
@ConfigurationProperties(prefix = "skein")
public class PipelineConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Collection NSIDs the indexer projects.  Entries ending in {@code .*} match every
     * collection under that prefix.
     */
    private List<String> collections = new ArrayList<>();

    private RelaySection relay = new RelaySection();
    private QueueSection queue = new QueueSection();
    private RetrySection retry = new RetrySection();
    private ReconnectSection reconnect = new ReconnectSection();
    private CursorSection cursor = new CursorSection();
    private DeadLetterSection deadLetter = new DeadLetterSection();
    private ShutdownSection shutdown = new ShutdownSection();
    private ReindexSection reindex = new ReindexSection();

    private PostgresConfig postgres = new PostgresConfig();
    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();
    private ArangoConfig arangodb = new ArangoConfig();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static PipelineConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), Root.class).getSkein();
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, Root.class).getSkein();
        }
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public String getRelayUrl() {
        return relay.getUrl();
    }

    public int getMaxRetries() {
        return retry.getMaxRetries();
    }

    public String getServiceName() {
        return cursor.getServiceName();
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    /** Document root so YAML files share the {@code skein:} prefix with Spring binding. */
    @Data
    public static class Root {
        private PipelineConfig skein = new PipelineConfig();
    }

    @Data
    public static class RelaySection {
        /** Relay base URL, e.g. {@code wss://bsky.network}. */
        private String url;
        private long connectTimeoutMs = 10_000;
        /** A connection silent for this long is treated as lost. */
        private long idleTimeoutMs = 60_000;
    }

    @Data
    public static class QueueSection {
        /** Total frames buffered between the transport and the workers. */
        private int capacity = 1_000;
        /** Number of entity-partitioned worker lanes. */
        private int lanes = 8;
    }

    @Data
    public static class RetrySection {
        /** Retries after the first failed attempt before a retryable failure is dead-lettered. */
        private int maxRetries = 3;
        private long initialDelayMs = 1_000;
        private long maxDelayMs = 30_000;
    }

    @Data
    public static class ReconnectSection {
        private long baseDelayMs = 1_000;
        private long maxDelayMs = 30_000;
        /** Fraction of each delay that is randomised, between 0 and 1. */
        private double jitter = 0.5;
        /** Connected time with frames flowing before the backoff is considered healthy again. */
        private long stableAfterMs = 30_000;
        /** Consecutive failed attempts after which the relay counts as in sustained outage. */
        private int outageThreshold = 5;

        public Duration getStableAfter() {
            return Duration.ofMillis(stableAfterMs);
        }
    }

    @Data
    public static class CursorSection {
        /** Key under which the cursor is persisted. */
        private String serviceName = "firehose-consumer";
        /** Persist after this many cursor advances... */
        private int flushBatchSize = 100;
        /** ...or at least this often. */
        private long flushIntervalMs = 5_000;
    }

    @Data
    public static class DeadLetterSection {
        private int warningThreshold = 100;
        private int criticalThreshold = 1_000;
        /** Interval of the automatic requeue sweep; {@code 0} disables it. */
        private long sweepIntervalMs = 0;
        private int sweepBatchSize = 50;
        /** Entries older than this are purged by the sweep; {@code 0} keeps them forever. */
        private int retentionDays = 30;
    }

    @Data
    public static class ShutdownSection {
        private long drainTimeoutMs = 30_000;
    }

    @Data
    public static class ReindexSection {
        /** Base URL of the XRPC service records are fetched from for manual reindex. */
        private String recordSourceUrl;
        private long timeoutMs = 10_000;
    }
}
