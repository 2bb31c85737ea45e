package com.skein.store.arangodb;

import com.arangodb.ArangoDB;
import com.arangodb.ArangoDatabase;
import com.arangodb.entity.CollectionType;
import com.arangodb.model.CollectionCreateOptions;
import com.skein.config.ArangoConfig;
import com.skein.model.EntityReference;
import com.skein.store.GraphEdge;
import com.skein.store.GraphMutation;
import com.skein.store.GraphNode;
import com.skein.store.GraphStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph store on ArangoDB.
 *
 * <p>Layout:</p>
 * <ul>
 *   <li>{@code records}: one vertex per indexed entity, keyed by the entity key.</li>
 *   <li>Node collections supplied by the domain (tags, fields, ...): shared vertices,
 *       upserted and never removed by a record delete.</li>
 *   <li>{@code relations}: every edge, tagged with the URI of the record that owns it.
 *       A record's edges are replaced as a set on every upsert.</li>
 * </ul>
 *
 * <p>Writes use AQL {@code UPSERT} with deterministic keys, so replaying a mutation leaves
 * the graph unchanged.</p>
 */
@Slf4j
public class ArangoGraphStore implements GraphStore, AutoCloseable {

    public static final String RELATIONS = "relations";

    private static final String UPSERT_RECORD =
            "UPSERT { _key: @key } "
                    + "INSERT MERGE(@props, { _key: @key, uri: @uri, repo: @repo, collection: @collection }) "
                    + "REPLACE MERGE(@props, { _key: @key, uri: @uri, repo: @repo, collection: @collection }) "
                    + "IN " + RECORDS;

    private static final String UPSERT_NODE =
            "UPSERT { _key: @key } INSERT MERGE(@props, { _key: @key }) UPDATE @props IN @@collection";

    private static final String REMOVE_OWNED_EDGES =
            "FOR e IN " + RELATIONS + " FILTER e.owner == @owner REMOVE e IN " + RELATIONS;

    private static final String UPSERT_EDGE =
            "UPSERT { _key: @key } INSERT @edge REPLACE @edge IN " + RELATIONS;

    private static final String REMOVE_RECORD =
            "REMOVE { _key: @key } IN " + RECORDS + " OPTIONS { ignoreErrors: true }";

    private static final String LOOKUP_LABELS =
            "FOR d IN @@collection FILTER d._key IN @keys RETURN { key: d._key, label: d.label }";

    private final ArangoDB arangoDB;
    private final ArangoDatabase database;

    public ArangoGraphStore(ArangoConfig config, Set<String> nodeCollections) {
        log.info("Connecting to ArangoDB at {}:{} database={}", config.getHost(), config.getPort(),
                config.getDatabase());
        this.arangoDB = new ArangoDB.Builder()
                .host(config.getHost(), config.getPort())
                .user(config.getUser())
                .password(config.getPassword())
                .timeout(config.getTimeoutMs())
                .build();
        if (!arangoDB.db(config.getDatabase()).exists()) {
            arangoDB.createDatabase(config.getDatabase());
            log.info("Created ArangoDB database={}", config.getDatabase());
        }
        this.database = arangoDB.db(config.getDatabase());

        createCollectionIfNotExists(RECORDS, CollectionType.DOCUMENT);
        createCollectionIfNotExists(RELATIONS, CollectionType.EDGES);
        nodeCollections.forEach(c -> createCollectionIfNotExists(c, CollectionType.DOCUMENT));
    }

    ArangoGraphStore(ArangoDatabase database) {
        this.arangoDB = null;
        this.database = database;
    }

    private void createCollectionIfNotExists(String name, CollectionType type) {
        if (!database.collection(name).exists()) {
            database.createCollection(name, new CollectionCreateOptions().type(type));
            log.info("Created ArangoDB collection={} type={}", name, type);
        }
    }

    @Override
    public void upsert(EntityReference ref, GraphMutation mutation) {
        Map<String, Object> recordVars = new HashMap<>();
        recordVars.put("key", ref.getKey());
        recordVars.put("uri", ref.getUri());
        recordVars.put("repo", ref.getRepo());
        recordVars.put("collection", ref.getCollection());
        recordVars.put("props", mutation.getRecordProperties());
        run(UPSERT_RECORD, recordVars);

        for (GraphNode node : mutation.getNodes()) {
            Map<String, Object> vars = new HashMap<>();
            vars.put("@collection", node.getCollection());
            vars.put("key", node.getKey());
            vars.put("props", node.getProperties());
            run(UPSERT_NODE, vars);
        }

        run(REMOVE_OWNED_EDGES, Map.of("owner", ref.getUri()));
        for (GraphEdge edge : mutation.getEdges()) {
            String from = edge.getFromCollection() + "/" + edge.getFromKey();
            String to = edge.getToCollection() + "/" + edge.getToKey();
            String key = edgeKey(ref.getUri(), from, to, edge.getRelation());

            Map<String, Object> document = new LinkedHashMap<>(edge.getProperties());
            document.put("_key", key);
            document.put("_from", from);
            document.put("_to", to);
            document.put("relation", edge.getRelation());
            document.put("owner", ref.getUri());
            run(UPSERT_EDGE, Map.of("key", key, "edge", document));
        }
        log.debug("Upserted graph uri={} nodes={} edges={}", ref.getUri(),
                mutation.getNodes().size(), mutation.getEdges().size());
    }

    @Override
    public void delete(EntityReference ref) {
        run(REMOVE_OWNED_EDGES, Map.of("owner", ref.getUri()));
        run(REMOVE_RECORD, Map.of("key", ref.getKey()));
        log.debug("Deleted graph vertex uri={}", ref.getUri());
    }

    @Override
    @SuppressWarnings("rawtypes")
    public Map<String, String> lookupLabels(String nodeCollection, Collection<String> keys) {
        if (keys.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> vars = new HashMap<>();
        vars.put("@collection", nodeCollection);
        vars.put("keys", List.copyOf(keys));
        List<Map> rows = database.query(LOOKUP_LABELS, Map.class, vars).asListRemaining();

        Map<String, String> labels = new HashMap<>();
        for (Map row : rows) {
            Object label = row.get("label");
            if (label != null) {
                labels.put(String.valueOf(row.get("key")), String.valueOf(label));
            }
        }
        return labels;
    }

    private void run(String aql, Map<String, Object> bindVars) {
        database.query(aql, Object.class, bindVars).asListRemaining();
    }

    static String edgeKey(String owner, String from, String to, String relation) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((owner + "|" + from + "|" + to + "|" + relation)
                    .getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public void close() {
        if (arangoDB != null) {
            arangoDB.shutdown();
        }
    }
}
