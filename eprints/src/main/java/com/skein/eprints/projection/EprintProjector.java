package com.skein.eprints.projection;

import com.skein.eprints.model.EprintAuthor;
import com.skein.eprints.model.EprintSubmission;
import com.skein.failure.RecordValidationException;
import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import com.skein.saga.IndexProjection;
import com.skein.store.GraphEdge;
import com.skein.store.GraphMutation;
import com.skein.store.GraphNode;
import com.skein.store.GraphStore;
import com.skein.store.RelationalRow;
import com.skein.store.SearchDocument;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects an eprint submission.
 *
 * <ul>
 *   <li>Relational: one {@code eprints_index} row with authors and fields as JSON.</li>
 *   <li>Search: title, abstract, author names, keywords and field labels.</li>
 *   <li>Graph: keyword → {@code tags}, field → {@code fields} and author →
 *       {@code actors} edges, plus a {@code supersedes} edge to the previous version.</li>
 * </ul>
 *
 * <p>Field labels come from the graph store and are looked up once per record, so the
 * relational row and the search document always carry the same labels.  A field not
 * yet known to the graph keeps a {@code null} label.</p>
 */
@Slf4j
public class EprintProjector implements RecordProjector<EprintSubmission> {

    private final GraphStore graphStore;

    public EprintProjector(GraphStore graphStore) {
        this.graphStore = graphStore;
    }

    @Override
    public IndexProjection project(EntityReference ref, EprintSubmission eprint, CommitFrame frame) {
        String title = Records.requireText(eprint.getTitle(), "title");
        Records.requireDid(eprint.getSubmittedBy(), "submittedBy");
        Records.requireTime(eprint.getCreatedAt(), "createdAt");
        List<EprintAuthor> authors = Records.orEmpty(eprint.getAuthors());
        if (authors.isEmpty()) {
            throw new RecordValidationException("An eprint needs at least one author", "authors");
        }
        for (EprintAuthor author : authors) {
            if ((author.getName() == null || author.getName().isBlank()) && author.getDid() == null) {
                throw new RecordValidationException("Author has neither name nor did", "authors");
            }
        }

        String abstractText = eprint.plainAbstract();
        Set<String> keywords = new LinkedHashSet<>(Records.orEmpty(eprint.getKeywords()));
        List<Map<String, Object>> fields = resolveFields(Records.orEmpty(eprint.getFieldUris()));
        List<String> fieldLabels = new ArrayList<>();
        fields.forEach(f -> {
            if (f.get("label") != null) {
                fieldLabels.add((String) f.get("label"));
            }
        });
        List<String> authorNames = new ArrayList<>();
        List<String> authorDids = new ArrayList<>();
        for (EprintAuthor author : authors) {
            if (author.getName() != null) {
                authorNames.add(author.getName());
            }
            if (author.getDid() != null) {
                authorDids.add(author.getDid());
            }
        }

        RelationalRow row = RelationalRow.builder()
                .column("cid", frame.getCid())
                .column("submitted_by", eprint.getSubmittedBy())
                .column("paper_did", eprint.getPaperDid())
                .column("title", title)
                .column("abstract", abstractText)
                .column("authors", authorsJson(authors))
                .column("keywords", new ArrayList<>(keywords))
                .column("fields", fields)
                .column("license", eprint.getLicenseSlug())
                .column("publication_status", eprint.getPublicationStatusSlug())
                .column("paper_type", eprint.getPaperTypeSlug())
                .column("version", eprint.getVersion())
                .column("previous_version_uri", eprint.getPreviousVersion())
                .column("created_at", eprint.getCreatedAt())
                .build();

        SearchDocument document = SearchDocument.builder()
                .field("title", title)
                .field("abstract", abstractText)
                .field("authorNames", authorNames)
                .field("authorDids", authorDids)
                .field("submittedBy", eprint.getSubmittedBy())
                .field("keywords", new ArrayList<>(keywords))
                .field("fieldUris", Records.orEmpty(eprint.getFieldUris()))
                .field("fieldLabels", fieldLabels)
                .field("license", eprint.getLicenseSlug())
                .field("publicationStatus", eprint.getPublicationStatusSlug())
                .field("paperType", eprint.getPaperTypeSlug())
                .field("createdAt", eprint.getCreatedAt().toString())
                .build();

        return IndexProjection.builder()
                .relational(row)
                .search(document)
                .graph(graph(ref, eprint, title, keywords, fields, authors))
                .build();
    }

    private List<Map<String, Object>> resolveFields(List<String> fieldUris) {
        if (fieldUris.isEmpty()) {
            return List.of();
        }
        Map<String, String> keys = new LinkedHashMap<>();
        fieldUris.forEach(uri -> keys.put(uri, GraphNodes.fieldKey(uri)));
        Map<String, String> labels = graphStore.lookupLabels(GraphNodes.FIELDS, new LinkedHashSet<>(keys.values()));
        log.debug("Resolved field labels requested={} found={}", keys.size(), labels.size());

        List<Map<String, Object>> fields = new ArrayList<>(fieldUris.size());
        keys.forEach((uri, key) -> {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("uri", uri);
            field.put("label", labels.get(key));
            fields.add(field);
        });
        return fields;
    }

    private static List<Map<String, Object>> authorsJson(List<EprintAuthor> authors) {
        List<Map<String, Object>> json = new ArrayList<>(authors.size());
        for (int i = 0; i < authors.size(); i++) {
            EprintAuthor author = authors.get(i);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("did", author.getDid());
            entry.put("name", author.getName());
            entry.put("orcid", author.getOrcid());
            entry.put("order", author.getOrder() != null ? author.getOrder() : i + 1);
            entry.put("correspondingAuthor", author.isCorrespondingAuthor());
            json.add(entry);
        }
        return json;
    }

    private static GraphMutation graph(EntityReference ref, EprintSubmission eprint, String title,
                                       Set<String> keywords, List<Map<String, Object>> fields,
                                       List<EprintAuthor> authors) {
        GraphMutation.GraphMutationBuilder graph = GraphMutation.builder()
                .recordProperty("kind", "eprint")
                .recordProperty("label", title);

        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String key = GraphNodes.tagKey(keyword);
            graph.node(GraphNode.builder().collection(GraphNodes.TAGS).key(key)
                    .property("label", GraphNodes.normalizeTag(keyword)).build());
            graph.edge(GraphEdge.outOf(ref).toCollection(GraphNodes.TAGS).toKey(key)
                    .relation("tagged_with").property("source", "author").build());
        }

        // field nodes are governed elsewhere; only the uri is written so the label stays intact
        for (Map<String, Object> field : fields) {
            String uri = (String) field.get("uri");
            String key = GraphNodes.fieldKey(uri);
            graph.node(GraphNode.builder().collection(GraphNodes.FIELDS).key(key).property("uri", uri).build());
            graph.edge(GraphEdge.outOf(ref).toCollection(GraphNodes.FIELDS).toKey(key)
                    .relation("classified_as").build());
        }

        for (int i = 0; i < authors.size(); i++) {
            EprintAuthor author = authors.get(i);
            if (author.getDid() == null) {
                continue;
            }
            String key = GraphNodes.actorKey(author.getDid());
            graph.node(GraphNode.builder().collection(GraphNodes.ACTORS).key(key)
                    .property("did", author.getDid()).build());
            graph.edge(GraphEdge.outOf(ref).toCollection(GraphNodes.ACTORS).toKey(key)
                    .relation("authored_by")
                    .property("order", author.getOrder() != null ? author.getOrder() : i + 1)
                    .build());
        }

        if (eprint.getPreviousVersion() != null) {
            EntityReference previous = Records.requireReference(eprint.getPreviousVersion(), "previousVersion");
            graph.edge(GraphEdge.between(ref, previous).relation("supersedes").build());
        }
        return graph.build();
    }
}
