package com.skein.eprints.projection;

import com.skein.eprints.model.UserTag;
import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import com.skein.saga.IndexProjection;
import com.skein.store.GraphEdge;
import com.skein.store.GraphMutation;
import com.skein.store.GraphNode;
import com.skein.store.GraphStore;
import com.skein.store.RelationalRow;
import com.skein.store.SearchDocument;

/**
 * Projects a user tag.  The tagger is the repository that holds the record.
 *
 * <p>In the graph the tag record links to its eprint and to the shared tag node, and the
 * tagger's actor node gets a {@code tagged} edge straight to the eprint.  All three
 * edges are owned by the tag record and disappear with it.</p>
 */
public class UserTagProjector implements RecordProjector<UserTag> {

    @Override
    public IndexProjection project(EntityReference ref, UserTag tag, CommitFrame frame) {
        EntityReference eprint = Records.requireReference(tag.getEprintUri(), "eprintUri");
        String text = Records.requireText(tag.getTag(), "tag");
        Records.requireTime(tag.getCreatedAt(), "createdAt");
        String normalized = GraphNodes.normalizeTag(text);
        String tagger = ref.getRepo();

        RelationalRow row = RelationalRow.builder()
                .column("cid", frame.getCid())
                .column("eprint_uri", eprint.getUri())
                .column("tagger_did", tagger)
                .column("tag", text)
                .column("normalized_tag", normalized)
                .column("created_at", tag.getCreatedAt())
                .build();

        SearchDocument document = SearchDocument.builder()
                .field("tag", text)
                .field("normalizedTag", normalized)
                .field("eprintUri", eprint.getUri())
                .field("tagger", tagger)
                .field("createdAt", tag.getCreatedAt().toString())
                .build();

        String tagKey = GraphNodes.tagKey(text);
        String taggerKey = GraphNodes.actorKey(tagger);
        GraphMutation graph = GraphMutation.builder()
                .recordProperty("kind", "userTag")
                .recordProperty("label", normalized)
                .node(GraphNode.builder().collection(GraphNodes.TAGS).key(tagKey).property("label", normalized).build())
                .node(GraphNode.builder().collection(GraphNodes.ACTORS).key(taggerKey).property("did", tagger).build())
                .edge(GraphEdge.between(ref, eprint).relation("tags").build())
                .edge(GraphEdge.outOf(ref).toCollection(GraphNodes.TAGS).toKey(tagKey).relation("uses_tag").build())
                .edge(GraphEdge.builder()
                        .fromCollection(GraphNodes.ACTORS).fromKey(taggerKey)
                        .toCollection(GraphStore.RECORDS).toKey(eprint.getKey())
                        .relation("tagged")
                        .property("tag", normalized)
                        .build())
                .build();

        return IndexProjection.builder()
                .relational(row)
                .search(document)
                .graph(graph)
                .build();
    }
}
