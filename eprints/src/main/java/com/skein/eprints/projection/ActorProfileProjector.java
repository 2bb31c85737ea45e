package com.skein.eprints.projection;

import com.skein.eprints.model.ActorProfile;
import com.skein.failure.RecordValidationException;
import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import com.skein.saga.IndexProjection;
import com.skein.store.GraphEdge;
import com.skein.store.GraphMutation;
import com.skein.store.GraphNode;
import com.skein.store.RelationalRow;
import com.skein.store.SearchDocument;

import java.util.List;

/**
 * Projects an actor profile into {@code authors_index}, the search index and the
 * account's {@code actors} node.
 */
public class ActorProfileProjector implements RecordProjector<ActorProfile> {

    @Override
    public IndexProjection project(EntityReference ref, ActorProfile profile, CommitFrame frame) {
        if (!ActorProfile.RKEY.equals(ref.getRkey())) {
            throw new RecordValidationException("Actor profile must use record key self, got " + ref.getRkey(),
                    "rkey");
        }
        String did = ref.getRepo();
        List<String> affiliations = Records.orEmpty(profile.getAffiliations());
        List<String> fieldIds = Records.orEmpty(profile.getFieldIds());

        RelationalRow row = RelationalRow.builder()
                .column("cid", frame.getCid())
                .column("did", did)
                .column("display_name", profile.getDisplayName())
                .column("bio", profile.getBio())
                .column("avatar_blob_cid", profile.avatarCid())
                .column("orcid", profile.getOrcid())
                .column("affiliations", affiliations)
                .column("field_ids", fieldIds)
                .build();

        SearchDocument document = SearchDocument.builder()
                .field("did", did)
                .field("displayName", profile.getDisplayName())
                .field("bio", profile.getBio())
                .field("orcid", profile.getOrcid())
                .field("affiliations", affiliations)
                .build();

        String actorKey = GraphNodes.actorKey(did);
        GraphNode.GraphNodeBuilder actor = GraphNode.builder()
                .collection(GraphNodes.ACTORS)
                .key(actorKey)
                .property("did", did);
        if (profile.getDisplayName() != null) {
            actor.property("label", profile.getDisplayName());
        }
        GraphMutation.GraphMutationBuilder graph = GraphMutation.builder()
                .recordProperty("kind", "profile")
                .node(actor.build())
                .edge(GraphEdge.outOf(ref).toCollection(GraphNodes.ACTORS).toKey(actorKey)
                        .relation("profile_of").build());
        for (String fieldId : fieldIds) {
            graph.edge(GraphEdge.builder()
                    .fromCollection(GraphNodes.ACTORS).fromKey(actorKey)
                    .toCollection(GraphNodes.FIELDS).toKey(GraphNodes.fieldKey(fieldId))
                    .relation("works_in")
                    .build());
        }

        return IndexProjection.builder()
                .relational(row)
                .search(document)
                .graph(graph.build())
                .build();
    }
}
