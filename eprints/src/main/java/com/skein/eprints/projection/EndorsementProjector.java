package com.skein.eprints.projection;

import com.skein.eprints.model.Endorsement;
import com.skein.failure.RecordValidationException;
import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import com.skein.saga.IndexProjection;
import com.skein.store.GraphEdge;
import com.skein.store.GraphMutation;
import com.skein.store.RelationalRow;
import com.skein.store.SearchDocument;

public class EndorsementProjector implements RecordProjector<Endorsement> {

    @Override
    public IndexProjection project(EntityReference ref, Endorsement endorsement, CommitFrame frame) {
        if (endorsement.getSubject() == null) {
            throw new RecordValidationException("Missing required field subject", "subject");
        }
        EntityReference eprint = Records.requireReference(endorsement.getSubject().getUri(), "subject.uri");
        String type = Records.requireText(endorsement.getEndorsementType(), "endorsementType");
        if (!Endorsement.TYPES.contains(type)) {
            throw new RecordValidationException("Unknown endorsement type " + type, "endorsementType");
        }
        Records.requireTime(endorsement.getCreatedAt(), "createdAt");

        RelationalRow row = RelationalRow.builder()
                .column("cid", frame.getCid())
                .column("eprint_uri", eprint.getUri())
                .column("endorser_did", ref.getRepo())
                .column("endorsement_type", type)
                .column("comment", endorsement.getComment())
                .column("created_at", endorsement.getCreatedAt())
                .build();

        SearchDocument document = SearchDocument.builder()
                .field("eprintUri", eprint.getUri())
                .field("endorser", ref.getRepo())
                .field("endorsementType", type)
                .field("comment", endorsement.getComment())
                .field("createdAt", endorsement.getCreatedAt().toString())
                .build();

        GraphMutation graph = GraphMutation.builder()
                .recordProperty("kind", "endorsement")
                .edge(GraphEdge.between(ref, eprint).relation("endorses").property("type", type).build())
                .build();

        return IndexProjection.builder()
                .relational(row)
                .search(document)
                .graph(graph)
                .build();
    }
}
