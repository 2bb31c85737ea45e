package com.skein.eprints.projection;

import com.skein.eprints.model.ReviewComment;
import com.skein.failure.RecordValidationException;
import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import com.skein.saga.IndexProjection;
import com.skein.store.GraphEdge;
import com.skein.store.GraphMutation;
import com.skein.store.RelationalRow;
import com.skein.store.SearchDocument;

/**
 * Projects a review comment: a {@code reviews_index} row, a searchable comment document
 * and {@code reviews} / {@code replies_to} edges.
 */
public class ReviewCommentProjector implements RecordProjector<ReviewComment> {

    @Override
    public IndexProjection project(EntityReference ref, ReviewComment comment, CommitFrame frame) {
        if (comment.getSubject() == null) {
            throw new RecordValidationException("Missing required field subject", "subject");
        }
        EntityReference eprint = Records.requireReference(comment.getSubject().getUri(), "subject.uri");
        String text = Records.requireText(comment.getText(), "text");
        Records.requireTime(comment.getCreatedAt(), "createdAt");
        EntityReference parent = comment.getParent() == null
                ? null
                : Records.requireReference(comment.getParent(), "parent");

        RelationalRow row = RelationalRow.builder()
                .column("cid", frame.getCid())
                .column("eprint_uri", eprint.getUri())
                .column("eprint_cid", comment.getSubject().getCid())
                .column("reviewer_did", ref.getRepo())
                .column("content", text)
                .column("review_type", comment.getReviewType())
                .column("line_number", comment.getLineNumber())
                .column("parent_review_uri", comment.getParent())
                .column("target", comment.getTarget())
                .column("created_at", comment.getCreatedAt())
                .build();

        SearchDocument document = SearchDocument.builder()
                .field("content", text)
                .field("eprintUri", eprint.getUri())
                .field("reviewer", ref.getRepo())
                .field("reviewType", comment.getReviewType())
                .field("createdAt", comment.getCreatedAt().toString())
                .build();

        GraphMutation.GraphMutationBuilder graph = GraphMutation.builder()
                .recordProperty("kind", "review")
                .edge(GraphEdge.between(ref, eprint).relation("reviews").build());
        if (parent != null) {
            graph.edge(GraphEdge.between(ref, parent).relation("replies_to").build());
        }

        return IndexProjection.builder()
                .relational(row)
                .search(document)
                .graph(graph.build())
                .build();
    }
}
