package com.skein.eprints.projection;

import com.skein.eprints.model.UserTag;
import com.skein.failure.RecordValidationException;
import com.skein.model.CommitFrame;
import com.skein.model.CommitOperation;
import com.skein.model.EntityReference;
import com.skein.saga.IndexProjection;
import com.skein.store.GraphEdge;
import com.skein.store.GraphStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserTagProjectorTest {

    private static final String TAGGER = "did:plc:tagger789";
    private static final String EPRINT = "at://did:plc:alice123/pub.chive.eprint.submission/3kpaper";
    private static final EntityReference REF = EntityReference.of(TAGGER, "pub.chive.eprint.userTag", "3ktag");
    private static final CommitFrame FRAME = CommitFrame.builder()
            .repo(TAGGER).collection("pub.chive.eprint.userTag").rkey("3ktag")
            .operation(CommitOperation.CREATE).cid("bafyreitag").sequence(9).build();

    private final UserTagProjector projector = new UserTagProjector();

    private static UserTag tag(String text) {
        return new UserTag(EPRINT, text, Instant.parse("2024-06-01T08:30:00Z"));
    }

    @Test
    void normalisesTagAndAttributesItToTheRepository() {
        IndexProjection projection = projector.project(REF, tag("  Machine   Learning "), FRAME);

        assertThat(projection.getRelational().getColumns())
                .containsEntry("tag", "  Machine   Learning ")
                .containsEntry("normalized_tag", "machine-learning")
                .containsEntry("tagger_did", TAGGER)
                .containsEntry("eprint_uri", EPRINT)
                .containsEntry("cid", "bafyreitag");
        assertThat(projection.getSearch().getFields()).containsEntry("normalizedTag", "machine-learning");
    }

    @Test
    void linksTagRecordEprintTagNodeAndTagger() {
        IndexProjection projection = projector.project(REF, tag("Machine Learning"), FRAME);
        String eprintKey = EntityReference.parse(EPRINT).getKey();

        assertThat(projection.getGraph().getNodes())
                .extracting(node -> node.getCollection() + "/" + node.getKey())
                .containsExactlyInAnyOrder(GraphNodes.TAGS + "/machine-learning", GraphNodes.ACTORS + "/" + TAGGER);
        assertThat(projection.getGraph().getEdges()).extracting(GraphEdge::getRelation)
                .containsExactly("tags", "uses_tag", "tagged");
        assertThat(projection.getGraph().getEdges().get(0).getToKey()).isEqualTo(eprintKey);
        GraphEdge tagged = projection.getGraph().getEdges().get(2);
        assertThat(tagged.getFromCollection()).isEqualTo(GraphNodes.ACTORS);
        assertThat(tagged.getToCollection()).isEqualTo(GraphStore.RECORDS);
        assertThat(tagged.getToKey()).isEqualTo(eprintKey);
        assertThat(tagged.getProperties()).containsEntry("tag", "machine-learning");
    }

    @Test
    void rejectsBlankTag() {
        assertThatThrownBy(() -> projector.project(REF, tag(" "), FRAME))
                .isInstanceOf(RecordValidationException.class)
                .extracting("field").isEqualTo("tag");
    }

    @Test
    void rejectsSubjectThatIsNotAnAtUri() {
        UserTag tag = new UserTag("did:plc:alice123", "physics", Instant.now());

        assertThatThrownBy(() -> projector.project(REF, tag, FRAME))
                .isInstanceOf(RecordValidationException.class)
                .extracting("field").isEqualTo("eprintUri");
    }
}
