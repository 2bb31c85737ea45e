package com.skein.eprints.projection;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skein.eprints.model.ActorProfile;
import com.skein.failure.RecordValidationException;
import com.skein.model.CommitFrame;
import com.skein.model.CommitOperation;
import com.skein.model.EntityReference;
import com.skein.saga.IndexProjection;
import com.skein.store.GraphEdge;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ActorProfileProjectorTest {

    private static final String DID = "did:plc:alice123";
    private static final CommitFrame FRAME = CommitFrame.builder()
            .repo(DID).collection("pub.chive.actor.profile").rkey("self")
            .operation(CommitOperation.UPDATE).cid("bafyreiprofile").sequence(3).build();

    private final ActorProfileProjector projector = new ActorProfileProjector();

    private static ActorProfile profile() {
        ObjectNode avatar = JsonNodeFactory.instance.objectNode();
        avatar.put("$type", "blob");
        avatar.putObject("ref").put("$link", "bafkreiavatar");
        avatar.put("mimeType", "image/png");
        return ActorProfile.builder()
                .displayName("Alice Liddell")
                .bio("Quantum information")
                .avatarBlobRef(avatar)
                .orcid("0000-0002-1825-0097")
                .affiliations(List.of("Oxford"))
                .fieldIds(List.of("quantum-computing", "at://did:plc:gov/pub.chive.graph.node/physics"))
                .build();
    }

    @Test
    void projectsProfileOfTheRepository() {
        EntityReference ref = EntityReference.of(DID, "pub.chive.actor.profile", "self");

        IndexProjection projection = projector.project(ref, profile(), FRAME);

        assertThat(projection.getRelational().getColumns())
                .containsEntry("did", DID)
                .containsEntry("display_name", "Alice Liddell")
                .containsEntry("avatar_blob_cid", "bafkreiavatar")
                .containsEntry("affiliations", List.of("Oxford"));
        assertThat(projection.getSearch().getFields()).containsEntry("displayName", "Alice Liddell");
        assertThat(projection.getGraph().getNodes()).singleElement().satisfies(node -> {
            assertThat(node.getCollection()).isEqualTo(GraphNodes.ACTORS);
            assertThat(node.getProperties()).containsEntry("label", "Alice Liddell");
        });
        assertThat(projection.getGraph().getEdges())
                .extracting(GraphEdge::getRelation, GraphEdge::getToKey)
                .containsExactly(
                        tuple("profile_of", DID),
                        tuple("works_in", "quantum-computing"),
                        tuple("works_in", "physics"));
    }

    @Test
    void profileWithoutDisplayNameKeepsExistingLabel() {
        EntityReference ref = EntityReference.of(DID, "pub.chive.actor.profile", "self");
        ActorProfile profile = profile();
        profile.setDisplayName(null);
        profile.setAvatarBlobRef(null);

        IndexProjection projection = projector.project(ref, profile, FRAME);

        assertThat(projection.getGraph().getNodes().get(0).getProperties()).doesNotContainKey("label");
        assertThat(projection.getRelational().getColumns()).containsEntry("avatar_blob_cid", null);
    }

    @Test
    void onlyTheSelfRecordIsAProfile() {
        EntityReference ref = EntityReference.of(DID, "pub.chive.actor.profile", "3kother");

        assertThatThrownBy(() -> projector.project(ref, profile(), FRAME))
                .isInstanceOf(RecordValidationException.class)
                .extracting("field").isEqualTo("rkey");
    }
}
