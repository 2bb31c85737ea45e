package com.skein.eprints;

import com.skein.dispatch.HandlerRegistry;
import com.skein.dispatch.IndexingDomain;
import com.skein.eprints.model.ActorProfile;
import com.skein.eprints.model.Endorsement;
import com.skein.eprints.model.EprintSubmission;
import com.skein.eprints.model.ReviewComment;
import com.skein.eprints.model.UserTag;
import com.skein.eprints.projection.ActorProfileProjector;
import com.skein.eprints.projection.EndorsementProjector;
import com.skein.eprints.projection.EprintProjector;
import com.skein.eprints.projection.GraphNodes;
import com.skein.eprints.projection.RecordProjector;
import com.skein.eprints.projection.ReviewCommentProjector;
import com.skein.eprints.projection.UserTagProjector;
import com.skein.saga.IndexingSaga;
import com.skein.store.GraphStore;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The eprint indexer's record kinds and how each is indexed.
 *
 * <p>Every kind is indexed through the {@link IndexingSaga}: creates and updates run the
 * kind's projector inside {@link IndexingSaga#index}, deletes go to
 * {@link IndexingSaga#delete}.</p>
 */
@Slf4j
public class EprintsDomain implements IndexingDomain {

    @Override
    public Map<String, String> tablesByCollection() {
        Map<String, String> tables = new LinkedHashMap<>();
        for (EprintRecordKind kind : EprintRecordKind.values()) {
            tables.put(kind.getCollection(), kind.getTable());
        }
        return tables;
    }

    @Override
    public Set<String> graphNodeCollections() {
        return Set.of(GraphNodes.TAGS, GraphNodes.FIELDS, GraphNodes.ACTORS);
    }

    @Override
    public void registerHandlers(HandlerRegistry registry, IndexingSaga saga, GraphStore graphStore) {
        UserTagProjector tags = new UserTagProjector();
        register(registry, saga, EprintRecordKind.SUBMISSION, EprintSubmission.class, new EprintProjector(graphStore));
        register(registry, saga, EprintRecordKind.REVIEW_COMMENT, ReviewComment.class, new ReviewCommentProjector());
        register(registry, saga, EprintRecordKind.ENDORSEMENT, Endorsement.class, new EndorsementProjector());
        register(registry, saga, EprintRecordKind.USER_TAG, UserTag.class, tags);
        register(registry, saga, EprintRecordKind.LEGACY_TAG, UserTag.class, tags);
        register(registry, saga, EprintRecordKind.ACTOR_PROFILE, ActorProfile.class, new ActorProfileProjector());
        log.info("Registered {} eprint record kinds", EprintRecordKind.values().length);
    }

    private static <R> void register(HandlerRegistry registry, IndexingSaga saga, EprintRecordKind kind,
                                     Class<R> type, RecordProjector<R> projector) {
        registry.onUpsert(kind, type, (ref, record, frame) -> saga.index(ref, () -> projector.project(ref, record, frame)));
        registry.onDelete(kind, (ref, record, frame) -> saga.delete(ref));
    }
}
