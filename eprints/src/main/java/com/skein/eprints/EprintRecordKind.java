package com.skein.eprints;

import com.skein.dispatch.RecordKind;
import com.skein.eprints.model.ActorProfile;
import com.skein.eprints.model.Endorsement;
import com.skein.eprints.model.EprintSubmission;
import com.skein.eprints.model.ReviewComment;
import com.skein.eprints.model.UserTag;

/**
 * Record kinds of the {@code pub.chive.*} namespace this indexer projects, with the
 * relational table each one lands in.
 */
public enum EprintRecordKind implements RecordKind {

    SUBMISSION("pub.chive.eprint.submission", "eprints_index", EprintSubmission.class),
    REVIEW_COMMENT("pub.chive.review.comment", "reviews_index", ReviewComment.class),
    ENDORSEMENT("pub.chive.review.endorsement", "endorsements_index", Endorsement.class),
    USER_TAG("pub.chive.eprint.userTag", "user_tags_index", UserTag.class),
    /** Older collection name for user tags; same shape and table. */
    LEGACY_TAG("pub.chive.eprint.tag", "user_tags_index", UserTag.class),
    ACTOR_PROFILE("pub.chive.actor.profile", "authors_index", ActorProfile.class);

    private final String collection;
    private final String table;
    private final Class<?> recordClass;

    EprintRecordKind(String collection, String table, Class<?> recordClass) {
        this.collection = collection;
        this.table = table;
        this.recordClass = recordClass;
    }

    @Override
    public String getCollection() {
        return collection;
    }

    public String getTable() {
        return table;
    }

    @Override
    public Class<?> getRecordClass() {
        return recordClass;
    }
}
