package com.skein.eprints.projection;

import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import com.skein.saga.IndexProjection;

/**
 * Derives the three-store projection of one decoded record.
 *
 * <p>Implementations validate what the stores rely on and throw
 * {@link com.skein.failure.RecordValidationException} for records that can never be
 * indexed.  They may read the graph store but never write to any store.</p>
 */
@FunctionalInterface
public interface RecordProjector<R> {

    IndexProjection project(EntityReference ref, R record, CommitFrame frame) throws Exception;
}
