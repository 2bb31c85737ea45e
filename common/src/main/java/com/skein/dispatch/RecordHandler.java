package com.skein.dispatch;

import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import com.skein.saga.IndexingOutcome;

/**
 * Indexes one decoded record.  {@code record} is {@code null} for deletes.
 *
 * <p>Handlers normally delegate to {@link com.skein.saga.IndexingSaga} and return its
 * outcome.  Anything they throw is classified by the dispatcher.</p>
 */
@FunctionalInterface
public interface RecordHandler<R> {

    IndexingOutcome handle(EntityReference ref, R record, CommitFrame frame) throws Exception;
}
