package com.skein.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skein.failure.Classification;
import com.skein.failure.ErrorClassifier;
import com.skein.failure.FailureKind;
import com.skein.failure.RecordValidationException;
import com.skein.model.CommitFrame;
import com.skein.model.EntityReference;
import com.skein.saga.IndexingOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes a commit frame to the handler registered for its record kind and operation.
 *
 * <p>The record JSON is decoded into the kind's record class first; a record that does
 * not decode is a terminal validation failure.  A collection the filter lets through but
 * no handler covers is a configuration gap: it is logged at WARN once per
 * (collection, operation) and the frame resolves as a no-op.</p>
 */
@Slf4j
public class CommitDispatcher {

    private final HandlerRegistry registry;
    private final ObjectMapper objectMapper;
    private final ErrorClassifier classifier;
    private final Set<String> reportedGaps = ConcurrentHashMap.newKeySet();

    public CommitDispatcher(HandlerRegistry registry, ObjectMapper objectMapper, ErrorClassifier classifier) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.classifier = classifier;
    }

    @SuppressWarnings("unchecked")
    public IndexingOutcome dispatch(CommitFrame frame) {
        EntityReference ref = frame.entityReference();

        Optional<RecordKind> kind = registry.kindFor(frame.getCollection());
        Optional<RecordHandler<?>> handler = kind.flatMap(k -> registry.handlerFor(k, frame.getOperation()));
        if (handler.isEmpty()) {
            if (reportedGaps.add(frame.getCollection() + "#" + frame.getOperation())) {
                log.warn("No handler for collection={} op={}; frames are acknowledged without indexing",
                        frame.getCollection(), frame.getOperation().wireName());
            }
            return IndexingOutcome.nothingToDo(ref);
        }

        Object record = null;
        if (frame.getOperation().carriesRecord()) {
            Class<?> type = kind.get().getRecordClass();
            try {
                record = objectMapper.treeToValue(frame.getRecord(), type);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                return failed(ref, new RecordValidationException(
                        "Record does not decode as " + type.getSimpleName() + ": " + e.getMessage(), null, e));
            }
        }

        try {
            return ((RecordHandler<Object>) handler.get()).handle(ref, record, frame);
        } catch (Exception e) {
            log.warn("Handler threw {}: {}", frame.describe(), e.getMessage());
            return failed(ref, e);
        }
    }

    private IndexingOutcome failed(EntityReference ref, Throwable error) {
        Classification classification = classifier.classify(error);
        return IndexingOutcome.builder()
                .reference(ref)
                .success(false)
                .error(error)
                .classification(classification)
                .failureKind(classification == Classification.TERMINAL
                        ? FailureKind.VALIDATION_FAILURE
                        : FailureKind.TRANSIENT_STORE_FAILURE)
                .build();
    }
}
