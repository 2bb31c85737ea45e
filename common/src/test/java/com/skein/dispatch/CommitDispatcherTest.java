package com.skein.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.skein.config.ObjectMappers;
import com.skein.failure.Classification;
import com.skein.failure.ErrorClassifier;
import com.skein.failure.FailureKind;
import com.skein.failure.RecordValidationException;
import com.skein.failure.TransientStoreException;
import com.skein.model.CommitFrame;
import com.skein.model.CommitOperation;
import com.skein.model.IndexingStage;
import com.skein.saga.IndexingOutcome;
import com.skein.testing.TestDomain;
import com.skein.testing.TestFrames;
import lombok.Data;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommitDispatcherTest {

    @Data
    public static class Submission {
        private String title;
        private int pages;
    }

    private enum TypedKind implements RecordKind {
        SUBMISSION;

        @Override
        public String getCollection() {
            return TestFrames.COLLECTION;
        }

        @Override
        public Class<?> getRecordClass() {
            return Submission.class;
        }
    }

    private final HandlerRegistry registry = new HandlerRegistry();
    private final CommitDispatcher dispatcher = new CommitDispatcher(registry, ObjectMappers.create(),
            new ErrorClassifier());

    @Test
    @DisplayName("Routes by collection and operation with the decoded record")
    void routesDecodedRecord() {
        List<String> seen = new ArrayList<>();
        registry.onUpsert(TypedKind.SUBMISSION, Submission.class, (ref, record, frame) -> {
            seen.add(frame.getOperation() + ":" + record.getTitle());
            return IndexingOutcome.success(ref, List.of(IndexingStage.RELATIONAL));
        });
        registry.onDelete(TypedKind.SUBMISSION, (ref, record, frame) -> {
            seen.add("DELETE:" + record);
            return IndexingOutcome.success(ref, List.of(IndexingStage.RELATIONAL));
        });

        dispatcher.dispatch(TestFrames.frame(1, "a", CommitOperation.CREATE));
        dispatcher.dispatch(TestFrames.frame(2, "a", CommitOperation.UPDATE));
        dispatcher.dispatch(TestFrames.frame(3, "a", CommitOperation.DELETE));

        assertThat(seen).containsExactly("CREATE:Title 1", "UPDATE:Title 2", "DELETE:null");
    }

    @Test
    @DisplayName("A collection without a handler resolves as nothing to do")
    void configurationGap() {
        IndexingOutcome outcome = dispatcher.dispatch(TestFrames.frame(1, "a", CommitOperation.CREATE));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getCommittedStages()).isEmpty();
    }

    @Test
    @DisplayName("A record that does not decode is a terminal validation failure")
    void undecodableRecord() {
        registry.onUpsert(TypedKind.SUBMISSION, Submission.class,
                (ref, record, frame) -> IndexingOutcome.success(ref, List.of(IndexingStage.RELATIONAL)));
        JsonNode record = JsonNodeFactory.instance.objectNode().put("title", "x").put("pages", "many");
        CommitFrame frame = TestFrames.frame(1, "a", CommitOperation.CREATE).toBuilder().record(record).build();

        IndexingOutcome outcome = dispatcher.dispatch(frame);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getError()).isInstanceOf(RecordValidationException.class);
        assertThat(outcome.getClassification()).isEqualTo(Classification.TERMINAL);
        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.VALIDATION_FAILURE);
    }

    @Test
    @DisplayName("Exceptions thrown by a handler are classified, not propagated")
    void handlerExceptionIsClassified() {
        registry.onUpsert(TypedKind.SUBMISSION, Submission.class, (ref, record, frame) -> {
            throw new TransientStoreException(IndexingStage.SEARCH, "cluster red");
        });

        IndexingOutcome outcome = dispatcher.dispatch(TestFrames.frame(1, "a", CommitOperation.CREATE));

        assertThat(outcome.isRetryable()).isTrue();
        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.TRANSIENT_STORE_FAILURE);
    }

    @Test
    void registryRejectsDuplicatesAndWrongRecordClass() {
        registry.onDelete(TypedKind.SUBMISSION, (ref, record, frame) -> IndexingOutcome.nothingToDo(ref));

        assertThatThrownBy(() -> registry.onDelete(TypedKind.SUBMISSION,
                (ref, record, frame) -> IndexingOutcome.nothingToDo(ref)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registry.onUpsert(TypedKind.SUBMISSION, JsonNode.class,
                (ref, record, frame) -> IndexingOutcome.nothingToDo(ref)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.onDelete(TestDomain.Kind.SUBMISSION,
                (ref, record, frame) -> IndexingOutcome.nothingToDo(ref)))
                .isInstanceOf(IllegalStateException.class);
    }
}
