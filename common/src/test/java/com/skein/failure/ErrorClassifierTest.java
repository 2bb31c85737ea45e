package com.skein.failure;

import com.arangodb.ArangoDBException;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.skein.model.IndexingStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.io.IOException;
import java.net.ConnectException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    @DisplayName("Store connectivity and timeouts are retryable")
    void connectivityIsRetryable() {
        assertThat(classifier.classify(new TransientStoreException(IndexingStage.SEARCH, "cluster unavailable")))
                .isEqualTo(Classification.RETRYABLE);
        assertThat(classifier.classify(new ConnectException("refused"))).isEqualTo(Classification.RETRYABLE);
        assertThat(classifier.classify(new TimeoutException("slow"))).isEqualTo(Classification.RETRYABLE);
        assertThat(classifier.classify(new QueryTimeoutException("statement timeout")))
                .isEqualTo(Classification.RETRYABLE);
    }

    @Test
    @DisplayName("Malformed content is terminal")
    void contentErrorsAreTerminal() {
        assertThat(classifier.classify(new RecordValidationException("title missing", "title")))
                .isEqualTo(Classification.TERMINAL);
        assertThat(classifier.classify(new JsonParseException((JsonParser) null, "bad json")))
                .isEqualTo(Classification.TERMINAL);
        assertThat(classifier.classify(new DataIntegrityViolationException("not null")))
                .isEqualTo(Classification.TERMINAL);
    }

    @Test
    @DisplayName("SQL state classes decide for plain SQLExceptions")
    void sqlStates() {
        assertThat(classifier.classify(new SQLException("connection lost", "08006")))
                .isEqualTo(Classification.RETRYABLE);
        assertThat(classifier.classify(new SQLException("deadlock", "40P01")))
                .isEqualTo(Classification.RETRYABLE);
        assertThat(classifier.classify(new SQLException("unique violation", "23505")))
                .isEqualTo(Classification.TERMINAL);
        assertThat(classifier.classify(new SQLException("invalid input", "22P02")))
                .isEqualTo(Classification.TERMINAL);
    }

    @Test
    @DisplayName("The outermost definite verdict in the cause chain wins")
    void walksCauseChain() {
        RuntimeException wrapped = new RuntimeException("handler failed",
                new IllegalStateException("inner", new IOException("socket reset")));
        assertThat(classifier.classify(wrapped)).isEqualTo(Classification.RETRYABLE);

        RuntimeException validationOverIo = new RecordValidationException("bad record", "x",
                new IOException("irrelevant"));
        assertThat(classifier.classify(validationOverIo)).isEqualTo(Classification.TERMINAL);
    }

    @Test
    @DisplayName("ArangoDB errors without a response are connection-level and retryable")
    void arangoWithoutResponse() {
        assertThat(classifier.classify(new ArangoDBException("connection refused")))
                .isEqualTo(Classification.RETRYABLE);
    }

    @Test
    @DisplayName("Unrecognised failures default to retryable")
    void unknownDefaultsToRetryable() {
        assertThat(classifier.classify(new IllegalStateException("who knows"))).isEqualTo(Classification.RETRYABLE);
        assertThat(classifier.isRetryable(null)).isTrue();
    }
}
