package com.skein.failure;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import com.arangodb.ArangoDBException;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.client.ResponseException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.io.IOException;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLRecoverableException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTransientException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Labels a processing failure {@link Classification#RETRYABLE} or {@link Classification#TERMINAL}.
 *
 * <p>The cause chain is walked from the outermost exception inwards and the first
 * exception with a definite verdict wins:</p>
 * <ul>
 *   <li><b>Retryable</b>: connectivity, timeouts, throttling and resource exhaustion in
 *       any store ({@link TransientStoreException}, I/O errors, SQL states 08/40/53/57,
 *       HTTP 408/429/5xx from the search cluster, ArangoDB 408/409/429/503).</li>
 *   <li><b>Terminal</b>: problems with the record's own content
 *       ({@link RecordValidationException}, JSON mapping errors, integrity and data
 *       errors, bad grammar, HTTP 400 mapping failures, other ArangoDB 4xx).</li>
 * </ul>
 *
 * <p>Failures with no recognisable exception in the chain are treated as retryable;
 * the retry budget bounds how long such a frame can hold its lane.</p>
 */
@Slf4j
public class ErrorClassifier {

    public Classification classify(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            Classification verdict = classifySingle(current);
            if (verdict != null) {
                return verdict;
            }
        }
        log.debug("No definite classification for {}, treating as retryable",
                error == null ? "null" : error.getClass().getName());
        return Classification.RETRYABLE;
    }

    public boolean isRetryable(Throwable error) {
        return classify(error) == Classification.RETRYABLE;
    }

    /**
     * Returns the verdict for one exception in the chain, or {@code null} to keep walking.
     */
    private Classification classifySingle(Throwable t) {
        // ── Own taxonomy ─────────────────────────────────────────────────
        if (t instanceof TransientStoreException) {
            return Classification.RETRYABLE;
        }
        if (t instanceof RecordValidationException) {
            return Classification.TERMINAL;
        }

        // ── Content errors ───────────────────────────────────────────────
        if (t instanceof JsonProcessingException || t instanceof IllegalArgumentException) {
            return Classification.TERMINAL;
        }

        // ── Relational store ─────────────────────────────────────────────
        if (t instanceof DataIntegrityViolationException || t instanceof BadSqlGrammarException) {
            return Classification.TERMINAL;
        }
        if (t instanceof TransientDataAccessException
                || t instanceof RecoverableDataAccessException
                || t instanceof DataAccessResourceFailureException) {
            return Classification.RETRYABLE;
        }
        if (t instanceof SQLException) {
            return classifySql((SQLException) t);
        }

        // ── Search store ─────────────────────────────────────────────────
        if (t instanceof ElasticsearchException) {
            return classifyHttpStatus(((ElasticsearchException) t).status());
        }
        if (t instanceof ResponseException) {
            return classifyHttpStatus(
                    ((ResponseException) t).getResponse().getStatusLine().getStatusCode());
        }

        // ── Graph store ──────────────────────────────────────────────────
        if (t instanceof ArangoDBException) {
            Integer code = ((ArangoDBException) t).getResponseCode();
            if (code == null) {
                // no HTTP response at all: connection level
                return Classification.RETRYABLE;
            }
            if (code == 408 || code == 409 || code == 429 || code >= 500) {
                return Classification.RETRYABLE;
            }
            return code >= 400 ? Classification.TERMINAL : null;
        }

        // ── Generic infrastructure ───────────────────────────────────────
        if (t instanceof IOException
                || t instanceof TimeoutException
                || t instanceof RejectedExecutionException) {
            return Classification.RETRYABLE;
        }
        return null;
    }

    private Classification classifySql(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return Classification.RETRYABLE;
        }
        if (e instanceof SQLIntegrityConstraintViolationException
                || e instanceof SQLDataException
                || e instanceof SQLSyntaxErrorException) {
            return Classification.TERMINAL;
        }
        String state = e.getSQLState();
        if (state == null || state.length() < 2) {
            return null;
        }
        switch (state.substring(0, 2)) {
            case "08": // connection exception
            case "40": // transaction rollback, deadlock, serialization failure
            case "53": // insufficient resources
            case "57": // operator intervention, e.g. admin shutdown
                return Classification.RETRYABLE;
            case "22": // data exception
            case "23": // integrity constraint violation
            case "42": // syntax error or access rule violation
                return Classification.TERMINAL;
            default:
                return null;
        }
    }

    private Classification classifyHttpStatus(int status) {
        if (status == 408 || status == 429 || status >= 500) {
            return Classification.RETRYABLE;
        }
        if (status >= 400) {
            return Classification.TERMINAL;
        }
        return null;
    }
}
