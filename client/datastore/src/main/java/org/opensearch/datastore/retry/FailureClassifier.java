/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.retry;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.http.ConnectionClosedException;
import org.apache.http.NoHttpResponseException;
import org.apache.http.conn.ConnectTimeoutException;
import org.opensearch.client.ResponseException;
import org.opensearch.datastore.Responses;

import javax.net.ssl.SSLException;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.CancellationException;

/**
 * Maps a failed attempt to a {@link FailureClassification}. Pure: looks at the failure and the index the
 * operation targets, nothing else.
 * <p>
 * Error responses are classified by status code. Transport failures are recognised anywhere in the cause
 * chain, as the REST client wraps them to keep the caller's stack trace.
 */
public final class FailureClassifier {

    static final String SEARCH_CONTEXT_MISSING = "No search context found";

    private static final String STOPPED_REACTOR = "I/O reactor";

    private FailureClassifier() {}

    /**
     * @param failure the failure of the last attempt
     * @param index the index the operation targets, {@code null} when it targets none
     */
    public static FailureClassification classify(Exception failure, String index) {
        boolean indexed = index != null && index.isEmpty() == false;
        if (failure instanceof ResponseException) {
            return classifyResponse((ResponseException) failure, indexed);
        }
        Throwable current = failure;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SocketTimeoutException || current instanceof ConnectTimeoutException) {
                return FailureClassification.retry(RetryReason.CONNECTION_TIMEOUT, failure);
            }
            if (isConnectionFailure(current)) {
                return FailureClassification.retry(RetryReason.CONNECTION_FAILED, failure);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return FailureClassification.fatal(failure);
    }

    private static FailureClassification classifyResponse(ResponseException failure, boolean indexed) {
        int status = failure.getResponse().getStatusLine().getStatusCode();
        switch (status) {
            case 404:
                String message = failure.getMessage();
                if (indexed && message != null && message.contains(SEARCH_CONTEXT_MISSING)) {
                    return FailureClassification.retry(RetryReason.SEARCH_CONTEXT_LOST, failure);
                }
                return FailureClassification.fatal(failure);
            case 409:
                return FailureClassification.conflict(conflictCounts(failure), failure);
            case 401:
                return FailureClassification.retry(RetryReason.AUTHENTICATION_FAILED, failure);
            case 429:
                return FailureClassification.retry(RetryReason.CLUSTER_BUSY, failure);
            case 503:
                return indexed ? FailureClassification.retry(RetryReason.INDEX_NOT_READY, failure) : FailureClassification.fatal(failure);
            case 403:
                return indexed ? FailureClassification.retry(RetryReason.WRITES_BLOCKED, failure) : FailureClassification.fatal(failure);
            default:
                return FailureClassification.fatal(failure);
        }
    }

    /**
     * Reads the top level {@code updated} and {@code deleted} counts a by-query conflict reports.
     */
    static ConflictCounts conflictCounts(ResponseException failure) {
        JsonNode body = Responses.errorBody(failure);
        if (body == null) {
            return ConflictCounts.ZERO;
        }
        return new ConflictCounts(body.path("updated").asLong(0), body.path("deleted").asLong(0));
    }

    private static boolean isConnectionFailure(Throwable t) {
        if (t instanceof ConnectException
            || t instanceof ConnectionClosedException
            || t instanceof NoHttpResponseException
            || t instanceof UnknownHostException
            || t instanceof SocketException
            || t instanceof SSLException
            || t instanceof CancellationException) {
            return true;
        }
        // requests sent through a client that was closed underneath them
        return t instanceof IllegalStateException && t.getMessage() != null && t.getMessage().contains(STOPPED_REACTOR);
    }
}
