/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.retry;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensearch.client.RestClient;
import org.opensearch.datastore.ClientLifecycleManager;
import org.opensearch.datastore.VersionConflictException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs {@link DatastoreOperation}s until they succeed. There is no maximum number of attempts: the callers
 * are background workers that would rather block than fail while the cluster is degraded. Wrap calls in an
 * external timeout when a bounded wait is needed.
 * <p>
 * Every attempt goes through the same cycle: attempt, and on failure classify it with the
 * {@link FailureClassifier}, sleep, optionally reconnect, attempt again. The backoff is linear, one second
 * per retry so far, capped at {@link #MAX_RETRY_BACKOFF_SECONDS}. Failures that are not recognised are
 * rethrown unchanged.
 * <p>
 * Version conflicts are either escalated as {@link VersionConflictException} after a short random delay that
 * desynchronizes concurrent writers, or absorbed: the partial counts they report are summed up and merged
 * into the {@code updated} and {@code deleted} fields of the eventual successful result.
 * <p>
 * Retry state is local to an invocation, so concurrent callers never see each other's counts.
 */
public class RetryExecutor {

    private static final Log logger = LogFactory.getLog(RetryExecutor.class);

    public static final int MAX_RETRY_BACKOFF_SECONDS = 10;

    static final int CONFLICT_JITTER_MILLIS = 100;

    private final ClientLifecycleManager lifecycle;
    private final Sleeper sleeper;

    public RetryExecutor(ClientLifecycleManager lifecycle) {
        this(lifecycle, Sleeper.THREAD);
    }

    public RetryExecutor(ClientLifecycleManager lifecycle, Sleeper sleeper) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Runs an operation that targets no index, absorbing version conflicts.
     */
    public <T> T execute(String action, DatastoreOperation<T> operation) throws IOException {
        return execute(action, null, operation, false);
    }

    /**
     * Runs an operation against {@code index}, absorbing version conflicts.
     */
    public <T> T execute(String action, String index, DatastoreOperation<T> operation) throws IOException {
        return execute(action, index, operation, false);
    }

    /**
     * Runs an operation until it succeeds or fails in a way that is not worth retrying.
     *
     * @param action name of the operation, for logging
     * @param index the index the operation targets, or {@code null}
     * @param operation the operation
     * @param raiseConflicts whether version conflicts fail the call instead of being absorbed
     * @return the result of the successful attempt, with absorbed conflict counts merged in
     * @throws VersionConflictException on a version conflict when {@code raiseConflicts} is set
     * @throws InterruptedIOException if interrupted while backing off
     * @throws IOException the unchanged failure of an attempt that is not retryable
     * @throws NullPointerException if the datastore has been closed
     */
    public <T> T execute(String action, String index, DatastoreOperation<T> operation, boolean raiseConflicts) throws IOException {
        Objects.requireNonNull(operation, "operation must not be null");
        RetryState state = new RetryState();
        while (true) {
            RestClient client = lifecycle.client();
            T result;
            try {
                result = operation.perform(client);
            } catch (IOException | RuntimeException e) {
                FailureClassification classification = FailureClassifier.classify(e, index);
                switch (classification.getKind()) {
                    case CONFLICT:
                        if (raiseConflicts) {
                            sleep(ThreadLocalRandom.current().nextLong(CONFLICT_JITTER_MILLIS), action, e);
                            throw new VersionConflictException(e.getMessage(), e);
                        }
                        state.absorb(classification.getConflictCounts());
                        if (logger.isDebugEnabled()) {
                            logger.debug("absorbed version conflict during [" + action + "], " + state.getAbsorbed() + " so far");
                        }
                        sleep(state.backoffMillis(), action, e);
                        break;
                    case RETRY:
                        RetryReason reason = classification.getReason();
                        logger.warn(retryMessage(reason, action, index, e));
                        sleep(state.backoffMillis(), action, e);
                        if (reason.resetsConnection()) {
                            lifecycle.resetIfCurrent(client);
                        }
                        break;
                    default:
                        throw e;
                }
                state.nextAttempt();
                continue;
            }
            if (state.getRetries() > 0) {
                logger.info("datastore operation [" + action + "] succeeded after [" + state.getRetries() + "] retries");
            }
            return state.merge(result);
        }
    }

    private void sleep(long millis, String action, Exception lastFailure) throws InterruptedIOException {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException(
                "interrupted while retrying datastore operation [" + action + "]"
            );
            interrupted.initCause(lastFailure);
            interrupted.addSuppressed(e);
            throw interrupted;
        }
    }

    private String retryMessage(RetryReason reason, String action, String index, Exception e) {
        String indexName = index == null ? null : index.toUpperCase(Locale.ROOT);
        switch (reason) {
            case SEARCH_CONTEXT_LOST:
                return "Index " + indexName + " was removed while a query was running, retrying...";
            case CONNECTION_TIMEOUT:
                return "connection timeout, server(s): " + hosts() + ", retrying " + action + "...";
            case CONNECTION_FAILED:
            case AUTHENTICATION_FAILED:
                return "No connection to server(s): " + hosts() + ", because [" + e.getMessage() + "] retrying " + action + "...";
            case CLUSTER_BUSY:
                if (indexName != null) {
                    return "cluster is too busy to perform the requested task on index " + indexName + ", retrying...";
                }
                return "cluster is too busy to perform the requested task (" + e.getMessage() + "), retrying...";
            case INDEX_NOT_READY:
                return "Looks like index " + indexName + " is not ready yet, retrying...";
            case WRITES_BLOCKED:
                return "cluster is preventing writing operations on index " + indexName + ", retrying...";
            default:
                throw new AssertionError("unknown retry reason " + reason);
        }
    }

    private String hosts() {
        return String.join(" | ", lifecycle.getSafeHosts());
    }
}
