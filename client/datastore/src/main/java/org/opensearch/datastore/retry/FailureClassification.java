/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.retry;

import java.util.Objects;

/**
 * Outcome of classifying a failed attempt: retry it, absorb or escalate a version conflict, or give up.
 */
public final class FailureClassification {

    /**
     * The closed set of classifications.
     */
    public enum Kind {
        RETRY,
        CONFLICT,
        FATAL
    }

    private final Kind kind;
    private final RetryReason reason;
    private final ConflictCounts conflictCounts;
    private final Exception cause;

    private FailureClassification(Kind kind, RetryReason reason, ConflictCounts conflictCounts, Exception cause) {
        this.kind = kind;
        this.reason = reason;
        this.conflictCounts = conflictCounts;
        this.cause = Objects.requireNonNull(cause, "cause must not be null");
    }

    public static FailureClassification retry(RetryReason reason, Exception cause) {
        return new FailureClassification(Kind.RETRY, Objects.requireNonNull(reason, "reason must not be null"), null, cause);
    }

    public static FailureClassification conflict(ConflictCounts counts, Exception cause) {
        return new FailureClassification(Kind.CONFLICT, null, Objects.requireNonNull(counts, "counts must not be null"), cause);
    }

    public static FailureClassification fatal(Exception cause) {
        return new FailureClassification(Kind.FATAL, null, null, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The retry reason, only set for {@link Kind#RETRY}.
     */
    public RetryReason getReason() {
        return reason;
    }

    /**
     * The partial counts reported by the conflict, only set for {@link Kind#CONFLICT}.
     */
    public ConflictCounts getConflictCounts() {
        return conflictCounts;
    }

    public Exception getCause() {
        return cause;
    }

    @Override
    public String toString() {
        switch (kind) {
            case RETRY:
                return "retry[" + reason + "]";
            case CONFLICT:
                return "conflict[" + conflictCounts + "]";
            default:
                return "fatal[" + cause.getClass().getSimpleName() + "]";
        }
    }
}
