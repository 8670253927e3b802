/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.retry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Bookkeeping of a single {@link RetryExecutor} invocation. Never shared between invocations.
 */
final class RetryState {

    private static final Log logger = LogFactory.getLog(RetryState.class);

    private int retries;
    private ConflictCounts absorbed = ConflictCounts.ZERO;

    int getRetries() {
        return retries;
    }

    ConflictCounts getAbsorbed() {
        return absorbed;
    }

    void nextAttempt() {
        retries++;
    }

    /**
     * Backoff before the next attempt: one second per retry so far, capped.
     */
    long backoffMillis() {
        return Math.min(retries, RetryExecutor.MAX_RETRY_BACKOFF_SECONDS) * 1000L;
    }

    void absorb(ConflictCounts counts) {
        absorbed = absorbed.plus(counts);
    }

    /**
     * Adds the counts of the conflicts absorbed along the way to the successful result, so callers see
     * the totals over every attempt.
     */
    <T> T merge(T result) {
        if (absorbed.isEmpty()) {
            return result;
        }
        if (result instanceof ObjectNode) {
            ObjectNode node = (ObjectNode) result;
            if (absorbed.getUpdated() != 0) {
                node.put("updated", node.path("updated").asLong(0) + absorbed.getUpdated());
            }
            if (absorbed.getDeleted() != 0) {
                node.put("deleted", node.path("deleted").asLong(0) + absorbed.getDeleted());
            }
        } else if (logger.isDebugEnabled()) {
            String type = result == null ? null : result.getClass().getName();
            logger.debug("dropping " + absorbed + ", result of type [" + type + "] has no counts");
        }
        return result;
    }
}
