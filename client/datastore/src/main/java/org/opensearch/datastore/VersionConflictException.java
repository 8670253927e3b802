/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

/**
 * Raised when a write is rejected by optimistic concurrency control and the caller asked for conflicts to
 * be surfaced instead of absorbed. The cause is the original conflict response.
 */
public final class VersionConflictException extends DatastoreException {

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
