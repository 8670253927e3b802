/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.retry;

/**
 * Why a failed attempt is worth retrying, and whether the connection has to be rebuilt before doing so.
 */
public enum RetryReason {
    /** The index was removed while a scroll or point in time was open on it. */
    SEARCH_CONTEXT_LOST(false),
    /** The transport timed out connecting or waiting for a response. */
    CONNECTION_TIMEOUT(true),
    /** The engine could not be reached or dropped the connection. */
    CONNECTION_FAILED(true),
    /** The engine rejected the credentials. */
    AUTHENTICATION_FAILED(true),
    /** The engine rejected the request with 429. */
    CLUSTER_BUSY(false),
    /** The index answered 503, usually because its primaries are not allocated yet. */
    INDEX_NOT_READY(false),
    /** The cluster refused to write to the index, for example because of a disk watermark block. */
    WRITES_BLOCKED(false);

    private final boolean resetsConnection;

    RetryReason(boolean resetsConnection) {
        this.resetsConnection = resetsConnection;
    }

    public boolean resetsConnection() {
        return resetsConnection;
    }
}
