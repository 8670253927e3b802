/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.retry;

/**
 * Documents a by-query request managed to update or delete before it hit a version conflict.
 */
public final class ConflictCounts {

    public static final ConflictCounts ZERO = new ConflictCounts(0, 0);

    private final long updated;
    private final long deleted;

    public ConflictCounts(long updated, long deleted) {
        this.updated = updated;
        this.deleted = deleted;
    }

    public long getUpdated() {
        return updated;
    }

    public long getDeleted() {
        return deleted;
    }

    public boolean isEmpty() {
        return updated == 0 && deleted == 0;
    }

    public ConflictCounts plus(ConflictCounts other) {
        return new ConflictCounts(updated + other.updated, deleted + other.deleted);
    }

    @Override
    public String toString() {
        return "ConflictCounts{updated=" + updated + ", deleted=" + deleted + '}';
    }
}
