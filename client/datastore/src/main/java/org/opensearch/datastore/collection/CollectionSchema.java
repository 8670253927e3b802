/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.collection;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Describes what a collection stores. The datastore only carries the descriptor around; interpreting it is
 * up to the {@link DocumentCollection} implementation bound to it.
 */
public final class CollectionSchema {

    private static final CollectionSchema DYNAMIC = new CollectionSchema(null);

    private final ObjectNode mappings;

    private CollectionSchema(ObjectNode mappings) {
        this.mappings = mappings;
    }

    /**
     * A schema without explicit mappings, the engine maps fields as it sees them.
     */
    public static CollectionSchema dynamic() {
        return DYNAMIC;
    }

    public static CollectionSchema withMappings(ObjectNode mappings) {
        if (mappings == null) {
            throw new IllegalArgumentException("mappings must not be null, use dynamic() instead");
        }
        return new CollectionSchema(mappings.deepCopy());
    }

    /**
     * The index mappings, {@code null} for a dynamic schema.
     */
    public ObjectNode getMappings() {
        return mappings == null ? null : mappings.deepCopy();
    }

    public boolean isDynamic() {
        return mappings == null;
    }

    @Override
    public String toString() {
        return isDynamic() ? "CollectionSchema{dynamic}" : "CollectionSchema{mappings=" + mappings + '}';
    }
}
