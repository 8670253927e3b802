/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.collection;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.List;

/**
 * The operations available on a named collection. Implementations send every call through the datastore's
 * {@link org.opensearch.datastore.Datastore#withRetries retry executor}.
 */
public interface DocumentCollection {

    String getName();

    /**
     * Creates the backing index if it does not exist yet.
     */
    void ensureExists() throws IOException;

    /**
     * Stores a new document.
     *
     * @throws org.opensearch.datastore.VersionConflictException if a document with that id already exists
     */
    void create(String id, ObjectNode document) throws IOException;

    /**
     * @return the document, or {@code null} if there is none with that id
     */
    ObjectNode read(String id) throws IOException;

    /**
     * Merges {@code partial} into the stored document.
     *
     * @return whether the document changed
     * @throws org.opensearch.datastore.VersionConflictException if the document was concurrently modified
     */
    boolean update(String id, ObjectNode partial) throws IOException;

    /**
     * @return whether a document was deleted
     */
    boolean delete(String id) throws IOException;

    /**
     * @return the documents matching the query string, at most {@code rows} of them
     */
    List<ObjectNode> query(String query, int rows) throws IOException;
}
