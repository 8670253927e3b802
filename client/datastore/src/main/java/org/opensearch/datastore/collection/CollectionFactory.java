/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.collection;

import org.opensearch.datastore.Datastore;

/**
 * Builds the {@link DocumentCollection} bound to a registered schema.
 */
@FunctionalInterface
public interface CollectionFactory {

    CollectionFactory JSON = JsonDocumentCollection::new;

    DocumentCollection create(Datastore datastore, String name, CollectionSchema schema, boolean validate);
}
