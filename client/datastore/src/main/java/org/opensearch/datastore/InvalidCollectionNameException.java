/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

/**
 * Thrown when a collection is registered under a name that contains anything but lower case letters,
 * digits and underscores.
 */
public final class InvalidCollectionNameException extends DatastoreException {

    private final String name;

    public InvalidCollectionNameException(String name) {
        super(
            "Invalid characters in model name ["
                + name
                + "]. You can only use lower case letters, numbers and underscores."
        );
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
