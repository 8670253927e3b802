/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.collection;

import org.opensearch.datastore.Datastore;
import org.opensearch.datastore.InvalidCollectionNameException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Registered schemas, and the collections built for them.
 * <p>
 * With validation on, a collection is built on first access and reused afterwards. With validation off
 * every access builds a fresh, uncached collection, so administrative callers never act on a stale one.
 */
public class CollectionRegistry {

    private static final Pattern VALID_NAME = Pattern.compile("[a-z0-9_]*");

    private final Datastore datastore;
    private final CollectionFactory factory;
    private final ConcurrentMap<String, CollectionSchema> models = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, DocumentCollection> collections = new ConcurrentHashMap<>();
    private volatile boolean validate = true;

    public CollectionRegistry(Datastore datastore, CollectionFactory factory) {
        this.datastore = Objects.requireNonNull(datastore, "datastore must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    /**
     * Registers the schema of a collection. Registering a name again replaces its schema and drops the
     * collection built for the previous one.
     *
     * @throws InvalidCollectionNameException if the name contains anything but lower case letters, digits and underscores
     */
    public void register(String name, CollectionSchema schema) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        if (VALID_NAME.matcher(name).matches() == false) {
            throw new InvalidCollectionNameException(name);
        }
        models.put(name, schema);
        collections.remove(name);
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under that name
     */
    public DocumentCollection getCollection(String name) {
        if (validate == false) {
            return factory.create(datastore, name, registeredSchema(name), false);
        }
        // the schema is read under the cache entry's lock so a concurrent register cannot leave a stale proxy cached
        return collections.computeIfAbsent(name, n -> factory.create(datastore, n, registeredSchema(n), true));
    }

    private CollectionSchema registeredSchema(String name) {
        CollectionSchema schema = models.get(name);
        if (schema == null) {
            throw new IllegalArgumentException("no collection registered under [" + name + "]");
        }
        return schema;
    }

    public Map<String, CollectionSchema> getModels() {
        return Collections.unmodifiableMap(models);
    }

    public boolean isValidate() {
        return validate;
    }

    public void setValidate(boolean validate) {
        this.validate = validate;
    }
}
