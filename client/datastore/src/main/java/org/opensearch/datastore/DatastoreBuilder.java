/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import org.opensearch.datastore.collection.CollectionFactory;
import org.opensearch.datastore.retry.Sleeper;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Helps creating a new {@link Datastore}. Allows to set the settings, the archive options, and the hooks
 * replacing how connections are opened and how the thread waits between attempts.
 */
public final class DatastoreBuilder {

    private final List<String> hosts;
    private DatastoreSettings settings = DatastoreSettings.defaults();
    private boolean archiveAccess = true;
    private int archiveAlternateRetention = 0;
    private CollectionFactory collectionFactory = CollectionFactory.JSON;
    private ClientLifecycleManager.ConnectionFactory connectionFactory = ClientLifecycleManager::connect;
    private Sleeper sleeper = Sleeper.THREAD;
    private Clock clock = Clock.systemUTC();

    /**
     * Creates a new builder instance and sets the hosts that the client will send requests to.
     *
     * @throws IllegalArgumentException if {@code hosts} is empty.
     * @throws NullPointerException if {@code hosts} or any host is {@code null}.
     */
    DatastoreBuilder(List<String> hosts) {
        Objects.requireNonNull(hosts, "hosts must not be null");
        if (hosts.isEmpty()) {
            throw new IllegalArgumentException("no hosts provided");
        }
        List<String> copy = new ArrayList<>(hosts.size());
        for (String host : hosts) {
            Objects.requireNonNull(host, "host cannot be null");
            HostUris.parse(host);
            copy.add(host);
        }
        this.hosts = Collections.unmodifiableList(copy);
    }

    DatastoreBuilder(String... hosts) {
        this(Arrays.asList(Objects.requireNonNull(hosts, "hosts must not be null")));
    }

    /**
     * Sets the connection and archive settings, {@link DatastoreSettings#defaults()} if not set.
     *
     * @throws NullPointerException if {@code settings} is {@code null}.
     */
    public DatastoreBuilder setSettings(DatastoreSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        return this;
    }

    public DatastoreBuilder setArchiveAccess(boolean archiveAccess) {
        this.archiveAccess = archiveAccess;
        return this;
    }

    /**
     * Sets the number of days archived documents are kept when they use the alternate retention.
     *
     * @throws IllegalArgumentException if {@code days} is negative.
     */
    public DatastoreBuilder setArchiveAlternateRetention(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("archiveAlternateRetention must not be negative but was [" + days + "]");
        }
        this.archiveAlternateRetention = days;
        return this;
    }

    public DatastoreBuilder setCollectionFactory(CollectionFactory collectionFactory) {
        this.collectionFactory = Objects.requireNonNull(collectionFactory, "collectionFactory must not be null");
        return this;
    }

    public DatastoreBuilder setConnectionFactory(ClientLifecycleManager.ConnectionFactory connectionFactory) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory must not be null");
        return this;
    }

    public DatastoreBuilder setSleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        return this;
    }

    public DatastoreBuilder setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        return this;
    }

    /**
     * Connects to the hosts and checks that the engine behind them is recent enough.
     *
     * @throws UnsupportedVersionException if the engine is older than the minimum supported version
     * @throws IOException if the engine could not be reached
     */
    public Datastore build() throws IOException {
        return new Datastore(this);
    }

    List<String> getHosts() {
        return hosts;
    }

    DatastoreSettings getSettings() {
        return settings;
    }

    boolean isArchiveAccess() {
        return archiveAccess;
    }

    int getArchiveAlternateRetention() {
        return archiveAlternateRetention;
    }

    CollectionFactory getCollectionFactory() {
        return collectionFactory;
    }

    ClientLifecycleManager.ConnectionFactory getConnectionFactory() {
        return connectionFactory;
    }

    Sleeper getSleeper() {
        return sleeper;
    }

    Clock getClock() {
        return clock;
    }
}
