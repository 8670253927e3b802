/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Connection and archive settings of a {@link Datastore}. Instances are immutable and are handed to the
 * datastore at construction, see {@link #builder()} and {@link #fromEnvironment(Map)}.
 */
public final class DatastoreSettings {

    public static final String TRANSPORT_TIMEOUT_ENV = "AL_DATASTORE_TRANSPORT_TIMEOUT";
    public static final String ROOT_CA_PATH_ENV = "DATASTORE_ROOT_CA_PATH";
    public static final String VERIFY_CERTS_ENV = "DATASTORE_VERIFY_CERTS";

    /**
     * The default transport timeout, used for both connecting and waiting on a response.
     */
    public static final Duration DEFAULT_TRANSPORT_TIMEOUT = Duration.ofSeconds(90);

    /**
     * The default location of the root certificate authority used to validate the engine's certificates.
     */
    public static final Path DEFAULT_ROOT_CA_PATH = Paths.get("/etc/assemblyline/ssl/al_root-ca.crt");

    private static final DatastoreSettings DEFAULTS = builder().build();

    private final Duration transportTimeout;
    private final Path rootCaPath;
    private final boolean verifyCerts;
    private final boolean archiveEnabled;
    private final List<String> archiveIndices;

    private DatastoreSettings(Builder builder) {
        this.transportTimeout = builder.transportTimeout;
        this.rootCaPath = builder.rootCaPath;
        this.verifyCerts = builder.verifyCerts;
        this.archiveEnabled = builder.archiveEnabled;
        this.archiveIndices = Collections.unmodifiableList(List.copyOf(builder.archiveIndices));
    }

    public static DatastoreSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the transport settings from the given environment, falling back to the defaults for missing
     * variables. Archive settings are not environment driven and keep their defaults.
     *
     * @throws IllegalArgumentException if the transport timeout is not a positive number of seconds
     */
    public static DatastoreSettings fromEnvironment(Map<String, String> environment) {
        Builder builder = builder();
        String timeout = environment.get(TRANSPORT_TIMEOUT_ENV);
        if (timeout != null) {
            try {
                builder.setTransportTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "[" + TRANSPORT_TIMEOUT_ENV + "] must be a number of seconds but was [" + timeout + "]",
                    e
                );
            }
        }
        String caPath = environment.get(ROOT_CA_PATH_ENV);
        if (caPath != null) {
            builder.setRootCaPath(Paths.get(caPath));
        }
        String verify = environment.get(VERIFY_CERTS_ENV);
        if (verify != null) {
            builder.setVerifyCerts("true".equals(verify.toLowerCase(Locale.ROOT)));
        }
        return builder.build();
    }

    public Duration getTransportTimeout() {
        return transportTimeout;
    }

    public Path getRootCaPath() {
        return rootCaPath;
    }

    public boolean isVerifyCerts() {
        return verifyCerts;
    }

    public boolean isArchiveEnabled() {
        return archiveEnabled;
    }

    /**
     * The archive indices, only populated when archiving is enabled.
     */
    public List<String> getArchiveIndices() {
        return archiveEnabled ? archiveIndices : Collections.emptyList();
    }

    @Override
    public String toString() {
        return "DatastoreSettings{"
            + "transportTimeout="
            + transportTimeout
            + ", rootCaPath="
            + rootCaPath
            + ", verifyCerts="
            + verifyCerts
            + ", archiveEnabled="
            + archiveEnabled
            + ", archiveIndices="
            + archiveIndices
            + '}';
    }

    /**
     * Helps creating {@link DatastoreSettings}.
     */
    public static final class Builder {
        private Duration transportTimeout = DEFAULT_TRANSPORT_TIMEOUT;
        private Path rootCaPath = DEFAULT_ROOT_CA_PATH;
        private boolean verifyCerts = true;
        private boolean archiveEnabled = false;
        private List<String> archiveIndices = Collections.emptyList();

        private Builder() {}

        /**
         * @throws IllegalArgumentException if the timeout is zero or negative
         */
        public Builder setTransportTimeout(Duration transportTimeout) {
            Objects.requireNonNull(transportTimeout, "transportTimeout must not be null");
            if (transportTimeout.isZero() || transportTimeout.isNegative()) {
                throw new IllegalArgumentException("transportTimeout must be positive but was [" + transportTimeout + "]");
            }
            this.transportTimeout = transportTimeout;
            return this;
        }

        public Builder setRootCaPath(Path rootCaPath) {
            this.rootCaPath = Objects.requireNonNull(rootCaPath, "rootCaPath must not be null");
            return this;
        }

        public Builder setVerifyCerts(boolean verifyCerts) {
            this.verifyCerts = verifyCerts;
            return this;
        }

        public Builder setArchiveEnabled(boolean archiveEnabled) {
            this.archiveEnabled = archiveEnabled;
            return this;
        }

        public Builder setArchiveIndices(List<String> archiveIndices) {
            this.archiveIndices = Objects.requireNonNull(archiveIndices, "archiveIndices must not be null");
            return this;
        }

        public DatastoreSettings build() {
            return new DatastoreSettings(this);
        }
    }
}
