/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.opensearch.client.Request;
import org.opensearch.datastore.retry.RetryExecutor;

import java.io.IOException;

/**
 * Queries the engine's version once, at startup, and refuses to go on with an engine that is too old.
 */
public final class VersionGuard {

    public static final String ELASTICSEARCH = "elasticsearch";
    public static final String OPENSEARCH = "opensearch";

    public static final EngineVersion MIN_ELASTICSEARCH_VERSION = EngineVersion.fromString("7.10.0");
    public static final EngineVersion MIN_OPENSEARCH_VERSION = EngineVersion.fromString("1.0.0");

    private final String distribution;
    private final EngineVersion version;

    private VersionGuard(String distribution, EngineVersion version) {
        this.distribution = distribution;
        this.version = version;
    }

    /**
     * Reads the version from the root endpoint, retrying until the engine answers.
     *
     * @throws UnsupportedVersionException if the engine is older than the minimum for its distribution
     */
    public static VersionGuard check(RetryExecutor retryExecutor) throws IOException {
        ObjectNode info = retryExecutor.execute("info", client -> Responses.perform(client, new Request("GET", "/")));
        VersionGuard guard = fromInfo(info);
        if (guard.isSupportedVersion(guard.getMinimumVersion()) == false) {
            throw new UnsupportedVersionException(guard.distribution, guard.version, guard.getMinimumVersion());
        }
        return guard;
    }

    static VersionGuard fromInfo(JsonNode info) {
        JsonNode versionNode = info.path("version");
        JsonNode number = versionNode.path("number");
        if (number.isTextual() == false) {
            throw new DatastoreException("engine info carries no version number: " + info);
        }
        JsonNode distribution = versionNode.path("distribution");
        String name = distribution.isTextual() ? distribution.asText() : ELASTICSEARCH;
        return new VersionGuard(name, EngineVersion.fromString(number.asText()));
    }

    public String getDistribution() {
        return distribution;
    }

    public EngineVersion getVersion() {
        return version;
    }

    public EngineVersion getMinimumVersion() {
        return OPENSEARCH.equals(distribution) ? MIN_OPENSEARCH_VERSION : MIN_ELASTICSEARCH_VERSION;
    }

    public boolean isSupportedVersion(EngineVersion minimum) {
        return version.onOrAfter(minimum);
    }
}
