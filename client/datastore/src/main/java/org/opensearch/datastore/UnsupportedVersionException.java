/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import java.util.Locale;

/**
 * Thrown at startup when the engine behind the configured hosts is older than the minimum version the
 * datastore supports.
 */
public final class UnsupportedVersionException extends DatastoreException {

    private final String distribution;
    private final EngineVersion detected;
    private final EngineVersion minimum;

    public UnsupportedVersionException(String distribution, EngineVersion detected, EngineVersion minimum) {
        super(
            String.format(
                Locale.ROOT,
                "%s version %s is not supported by the datastore. Upgrade to %s %s at minimum.",
                distribution,
                detected,
                distribution,
                minimum
            )
        );
        this.distribution = distribution;
        this.detected = detected;
        this.minimum = minimum;
    }

    public String getDistribution() {
        return distribution;
    }

    public EngineVersion getDetected() {
        return detected;
    }

    public EngineVersion getMinimum() {
        return minimum;
    }
}
