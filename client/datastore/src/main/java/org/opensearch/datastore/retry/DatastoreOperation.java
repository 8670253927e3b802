/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.retry;

import org.opensearch.client.RestClient;

import java.io.IOException;

/**
 * A call against the engine that the {@link RetryExecutor} may attempt many times. Every attempt receives
 * the connection that is current at that time, so implementations must not hold on to it.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface DatastoreOperation<T> {

    T perform(RestClient client) throws IOException;
}
