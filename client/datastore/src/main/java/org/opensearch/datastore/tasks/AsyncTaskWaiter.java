/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensearch.client.Request;
import org.opensearch.client.ResponseException;
import org.opensearch.datastore.DatastoreException;
import org.opensearch.datastore.Responses;
import org.opensearch.datastore.retry.RetryExecutor;

import java.io.IOException;
import java.util.Objects;

/**
 * Waits for a server side task, such as a delete by query started with {@code wait_for_completion=false},
 * to finish. Each poll blocks on the engine for at most {@link #POLL_TIMEOUT} so that the transport never
 * times out on long running tasks; a poll that ends with a {@code timeout_exception} simply means the task
 * is still running.
 */
public class AsyncTaskWaiter {

    private static final Log logger = LogFactory.getLog(AsyncTaskWaiter.class);

    public static final String POLL_TIMEOUT = "5s";

    static final String TIMEOUT_EXCEPTION = "timeout_exception";

    private final RetryExecutor retryExecutor;

    public AsyncTaskWaiter(RetryExecutor retryExecutor) {
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
    }

    /**
     * Waits for the task returned by an asynchronous request, i.e. a body with a {@code task} field.
     */
    public ObjectNode waitFor(JsonNode asyncResponse) throws IOException {
        JsonNode task = asyncResponse.path("task");
        if (task.isTextual() == false) {
            throw new DatastoreException("response does not reference a task: " + asyncResponse);
        }
        return waitFor(task.asText());
    }

    /**
     * Polls the task until it completes.
     *
     * @return the task's {@code response} when it has one, its {@code task.status} otherwise
     * @throws IOException any failure other than a poll timing out
     */
    public ObjectNode waitFor(String taskId) throws IOException {
        ObjectNode result = null;
        int polls = 0;
        while (result == null) {
            polls++;
            try {
                result = retryExecutor.execute("get_task", client -> {
                    Request request = new Request("GET", "/_tasks/" + taskId);
                    request.addParameter("wait_for_completion", "true");
                    request.addParameter("timeout", POLL_TIMEOUT);
                    return Responses.perform(client, request);
                });
            } catch (ResponseException e) {
                if (isPollTimeout(e) == false) {
                    throw e;
                }
                if (logger.isDebugEnabled()) {
                    logger.debug("task [" + taskId + "] still running after [" + polls + "] polls");
                }
            }
        }
        return taskResult(taskId, result);
    }

    static boolean isPollTimeout(ResponseException e) {
        int status = e.getResponse().getStatusLine().getStatusCode();
        return (status == 500 || status == 408) && TIMEOUT_EXCEPTION.equals(Responses.errorType(e));
    }

    static ObjectNode taskResult(String taskId, ObjectNode result) {
        JsonNode response = result.get("response");
        if (response instanceof ObjectNode) {
            return (ObjectNode) response;
        }
        JsonNode status = result.path("task").path("status");
        if (status instanceof ObjectNode) {
            return (ObjectNode) status;
        }
        throw new DatastoreException("task [" + taskId + "] completed without response nor status: " + result);
    }
}
