/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.tasks;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensearch.client.Request;
import org.opensearch.datastore.Responses;
import org.opensearch.datastore.retry.RetryExecutor;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Deletes the results of completed tasks from the internal task index, which otherwise grows forever.
 */
public class TaskCleanup {

    private static final Log logger = LogFactory.getLog(TaskCleanup.class);

    public static final String TASK_INDEX = ".tasks";

    private final RetryExecutor retryExecutor;
    private final AsyncTaskWaiter taskWaiter;
    private final Clock clock;

    public TaskCleanup(RetryExecutor retryExecutor, AsyncTaskWaiter taskWaiter, Clock clock) {
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
        this.taskWaiter = Objects.requireNonNull(taskWaiter, "taskWaiter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Deletes completed tasks that started more than {@code age} ago.
     *
     * @param age minimum age of the tasks to delete
     * @param maxTasks maximum number of tasks to delete, {@code null} for no limit
     * @return the number of deleted tasks
     */
    public long cleanup(Duration age, Integer maxTasks) throws IOException {
        Objects.requireNonNull(age, "age must not be null");
        if (age.isNegative()) {
            throw new IllegalArgumentException("age must not be negative but was [" + age + "]");
        }
        if (maxTasks != null && maxTasks <= 0) {
            throw new IllegalArgumentException("maxTasks must be positive but was [" + maxTasks + "]");
        }
        final String query = buildQuery(age, clock.millis());
        ObjectNode task = retryExecutor.execute("delete_by_query", TASK_INDEX, client -> {
            Request request = new Request("POST", "/" + TASK_INDEX + "/_delete_by_query");
            request.addParameter("q", query);
            request.addParameter("wait_for_completion", "false");
            request.addParameter("conflicts", "proceed");
            if (maxTasks != null) {
                request.addParameter("max_docs", Integer.toString(maxTasks));
            }
            return Responses.perform(client, request);
        });

        ObjectNode result = taskWaiter.waitFor(task);
        long deleted = result.path("deleted").asLong(0);
        logger.info("deleted [" + deleted + "] completed tasks older than [" + age + "]");
        return deleted;
    }

    /**
     * Selects the completed tasks whose start time is before {@code nowMillis - age}.
     */
    static String buildQuery(Duration age, long nowMillis) {
        return "completed:true AND task.start_time_in_millis:<" + (nowMillis - age.toMillis());
    }
}
