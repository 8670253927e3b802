/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.tasks;

import org.opensearch.datastore.ClientLifecycleManager;
import org.opensearch.datastore.DatastoreSettings;
import org.opensearch.datastore.retry.RetryExecutor;
import org.opensearch.datastore.test.DatastoreTestCase;
import org.opensearch.datastore.test.MockEngineServer;
import org.junit.After;
import org.junit.Before;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TaskCleanupTests extends DatastoreTestCase {

    private static final long NOW = 1_700_000_000_000L;
    private static final String DELETE_PATH = "/.tasks/_delete_by_query";

    private MockEngineServer server;
    private ClientLifecycleManager lifecycle;
    private TaskCleanup cleanup;

    @Before
    public void startServer() throws IOException {
        server = new MockEngineServer();
        lifecycle = new ClientLifecycleManager(Collections.singletonList(server.getHostUri()), DatastoreSettings.defaults());
        RetryExecutor executor = new RetryExecutor(lifecycle, new RecordingSleeper()::sleep);
        cleanup = new TaskCleanup(executor, new AsyncTaskWaiter(executor), Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @After
    public void stopServer() {
        lifecycle.close();
        server.close();
    }

    public void testBuildQuery() {
        assertEquals(
            "completed:true AND task.start_time_in_millis:<" + (NOW - 86_400_000L),
            TaskCleanup.buildQuery(Duration.ofDays(1), NOW)
        );
        assertEquals("completed:true AND task.start_time_in_millis:<" + NOW, TaskCleanup.buildQuery(Duration.ZERO, NOW));
    }

    public void testCleanupDeletesOldCompletedTasks() throws IOException {
        server.answer("POST", DELETE_PATH, 200, "{\"task\":\"node1:7\"}");
        server.answer("GET", "/_tasks/node1:7", 200, "{\"completed\":true,\"response\":{\"deleted\":12,\"total\":12}}");

        assertEquals(12, cleanup.cleanup(Duration.ofHours(6), null));

        List<MockEngineServer.RecordedRequest> deletes = server.getRequests("POST", DELETE_PATH);
        assertEquals(1, deletes.size());
        MockEngineServer.RecordedRequest delete = deletes.get(0);
        assertEquals("completed:true AND task.start_time_in_millis:<" + (NOW - Duration.ofHours(6).toMillis()), delete.getParameter("q"));
        assertEquals("false", delete.getParameter("wait_for_completion"));
        assertEquals("proceed", delete.getParameter("conflicts"));
        assertNull(delete.getParameter("max_docs"));
    }

    public void testCleanupIsBounded() throws IOException {
        int maxTasks = randomIntBetween(1, 10_000);
        server.answer("POST", DELETE_PATH, 200, "{\"task\":\"node1:8\"}");
        server.answer("GET", "/_tasks/node1:8", 200, "{\"completed\":true,\"response\":{\"deleted\":1}}");

        assertEquals(1, cleanup.cleanup(Duration.ofDays(30), maxTasks));
        assertEquals(Integer.toString(maxTasks), server.getRequests("POST", DELETE_PATH).get(0).getParameter("max_docs"));
    }

    public void testInvalidArguments() throws IOException {
        try {
            cleanup.cleanup(Duration.ofSeconds(-1), null);
            fail("expected a negative age to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("age"));
        }
        try {
            cleanup.cleanup(Duration.ofDays(1), 0);
            fail("expected a zero bound to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("maxTasks"));
        }
        assertTrue(server.getRequests().isEmpty());
    }
}
