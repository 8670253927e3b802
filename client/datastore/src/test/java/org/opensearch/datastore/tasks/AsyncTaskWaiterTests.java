/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.tasks;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.opensearch.client.ResponseException;
import org.opensearch.datastore.ClientLifecycleManager;
import org.opensearch.datastore.DatastoreException;
import org.opensearch.datastore.DatastoreSettings;
import org.opensearch.datastore.retry.RetryExecutor;
import org.opensearch.datastore.test.DatastoreTestCase;
import org.opensearch.datastore.test.MockEngineServer;
import org.junit.After;
import org.junit.Before;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.opensearch.datastore.ResponseExceptions.error;

public class AsyncTaskWaiterTests extends DatastoreTestCase {

    private static final String TASK_PATH = "/_tasks/node1:42";
    private static final String POLL_TIMEOUT = "{\"error\":{\"type\":\"timeout_exception\","
        + "\"reason\":\"Timed out waiting for completion of [task]\"},\"status\":500}";

    private MockEngineServer server;
    private ClientLifecycleManager lifecycle;
    private AsyncTaskWaiter waiter;

    @Before
    public void startServer() throws IOException {
        server = new MockEngineServer();
        lifecycle = new ClientLifecycleManager(Collections.singletonList(server.getHostUri()), DatastoreSettings.defaults());
        waiter = new AsyncTaskWaiter(new RetryExecutor(lifecycle, new RecordingSleeper()::sleep));
    }

    @After
    public void stopServer() {
        lifecycle.close();
        server.close();
    }

    public void testReturnsTheResponseOfACompletedTask() throws IOException {
        server.answer("GET", TASK_PATH, 200, "{\"completed\":true,\"task\":{\"status\":{\"total\":3}},\"response\":{\"deleted\":3}}");
        ObjectNode result = waiter.waitFor(json("{\"task\":\"node1:42\"}"));
        assertEquals(3, result.get("deleted").asLong());

        List<MockEngineServer.RecordedRequest> polls = server.getRequests("GET", TASK_PATH);
        assertEquals(1, polls.size());
        assertEquals("true", polls.get(0).getParameter("wait_for_completion"));
        assertEquals(AsyncTaskWaiter.POLL_TIMEOUT, polls.get(0).getParameter("timeout"));
    }

    public void testFallsBackToTheTaskStatus() throws IOException {
        server.answer("GET", TASK_PATH, 200, "{\"completed\":true,\"task\":{\"status\":{\"total\":3,\"deleted\":2}}}");
        ObjectNode result = waiter.waitFor("node1:42");
        assertEquals(3, result.get("total").asLong());
        assertEquals(2, result.get("deleted").asLong());
    }

    public void testKeepsPollingOnTimeouts() throws IOException {
        int timeouts = randomIntBetween(1, 4);
        for (int i = 0; i < timeouts; i++) {
            server.answer("GET", TASK_PATH, 500, POLL_TIMEOUT);
        }
        server.answer("GET", TASK_PATH, 200, "{\"completed\":true,\"response\":{\"updated\":7}}");
        ObjectNode result = waiter.waitFor("node1:42");
        assertEquals(7, result.get("updated").asLong());
        assertEquals(timeouts + 1, server.getRequests("GET", TASK_PATH).size());
    }

    public void testOtherErrorsAbortTheWait() {
        server.answer("GET", TASK_PATH, 500, "{\"error\":{\"type\":\"illegal_state_exception\",\"reason\":\"boom\"},\"status\":500}");
        try {
            waiter.waitFor("node1:42");
            fail("expected the error to propagate");
        } catch (ResponseException e) {
            assertEquals(500, e.getResponse().getStatusLine().getStatusCode());
        } catch (IOException e) {
            throw new AssertionError(e);
        }
        assertEquals(1, server.getRequests("GET", TASK_PATH).size());
    }

    public void testMissingTask() {
        try {
            waiter.waitFor(json("{\"acknowledged\":true}"));
            fail("expected a missing task to be reported");
        } catch (DatastoreException e) {
            assertTrue(e.getMessage().contains("does not reference a task"));
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    public void testPollTimeoutDetection() throws IOException {
        assertTrue(AsyncTaskWaiter.isPollTimeout(error(500, "timeout_exception", "timed out")));
        assertTrue(AsyncTaskWaiter.isPollTimeout(error(408, "timeout_exception", "timed out")));
        assertFalse(AsyncTaskWaiter.isPollTimeout(error(500, "search_phase_execution_exception", "all shards failed")));
        assertFalse(AsyncTaskWaiter.isPollTimeout(error(404, "resource_not_found_exception", "task not found")));
    }

    public void testTaskWithoutResult() {
        try {
            AsyncTaskWaiter.taskResult("node1:42", json("{\"completed\":true}"));
            fail("expected an incomplete task result to be reported");
        } catch (DatastoreException e) {
            assertTrue(e.getMessage().contains("node1:42"));
        }
    }
}
