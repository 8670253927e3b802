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
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensearch.client.Request;
import org.opensearch.client.Response;
import org.opensearch.datastore.collection.CollectionRegistry;
import org.opensearch.datastore.collection.CollectionSchema;
import org.opensearch.datastore.collection.DocumentCollection;
import org.opensearch.datastore.datemath.DateMathTranslator;
import org.opensearch.datastore.retry.DatastoreOperation;
import org.opensearch.datastore.retry.RetryExecutor;
import org.opensearch.datastore.security.CredentialSwitcher;
import org.opensearch.datastore.tasks.AsyncTaskWaiter;
import org.opensearch.datastore.tasks.TaskCleanup;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entry point to a search engine cluster. Holds the connection, retries every request through a
 * {@link RetryExecutor}, and hands out the {@link DocumentCollection}s registered on it.
 * <p>
 * Instances are thread safe. A closed datastore fails every further request with a
 * {@link NullPointerException}.
 */
public class Datastore implements Closeable {

    private static final Log logger = LogFactory.getLog(Datastore.class);

    private final ClientLifecycleManager lifecycle;
    private final RetryExecutor retryExecutor;
    private final VersionGuard versionGuard;
    private final AsyncTaskWaiter taskWaiter;
    private final TaskCleanup taskCleanup;
    private final CredentialSwitcher credentialSwitcher;
    private final CollectionRegistry registry;
    private final DateMathTranslator dateMath = DateMathTranslator.getInstance();
    private final boolean archiveAccess;
    private final int archiveAlternateRetention;

    Datastore(DatastoreBuilder builder) throws IOException {
        this.lifecycle = new ClientLifecycleManager(builder.getHosts(), builder.getSettings(), builder.getConnectionFactory());
        this.retryExecutor = new RetryExecutor(lifecycle, builder.getSleeper());
        try {
            this.versionGuard = VersionGuard.check(retryExecutor);
        } catch (IOException | RuntimeException e) {
            lifecycle.close();
            throw e;
        }
        this.taskWaiter = new AsyncTaskWaiter(retryExecutor);
        this.taskCleanup = new TaskCleanup(retryExecutor, taskWaiter, builder.getClock());
        this.credentialSwitcher = new CredentialSwitcher(retryExecutor, lifecycle, versionGuard.getDistribution());
        this.registry = new CollectionRegistry(this, builder.getCollectionFactory());
        this.archiveAccess = builder.isArchiveAccess();
        this.archiveAlternateRetention = builder.getArchiveAlternateRetention();
        logger.debug("connected to " + versionGuard.getDistribution() + " [" + versionGuard.getVersion() + "] at " + getHosts(true));
    }

    /**
     * Returns a new {@link DatastoreBuilder} to help with {@link Datastore} creation.
     */
    public static DatastoreBuilder builder(String... hosts) {
        return new DatastoreBuilder(hosts);
    }

    public static DatastoreBuilder builder(List<String> hosts) {
        return new DatastoreBuilder(hosts);
    }

    // collections

    /**
     * @throws InvalidCollectionNameException if the name contains anything but lower case letters, digits and underscores
     */
    public void register(String name, CollectionSchema schema) {
        registry.register(name, schema);
    }

    public DocumentCollection getCollection(String name) {
        return registry.getCollection(name);
    }

    public Map<String, CollectionSchema> getModels() {
        return registry.getModels();
    }

    public boolean isValidate() {
        return registry.isValidate();
    }

    public void setValidate(boolean validate) {
        registry.setValidate(validate);
    }

    // connection

    /**
     * Checks whether the cluster answers. Never throws, any failure reads as {@code false}.
     */
    public boolean ping() {
        try {
            Response response = lifecycle.client().performRequest(new Request("HEAD", "/"));
            return response.getStatusLine().getStatusCode() == 200;
        } catch (Exception e) {
            logger.debug("ping to " + getHosts(true) + " failed", e);
            return false;
        }
    }

    public boolean isClosed() {
        return lifecycle.isClosed();
    }

    /**
     * @param safe strip credentials, scheme and port, leaving only what can be logged
     */
    public List<String> getHosts(boolean safe) {
        return safe ? lifecycle.getSafeHosts() : lifecycle.getHosts();
    }

    public DatastoreSettings getSettings() {
        return lifecycle.getSettings();
    }

    @Override
    public void close() {
        lifecycle.close();
    }

    // tasks and credentials

    /**
     * Deletes every completed task that started more than {@code age} ago.
     *
     * @return the number of deleted tasks
     */
    public long taskCleanup(Duration age) throws IOException {
        return taskCleanup.cleanup(age, null);
    }

    public long taskCleanup(Duration age, int maxTasks) throws IOException {
        return taskCleanup.cleanup(age, maxTasks);
    }

    /**
     * Waits for the task started by an asynchronous request and returns its result.
     */
    public ObjectNode getTaskResults(JsonNode asyncResponse) throws IOException {
        return taskWaiter.waitFor(asyncResponse);
    }

    /**
     * Switches every connection to one of the {@link CredentialSwitcher#ALTERNATE_USERS alternate users}.
     *
     * @return {@code false} if the user is not an alternate user, in which case nothing changes
     */
    public boolean switchUser(String username) throws IOException {
        return credentialSwitcher.switchUser(username);
    }

    // retries

    public <T> T withRetries(String action, DatastoreOperation<T> operation) throws IOException {
        return retryExecutor.execute(action, operation);
    }

    public <T> T withRetries(String action, String index, DatastoreOperation<T> operation) throws IOException {
        return retryExecutor.execute(action, index, operation);
    }

    /**
     * Runs the operation, retrying it for as long as the cluster fails in a way that is worth retrying.
     *
     * @param index the index the operation targets, {@code null} if none
     * @param raiseConflicts throw {@link VersionConflictException} on the first conflict instead of retrying
     */
    public <T> T withRetries(String action, String index, DatastoreOperation<T> operation, boolean raiseConflicts)
        throws IOException {
        return retryExecutor.execute(action, index, operation, raiseConflicts);
    }

    // date math

    public String now() {
        return DateMathTranslator.NOW;
    }

    public String year() {
        return DateMathTranslator.YEAR;
    }

    public String month() {
        return DateMathTranslator.MONTH;
    }

    public String week() {
        return DateMathTranslator.WEEK;
    }

    public String day() {
        return DateMathTranslator.DAY;
    }

    public String hour() {
        return DateMathTranslator.HOUR;
    }

    public String minute() {
        return DateMathTranslator.MINUTE;
    }

    public String second() {
        return DateMathTranslator.SECOND;
    }

    public String millisecond() {
        return DateMathTranslator.MILLISECOND;
    }

    public String microsecond() {
        return DateMathTranslator.MICROSECOND;
    }

    public String nanosecond() {
        return DateMathTranslator.NANOSECOND;
    }

    public String dateSeparator() {
        return DateMathTranslator.SEPARATOR;
    }

    public String toNativeDateMath(String expression) {
        return dateMath.translate(expression);
    }

    // version and archive

    public EngineVersion getEngineVersion() {
        return versionGuard.getVersion();
    }

    public String getDistribution() {
        return versionGuard.getDistribution();
    }

    public boolean isSupportedVersion(EngineVersion minimum) {
        return versionGuard.isSupportedVersion(minimum);
    }

    public List<String> getArchiveIndices() {
        return lifecycle.getSettings().getArchiveIndices();
    }

    public boolean isArchiveAccess() {
        return archiveAccess;
    }

    public int getArchiveAlternateRetention() {
        return archiveAlternateRetention;
    }

    @Override
    public String toString() {
        return "Datastore - " + getHosts(true);
    }
}
