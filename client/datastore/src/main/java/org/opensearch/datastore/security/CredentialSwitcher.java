/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.security;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensearch.client.Request;
import org.opensearch.datastore.ClientLifecycleManager;
import org.opensearch.datastore.DatastoreException;
import org.opensearch.datastore.HostUris;
import org.opensearch.datastore.Responses;
import org.opensearch.datastore.VersionGuard;
import org.opensearch.datastore.retry.RetryExecutor;
import org.opensearch.datastore.tasks.TaskCleanup;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Switches the identity a datastore connects with to one of a few privileged alternate users. The user and
 * its role are provisioned on the fly with a fresh random password, then the connection is rebuilt with the
 * new credentials.
 * <p>
 * Elasticsearch provisions them through its {@code _security} API, OpenSearch through the security plugin's
 * {@code _plugins/_security/api}.
 */
public class CredentialSwitcher {

    private static final Log logger = LogFactory.getLog(CredentialSwitcher.class);

    /**
     * User allowed to manage the internal task index, used to clean it up.
     */
    public static final String PLUMBER = "plumber";

    public static final String MANAGE_TASKS_ROLE = "manage_tasks";

    public static final Set<String> ALTERNATE_USERS = Collections.singleton(PLUMBER);

    static final int SECRET_BYTES = 32;

    private final RetryExecutor retryExecutor;
    private final ClientLifecycleManager lifecycle;
    private final String distribution;
    private final SecureRandom random;

    public CredentialSwitcher(RetryExecutor retryExecutor, ClientLifecycleManager lifecycle, String distribution) {
        this(retryExecutor, lifecycle, distribution, new SecureRandom());
    }

    CredentialSwitcher(RetryExecutor retryExecutor, ClientLifecycleManager lifecycle, String distribution, SecureRandom random) {
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.distribution = Objects.requireNonNull(distribution, "distribution must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Reconnects as {@code username}. Unknown users are ignored with a warning.
     *
     * @return whether the identity was switched
     * @throws DatastoreException if the engine distribution has no known security API
     */
    public boolean switchUser(String username) throws IOException {
        if (ALTERNATE_USERS.contains(username) == false) {
            logger.warn("Unknown alternative user '" + username + "' to switch to");
            return false;
        }
        final boolean opensearch = isOpenSearch();
        final String rolePath = opensearch ? "/_plugins/_security/api/roles/" : "/_security/role/";
        final String userPath = opensearch ? "/_plugins/_security/api/internalusers/" : "/_security/user/";

        retryExecutor.execute("put_role", client -> {
            Request request = new Request("PUT", rolePath + MANAGE_TASKS_ROLE);
            request.setJsonEntity(Responses.toJson(opensearch ? openSearchRole() : elasticsearchRole()));
            return Responses.perform(client, request);
        });

        final String password = generateSecret();
        retryExecutor.execute("put_user", client -> {
            Request request = new Request("PUT", userPath + username);
            request.setJsonEntity(Responses.toJson(opensearch ? openSearchUser(password) : elasticsearchUser(password)));
            return Responses.perform(client, request);
        });

        List<String> hosts = new ArrayList<>();
        for (String host : lifecycle.getHosts()) {
            hosts.add(HostUris.withCredentials(host, username, password));
        }
        lifecycle.reset(hosts);
        logger.info("switched datastore connection to user [" + username + "]");
        return true;
    }

    private boolean isOpenSearch() {
        if (VersionGuard.OPENSEARCH.equals(distribution)) {
            return true;
        }
        if (VersionGuard.ELASTICSEARCH.equals(distribution)) {
            return false;
        }
        throw new DatastoreException("no security API known for distribution [" + distribution + "], cannot switch user");
    }

    /**
     * Full privileges, restricted indices included, on the internal task index.
     */
    static ObjectNode elasticsearchRole() {
        ObjectNode role = Responses.newObject();
        ObjectNode indices = role.putArray("indices").addObject();
        indices.putArray("names").add(TaskCleanup.TASK_INDEX);
        indices.putArray("privileges").add("all");
        indices.put("allow_restricted_indices", true);
        return role;
    }

    static ObjectNode elasticsearchUser(String password) {
        ObjectNode user = Responses.newObject();
        user.put("password", password);
        ArrayNode roles = user.putArray("roles");
        roles.add(MANAGE_TASKS_ROLE);
        roles.add("superuser");
        return user;
    }

    /**
     * Security plugin role granting every index action on the internal task index.
     */
    static ObjectNode openSearchRole() {
        ObjectNode role = Responses.newObject();
        ObjectNode permissions = role.putArray("index_permissions").addObject();
        permissions.putArray("index_patterns").add(TaskCleanup.TASK_INDEX);
        permissions.putArray("allowed_actions").add("indices_all");
        return role;
    }

    static ObjectNode openSearchUser(String password) {
        ObjectNode user = Responses.newObject();
        user.put("password", password);
        ArrayNode roles = user.putArray("opensearch_security_roles");
        roles.add(MANAGE_TASKS_ROLE);
        roles.add("all_access");
        return user;
    }

    String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
