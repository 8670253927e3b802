/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.TrustAllStrategy;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.ssl.SSLContexts;
import org.opensearch.client.RestClient;
import org.opensearch.client.RestClientBuilder;

import javax.net.ssl.SSLContext;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Owns the {@link RestClient} a {@link Datastore} talks through: creates it, replaces it when it is deemed
 * broken or when the credentials change, and tears it down on {@link #close()}.
 * <p>
 * The client is created without any retry logic of its own, retrying is the job of the
 * {@link org.opensearch.datastore.retry.RetryExecutor} sitting on top of this class. Once closed the manager
 * never reconnects again: {@link #client()} fails hard instead.
 */
public class ClientLifecycleManager implements Closeable {

    private static final Log logger = LogFactory.getLog(ClientLifecycleManager.class);

    private final DatastoreSettings settings;
    private final ConnectionFactory connectionFactory;
    private volatile List<String> hosts;
    private volatile RestClient client;
    private volatile boolean closed;

    public ClientLifecycleManager(List<String> hosts, DatastoreSettings settings) {
        this(hosts, settings, ClientLifecycleManager::connect);
    }

    public ClientLifecycleManager(List<String> hosts, DatastoreSettings settings, ConnectionFactory connectionFactory) {
        if (hosts == null || hosts.isEmpty()) {
            throw new IllegalArgumentException("hosts must not be null or empty");
        }
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory must not be null");
        this.hosts = Collections.unmodifiableList(new ArrayList<>(hosts));
        this.client = connectionFactory.connect(this.hosts, settings);
    }

    /**
     * Returns the current connection.
     *
     * @throws NullPointerException if the manager has been closed, the connection is null from then on
     */
    public RestClient client() {
        return Objects.requireNonNull(client, "connection is null, the datastore has been closed");
    }

    public List<String> getHosts() {
        return hosts;
    }

    /**
     * Returns the host names only, without scheme, credentials or port.
     */
    public List<String> getSafeHosts() {
        List<String> safe = new ArrayList<>(hosts.size());
        for (String host : hosts) {
            safe.add(HostUris.safeHost(host));
        }
        return safe;
    }

    public DatastoreSettings getSettings() {
        return settings;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Replaces the connection with a new one built with the same settings against the current hosts.
     */
    public void reset() {
        reset(hosts);
    }

    /**
     * Replaces the connection with a new one built with the same settings against the given hosts. The
     * previous connection does not need to be closed first. Does nothing once the manager is closed.
     */
    public synchronized void reset(List<String> newHosts) {
        if (newHosts == null || newHosts.isEmpty()) {
            throw new IllegalArgumentException("hosts must not be null or empty");
        }
        if (closed) {
            logger.warn("not reconnecting to " + String.join(" | ", getSafeHosts()) + ", the datastore has been closed");
            return;
        }
        RestClient previous = client;
        List<String> copy = Collections.unmodifiableList(new ArrayList<>(newHosts));
        client = connectionFactory.connect(copy, settings);
        hosts = copy;
        closeQuietly(previous);
        logger.info("Reconnected to " + String.join(" | ", getSafeHosts()));
    }

    /**
     * Resets the connection only if {@code failed} is still the current one. Concurrent callers that all
     * observed the same broken connection end up replacing it once.
     *
     * @return whether a new connection was created
     */
    public synchronized boolean resetIfCurrent(RestClient failed) {
        if (closed || client != failed) {
            return false;
        }
        reset(hosts);
        return true;
    }

    /**
     * Marks the manager as closed and drops the connection. Any later use of {@link #client()} fails with a
     * {@link NullPointerException} rather than silently reconnecting.
     */
    @Override
    public synchronized void close() {
        closed = true;
        RestClient previous = client;
        client = null;
        closeQuietly(previous);
    }

    private static void closeQuietly(RestClient restClient) {
        if (restClient == null) {
            return;
        }
        try {
            restClient.close();
        } catch (IOException e) {
            logger.debug("failed to close discarded connection", e);
        }
    }

    /**
     * Builds a {@link RestClient} against the given hosts. Credentials embedded in the host URIs are sent
     * as basic authentication to the host they belong to. The path of the first host, if any, prefixes
     * every request.
     */
    public static RestClient connect(List<String> hosts, DatastoreSettings settings) {
        HttpHost[] httpHosts = new HttpHost[hosts.size()];
        CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
        for (int i = 0; i < hosts.size(); i++) {
            String host = hosts.get(i);
            httpHosts[i] = HostUris.toHttpHost(host);
            String username = HostUris.username(host);
            if (username != null) {
                String password = HostUris.password(host);
                credentialsProvider.setCredentials(
                    new AuthScope(httpHosts[i]),
                    new UsernamePasswordCredentials(username, password == null ? "" : password)
                );
            }
        }

        final SSLContext sslContext = sslContext(settings);
        final int timeoutMillis = Math.toIntExact(settings.getTransportTimeout().toMillis());
        RestClientBuilder builder = RestClient.builder(httpHosts)
            .setRequestConfigCallback(
                requestConfigBuilder -> requestConfigBuilder.setConnectTimeout(timeoutMillis).setSocketTimeout(timeoutMillis)
            )
            .setHttpClientConfigCallback(httpClientBuilder -> {
                httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider).setSSLContext(sslContext);
                if (settings.isVerifyCerts() == false) {
                    httpClientBuilder.setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
                }
                return httpClientBuilder;
            });
        String pathPrefix = HostUris.pathPrefix(hosts.get(0));
        if (pathPrefix != null) {
            builder.setPathPrefix(pathPrefix);
        }
        return builder.build();
    }

    /**
     * Trusts everything when certificate verification is off, only the configured root CA when it exists,
     * and the JVM defaults otherwise.
     */
    static SSLContext sslContext(DatastoreSettings settings) {
        try {
            if (settings.isVerifyCerts() == false) {
                return SSLContexts.custom().loadTrustMaterial(TrustAllStrategy.INSTANCE).build();
            }
            Path caPath = settings.getRootCaPath();
            if (Files.exists(caPath) == false) {
                return SSLContexts.createSystemDefault();
            }
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            try (InputStream in = Files.newInputStream(caPath)) {
                CertificateFactory certificateFactory = CertificateFactory.getInstance("X.509");
                int index = 0;
                for (Certificate certificate : certificateFactory.generateCertificates(in)) {
                    trustStore.setCertificateEntry("root-ca-" + index++, certificate);
                }
            }
            return SSLContexts.custom().loadTrustMaterial(trustStore, null).build();
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("could not create the ssl context", e);
        }
    }

    /**
     * Creates the connection for a list of hosts. Tests plug in their own to avoid real sockets.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        RestClient connect(List<String> hosts, DatastoreSettings settings);
    }
}
