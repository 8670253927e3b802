/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import org.apache.http.HttpHost;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Helpers for the host URIs a {@link Datastore} is configured with. A host URI looks like
 * {@code scheme://[user:password@]host[:port][/path]}; the scheme defaults to {@code http} and the port
 * to {@link #DEFAULT_PORT}.
 */
public final class HostUris {

    public static final int DEFAULT_PORT = 9200;

    private HostUris() {}

    /**
     * Parses a host URI, adding the default scheme when the host has none.
     *
     * @throws IllegalArgumentException if the host is not a valid URI or names no host
     */
    public static URI parse(String host) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("host must not be null or empty");
        }
        String withScheme = host.contains("://") ? host : "http://" + host;
        URI uri;
        try {
            uri = new URI(withScheme);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid host [" + safeHost(host) + "]", e);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("host URI [" + safeHost(host) + "] does not name a host");
        }
        return uri;
    }

    public static HttpHost toHttpHost(String host) {
        URI uri = parse(host);
        int port = uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort();
        return new HttpHost(uri.getHost(), port, uri.getScheme());
    }

    /**
     * Returns the decoded user name embedded in the host, or {@code null} if it carries no credentials.
     */
    public static String username(String host) {
        String userInfo = parse(host).getRawUserInfo();
        if (userInfo == null) {
            return null;
        }
        int colon = userInfo.indexOf(':');
        return decode(colon == -1 ? userInfo : userInfo.substring(0, colon));
    }

    /**
     * Returns the decoded password embedded in the host, or {@code null} if it carries none.
     */
    public static String password(String host) {
        String userInfo = parse(host).getRawUserInfo();
        if (userInfo == null) {
            return null;
        }
        int colon = userInfo.indexOf(':');
        return colon == -1 ? null : decode(userInfo.substring(colon + 1));
    }

    /**
     * Returns the path of the host URI when it has one, to be used as the path prefix of every request.
     */
    public static String pathPrefix(String host) {
        String path = parse(host).getRawPath();
        if (path == null || path.isEmpty() || "/".equals(path)) {
            return null;
        }
        return path;
    }

    /**
     * Returns a copy of the host URI carrying the given credentials in place of its own, if any.
     */
    public static String withCredentials(String host, String username, String password) {
        URI uri = parse(host);
        StringBuilder builder = new StringBuilder();
        builder.append(uri.getScheme()).append("://").append(encode(username)).append(':').append(encode(password)).append('@');
        builder.append(uri.getHost());
        if (uri.getPort() != -1) {
            builder.append(':').append(uri.getPort());
        }
        if (uri.getRawPath() != null) {
            builder.append(uri.getRawPath());
        }
        if (uri.getRawQuery() != null) {
            builder.append('?').append(uri.getRawQuery());
        }
        return builder.toString();
    }

    /**
     * Strips everything but the host name: scheme, credentials, port and path are removed. Safe to log,
     * and never fails, even on values {@link #parse(String)} would reject.
     */
    public static String safeHost(String host) {
        String rest = host;
        int scheme = rest.indexOf("://");
        if (scheme != -1) {
            rest = rest.substring(scheme + 3);
        }
        int slash = rest.indexOf('/');
        if (slash != -1) {
            rest = rest.substring(0, slash);
        }
        int at = rest.lastIndexOf('@');
        if (at != -1) {
            rest = rest.substring(at + 1);
        }
        if (rest.startsWith("[")) {
            int end = rest.indexOf(']');
            return end == -1 ? rest : rest.substring(0, end + 1);
        }
        int colon = rest.indexOf(':');
        return colon == -1 ? rest : rest.substring(0, colon);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, UTF_8);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, UTF_8);
    }
}
