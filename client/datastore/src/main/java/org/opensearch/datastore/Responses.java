/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.http.HttpEntity;
import org.apache.http.util.EntityUtils;
import org.opensearch.client.Request;
import org.opensearch.client.Response;
import org.opensearch.client.ResponseException;
import org.opensearch.client.RestClient;

import java.io.IOException;
import java.io.InputStream;

/**
 * JSON plumbing shared by everything that talks to the engine: parsing response bodies and error bodies,
 * and rendering request bodies.
 */
public final class Responses {

    private static final Log logger = LogFactory.getLog(Responses.class);

    static final ObjectMapper MAPPER = new ObjectMapper();

    private Responses() {}

    /**
     * Parses the body of a successful response into a JSON object.
     *
     * @throws IOException if the body can not be read or is not a JSON object
     */
    public static ObjectNode toObject(Response response) throws IOException {
        HttpEntity entity = response.getEntity();
        if (entity == null) {
            throw new IOException("response to [" + response.getRequestLine() + "] has no body");
        }
        JsonNode node;
        try (InputStream in = entity.getContent()) {
            node = MAPPER.readTree(in);
        }
        if (node instanceof ObjectNode == false) {
            throw new IOException("response to [" + response.getRequestLine() + "] is not a json object");
        }
        return (ObjectNode) node;
    }

    /**
     * Performs the request and parses its body.
     */
    public static ObjectNode perform(RestClient client, Request request) throws IOException {
        return toObject(client.performRequest(request));
    }

    /**
     * Parses the body of an error response. Returns {@code null} when there is no body or it is not JSON,
     * which happens with proxies sitting in front of the engine.
     */
    public static JsonNode errorBody(ResponseException exception) {
        HttpEntity entity = exception.getResponse().getEntity();
        if (entity == null) {
            return null;
        }
        try {
            return MAPPER.readTree(EntityUtils.toString(entity));
        } catch (IOException e) {
            logger.debug("error response body is not json", e);
            return null;
        }
    }

    /**
     * Returns the {@code error.type} of an error response, or {@code null} if it has none.
     */
    public static String errorType(ResponseException exception) {
        JsonNode body = errorBody(exception);
        if (body == null) {
            return null;
        }
        JsonNode type = body.path("error").path("type");
        return type.isTextual() ? type.asText() : null;
    }

    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unable to render [" + value.getClass().getName() + "] as json", e);
        }
    }
}
