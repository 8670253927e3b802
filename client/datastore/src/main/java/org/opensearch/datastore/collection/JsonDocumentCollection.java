/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.collection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensearch.client.Request;
import org.opensearch.client.Response;
import org.opensearch.client.ResponseException;
import org.opensearch.datastore.Datastore;
import org.opensearch.datastore.Responses;

import java.io.IOException;
import java.net.URLEncoder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link DocumentCollection} storing raw JSON documents in an index named after the collection.
 */
public class JsonDocumentCollection implements DocumentCollection {

    private static final Log logger = LogFactory.getLog(JsonDocumentCollection.class);

    private final Datastore datastore;
    private final String name;
    private final CollectionSchema schema;
    private final boolean validate;

    public JsonDocumentCollection(Datastore datastore, String name, CollectionSchema schema, boolean validate) {
        this.datastore = Objects.requireNonNull(datastore, "datastore must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.validate = validate;
    }

    @Override
    public String getName() {
        return name;
    }

    public CollectionSchema getSchema() {
        return schema;
    }

    public boolean isValidate() {
        return validate;
    }

    @Override
    public void ensureExists() throws IOException {
        boolean exists = datastore.withRetries("exists", name, client -> {
            // the client does not treat a 404 on HEAD as an error
            Response response = client.performRequest(new Request("HEAD", "/" + name));
            return response.getStatusLine().getStatusCode() == 200;
        });
        if (exists) {
            return;
        }
        try {
            datastore.withRetries("create_index", name, client -> {
                Request request = new Request("PUT", "/" + name);
                if (schema.isDynamic() == false) {
                    ObjectNode body = Responses.newObject();
                    body.set("mappings", schema.getMappings());
                    request.setJsonEntity(Responses.toJson(body));
                }
                return Responses.perform(client, request);
            });
            logger.info("created index [" + name + "]");
        } catch (ResponseException e) {
            if ("resource_already_exists_exception".equals(Responses.errorType(e)) == false) {
                throw e;
            }
            logger.debug("index [" + name + "] was created concurrently");
        }
    }

    @Override
    public void create(String id, ObjectNode document) throws IOException {
        datastore.withRetries("create", name, client -> {
            Request request = new Request("PUT", docPath(id));
            request.addParameter("op_type", "create");
            request.setJsonEntity(Responses.toJson(document));
            return Responses.perform(client, request);
        }, true);
    }

    @Override
    public ObjectNode read(String id) throws IOException {
        ObjectNode result;
        try {
            result = datastore.withRetries("get", name, client -> Responses.perform(client, new Request("GET", docPath(id))));
        } catch (ResponseException e) {
            if (e.getResponse().getStatusLine().getStatusCode() == 404) {
                return null;
            }
            throw e;
        }
        JsonNode source = result.get("_source");
        return result.path("found").asBoolean(false) && source instanceof ObjectNode ? (ObjectNode) source : null;
    }

    @Override
    public boolean update(String id, ObjectNode partial) throws IOException {
        ObjectNode result = datastore.withRetries("update", name, client -> {
            Request request = new Request("POST", "/" + name + "/_update/" + encode(id));
            ObjectNode body = Responses.newObject();
            body.set("doc", partial);
            request.setJsonEntity(Responses.toJson(body));
            return Responses.perform(client, request);
        }, true);
        return "noop".equals(result.path("result").asText()) == false;
    }

    @Override
    public boolean delete(String id) throws IOException {
        try {
            datastore.withRetries("delete", name, client -> Responses.perform(client, new Request("DELETE", docPath(id))));
            return true;
        } catch (ResponseException e) {
            if (e.getResponse().getStatusLine().getStatusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public List<ObjectNode> query(String query, int rows) throws IOException {
        if (rows < 0) {
            throw new IllegalArgumentException("rows must not be negative but was [" + rows + "]");
        }
        ObjectNode result = datastore.withRetries("search", name, client -> {
            Request request = new Request("POST", "/" + name + "/_search");
            ObjectNode body = Responses.newObject();
            body.putObject("query").putObject("query_string").put("query", query);
            body.put("size", rows);
            request.setJsonEntity(Responses.toJson(body));
            return Responses.perform(client, request);
        });
        List<ObjectNode> documents = new ArrayList<>();
        for (JsonNode hit : result.path("hits").path("hits")) {
            JsonNode source = hit.get("_source");
            if (source instanceof ObjectNode) {
                documents.add((ObjectNode) source);
            }
        }
        return documents;
    }

    /**
     * Deletes every document matching the query string. Conflicts with concurrent writers are retried and
     * the documents deleted before each conflict are counted in.
     *
     * @return the number of deleted documents
     */
    public long deleteByQuery(String query) throws IOException {
        ObjectNode result = datastore.withRetries("delete_by_query", name, client -> {
            Request request = new Request("POST", "/" + name + "/_delete_by_query");
            request.addParameter("q", query);
            request.addParameter("refresh", "true");
            return Responses.perform(client, request);
        });
        return result.path("deleted").asLong(0);
    }

    private String docPath(String id) {
        return "/" + name + "/_doc/" + encode(id);
    }

    private static String encode(String id) {
        return URLEncoder.encode(Objects.requireNonNull(id, "id must not be null"), UTF_8).replace("+", "%20");
    }

    @Override
    public String toString() {
        return "JsonDocumentCollection{name=" + name + ", validate=" + validate + '}';
    }
}
