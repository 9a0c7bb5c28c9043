package com.tomeqa.index.store.qdrant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tomeqa.index.exception.IndexServiceException;
import com.tomeqa.index.exception.TransientStoreException;
import com.tomeqa.index.http.Http;
import com.tomeqa.index.json.Json;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.IndexPoint;
import com.tomeqa.index.model.ScoredChunk;
import com.tomeqa.index.store.AliasOperation;
import com.tomeqa.index.store.IndexServiceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link IndexServiceClient} over the Qdrant REST API.
 */
public final class QdrantIndexServiceClient implements IndexServiceClient {
    private static final Logger log = LoggerFactory.getLogger(QdrantIndexServiceClient.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};
    static final int SCROLL_PAGE_SIZE = 256;

    private final String baseUrl;
    private final String apiKey;
    private final String distance;
    private final Duration adminTimeout;
    private final Duration searchTimeout;

    public QdrantIndexServiceClient(String baseUrl, String apiKey, String distance,
                                    Duration adminTimeout, Duration searchTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.distance = (distance == null || distance.isBlank()) ? "Cosine" : distance;
        this.adminTimeout = adminTimeout;
        this.searchTimeout = searchTimeout;
    }

    @Override
    public String backendName() {
        return "qdrant";
    }

    @Override
    public void createCollection(String name, int vectorSize) {
        ObjectNode vectors = Json.MAPPER.createObjectNode()
                .put("size", vectorSize)
                .put("distance", distance);
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("vectors", vectors);

        HttpResponse<String> resp = send(request("/collections/" + encode(name), adminTimeout)
                .PUT(json(body)).build(), "create collection " + name);
        requireSuccess(resp, "create collection " + name);
        log.info("[QDRANT] Created collection {} (size={}, distance={})", name, vectorSize, distance);
    }

    @Override
    public boolean collectionExists(String name) {
        HttpResponse<String> resp = send(request("/collections/" + encode(name), adminTimeout)
                .GET().build(), "get collection " + name);
        if (resp.statusCode() == 404) {
            return false;
        }
        requireSuccess(resp, "get collection " + name);
        return true;
    }

    @Override
    public void deleteCollection(String name) {
        HttpResponse<String> resp = send(request("/collections/" + encode(name), adminTimeout)
                .DELETE().build(), "delete collection " + name);
        requireSuccess(resp, "delete collection " + name);
        log.info("[QDRANT] Deleted collection {}", name);
    }

    @Override
    public List<String> listCollections() {
        HttpResponse<String> resp = send(request("/collections", adminTimeout).GET().build(), "list collections");
        requireSuccess(resp, "list collections");
        List<String> names = new ArrayList<>();
        for (JsonNode c : readResult(resp).path("collections")) {
            names.add(c.path("name").asText());
        }
        return names;
    }

    @Override
    public void upsert(String collection, List<IndexPoint> points) {
        ArrayNode arr = Json.MAPPER.createArrayNode();
        for (IndexPoint p : points) {
            ObjectNode obj = Json.MAPPER.createObjectNode();
            obj.put("id", p.id());
            obj.set("vector", toArray(p.vector()));
            obj.set("payload", Json.MAPPER.valueToTree(p.payload().toPayload()));
            arr.add(obj);
        }
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("points", arr);

        HttpResponse<String> resp = send(request("/collections/" + encode(collection) + "/points?wait=true", adminTimeout)
                .PUT(json(body)).build(), "upsert into " + collection);
        requireSuccess(resp, "upsert into " + collection);
    }

    @Override
    public List<ScoredChunk> search(String collection, float[] vector, int limit) {
        long startTime = System.currentTimeMillis();
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("vector", toArray(vector));
        body.put("limit", limit);
        body.put("with_payload", true);

        HttpResponse<String> resp = send(request("/collections/" + encode(collection) + "/points/search", searchTimeout)
                .POST(json(body)).build(), "search " + collection);
        requireSuccess(resp, "search " + collection);

        List<ScoredChunk> out = new ArrayList<>();
        for (JsonNode hit : readResult(resp)) {
            out.add(new ScoredChunk(toChunk(hit.get("payload")), hit.path("score").asDouble()));
        }
        log.debug("[QDRANT TIMING] search {} took {}ms, {} hits", collection, System.currentTimeMillis() - startTime, out.size());
        return out;
    }

    @Override
    public List<Chunk> scroll(String collection, Map<String, Object> filters, int limit) {
        ArrayNode must = Json.MAPPER.createArrayNode();
        filters.forEach((key, value) -> {
            ObjectNode match = Json.MAPPER.createObjectNode();
            match.set("value", Json.MAPPER.valueToTree(value));
            ObjectNode condition = Json.MAPPER.createObjectNode();
            condition.put("key", "metadata." + key);
            condition.set("match", match);
            must.add(condition);
        });

        List<Chunk> out = new ArrayList<>();
        JsonNode offset = null;
        while (out.size() < limit) {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.put("limit", Math.min(limit - out.size(), SCROLL_PAGE_SIZE));
            body.put("with_payload", true);
            body.put("with_vector", false);
            if (!must.isEmpty()) {
                ObjectNode filter = Json.MAPPER.createObjectNode();
                filter.set("must", must);
                body.set("filter", filter);
            }
            if (offset != null) {
                body.set("offset", offset);
            }

            HttpResponse<String> resp = send(request("/collections/" + encode(collection) + "/points/scroll", searchTimeout)
                    .POST(json(body)).build(), "scroll " + collection);
            requireSuccess(resp, "scroll " + collection);

            JsonNode result = readResult(resp);
            for (JsonNode point : result.path("points")) {
                out.add(toChunk(point.get("payload")));
            }
            offset = result.get("next_page_offset");
            if (offset == null || offset.isNull()) {
                break;
            }
        }
        return out;
    }

    @Override
    public long count(String collection) {
        ObjectNode body = Json.MAPPER.createObjectNode().put("exact", true);
        HttpResponse<String> resp = send(request("/collections/" + encode(collection) + "/points/count", adminTimeout)
                .POST(json(body)).build(), "count " + collection);
        requireSuccess(resp, "count " + collection);
        return readResult(resp).path("count").asLong();
    }

    @Override
    public Optional<String> resolveAlias(String alias) {
        HttpResponse<String> resp = send(request("/aliases", adminTimeout).GET().build(), "list aliases");
        requireSuccess(resp, "list aliases");
        for (JsonNode a : readResult(resp).path("aliases")) {
            if (alias.equals(a.path("alias_name").asText())) {
                return Optional.of(a.path("collection_name").asText());
            }
        }
        return Optional.empty();
    }

    @Override
    public void updateAliases(List<AliasOperation> operations) {
        ArrayNode actions = Json.MAPPER.createArrayNode();
        for (AliasOperation op : operations) {
            ObjectNode action = Json.MAPPER.createObjectNode();
            if (op.type() == AliasOperation.Type.DELETE) {
                action.set("delete_alias", Json.MAPPER.createObjectNode().put("alias_name", op.alias()));
            } else {
                action.set("create_alias", Json.MAPPER.createObjectNode()
                        .put("collection_name", op.collection())
                        .put("alias_name", op.alias()));
            }
            actions.add(action);
        }
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("actions", actions);

        HttpResponse<String> resp = send(request("/collections/aliases", adminTimeout)
                .POST(json(body)).build(), "update aliases");
        requireSuccess(resp, "update aliases");
        log.info("[QDRANT] Applied alias batch with {} actions", operations.size());
    }

    private HttpRequest.Builder request(String path, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest req, String operation) {
        try {
            return Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientStoreException("Qdrant " + operation + " timed out", true, e);
        } catch (IOException e) {
            throw new TransientStoreException("Qdrant " + operation + " failed: " + e.getMessage(), false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted during Qdrant " + operation, false, e);
        }
    }

    private static void requireSuccess(HttpResponse<String> resp, String operation) {
        int status = resp.statusCode();
        if (status / 100 == 2) {
            return;
        }
        if (status >= 500) {
            throw new TransientStoreException("Qdrant " + operation + " HTTP " + status + ": " + resp.body(), false);
        }
        throw new IndexServiceException("Qdrant " + operation + " HTTP " + status + ": " + resp.body(), status);
    }

    private static JsonNode readResult(HttpResponse<String> resp) {
        try {
            JsonNode result = Json.MAPPER.readTree(resp.body()).get("result");
            if (result == null) {
                throw new IndexServiceException("Qdrant response without result: " + resp.body(), resp.statusCode());
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new IndexServiceException("Unreadable Qdrant response", e);
        }
    }

    private static Chunk toChunk(JsonNode payload) {
        if (payload == null || payload.isNull()) {
            return Chunk.fromPayload(Map.of());
        }
        return Chunk.fromPayload(Json.MAPPER.convertValue(payload, PAYLOAD_TYPE));
    }

    private static HttpRequest.BodyPublisher json(JsonNode body) {
        try {
            return HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IndexServiceException("Cannot serialize Qdrant request", e);
        }
    }

    private static ArrayNode toArray(float[] vector) {
        ArrayNode arr = Json.MAPPER.createArrayNode();
        for (float v : vector) arr.add(v);
        return arr;
    }

    private static String encode(String name) {
        return URLEncoder.encode(name, StandardCharsets.UTF_8);
    }
}
