package com.tomeqa.index.embed.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tomeqa.index.embed.EmbeddingsClient;
import com.tomeqa.index.exception.IndexServiceException;
import com.tomeqa.index.exception.TransientStoreException;
import com.tomeqa.index.http.Http;
import com.tomeqa.index.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Client for any server exposing the OpenAI {@code /v1/embeddings} API (OpenAI, llama.cpp, Ollama).
 */
public final class OpenAIEmbeddingsClient implements EmbeddingsClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIEmbeddingsClient.class);

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Duration timeout;

    public OpenAIEmbeddingsClient(String baseUrl, String model) {
        this(baseUrl, model, null, Duration.ofSeconds(60));
    }

    public OpenAIEmbeddingsClient(String baseUrl, String model, String apiKey, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        long startTime = System.currentTimeMillis();
        HttpResponse<String> resp;
        try {
            ArrayNode input = Json.MAPPER.createArrayNode();
            texts.forEach(input::add);
            ObjectNode body = Json.MAPPER.createObjectNode().put("model", model);
            body.set("input", input);

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            resp = Http.CLIENT.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientStoreException("Embedding request timed out after " + timeout, true, e);
        } catch (IOException e) {
            throw new TransientStoreException("Embedding request failed: " + e.getMessage(), false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while embedding", false, e);
        }

        if (resp.statusCode() >= 500) {
            throw new TransientStoreException("Embedding HTTP " + resp.statusCode() + ": " + resp.body(), false);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new IndexServiceException("Embedding HTTP " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
        }

        List<float[]> vectors = parse(resp.body(), texts.size());
        log.debug("[EMBED TIMING] total={}ms batch={}", System.currentTimeMillis() - startTime, texts.size());
        return vectors;
    }

    static List<float[]> parse(String responseBody, int expected) {
        JsonNode data;
        try {
            data = Json.MAPPER.readTree(responseBody).get("data");
        } catch (IOException e) {
            throw new IndexServiceException("Unreadable embedding response", e);
        }
        if (data == null || !data.isArray() || data.size() != expected) {
            throw new IndexServiceException("Bad embedding response: expected " + expected + " vectors", -1);
        }

        float[][] ordered = new float[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.has("index") ? item.get("index").asInt() : i;
            JsonNode vec = item.get("embedding");
            if (vec == null || !vec.isArray() || index < 0 || index >= expected) {
                throw new IndexServiceException("Bad embedding response: malformed item " + i, -1);
            }
            float[] out = new float[vec.size()];
            for (int j = 0; j < vec.size(); j++) {
                out[j] = (float) vec.get(j).asDouble();
            }
            ordered[index] = out;
        }
        if (Arrays.stream(ordered).anyMatch(v -> v == null)) {
            throw new IndexServiceException("Bad embedding response: duplicate indexes", -1);
        }
        return new ArrayList<>(Arrays.asList(ordered));
    }
}
