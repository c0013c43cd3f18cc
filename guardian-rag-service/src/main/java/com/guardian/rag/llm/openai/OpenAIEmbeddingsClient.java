package com.guardian.rag.llm.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardian.rag.http.Http;
import com.guardian.rag.json.Json;
import com.guardian.rag.llm.EmbeddingBatch;
import com.guardian.rag.llm.EmbeddingException;
import com.guardian.rag.llm.EmbeddingsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Batched client for any OpenAI-compatible {@code /v1/embeddings} endpoint
 * (OpenAI, llama.cpp, Ollama, text-embeddings-inference).
 */
public final class OpenAIEmbeddingsClient implements EmbeddingsClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIEmbeddingsClient.class);

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Duration timeout;

    public OpenAIEmbeddingsClient(String baseUrl, String model, String apiKey, Duration timeout) {
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new EmbeddingException("Cannot embed an empty batch");
        }

        long startTime = System.currentTimeMillis();
        HttpResponse<String> resp;
        try {
            ObjectNode body = Json.MAPPER.createObjectNode().put("model", model);
            ArrayNode input = body.putArray("input");
            texts.forEach(input::add);

            HttpRequest req = Http.withBearer(HttpRequest.newBuilder(), apiKey)
                    .uri(URI.create(baseUrl + "/v1/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();

            resp = Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding call interrupted", e);
        } catch (Exception e) {
            throw new EmbeddingException("OpenAI-compatible embedding failed", e);
        }

        if (resp.statusCode() / 100 != 2) {
            throw new EmbeddingException("OpenAI-compatible embed HTTP " + resp.statusCode() + ": " + resp.body());
        }

        EmbeddingBatch batch = parse(resp.body(), texts.size());
        log.debug("[EMBED TIMING] {}ms for {} texts (dim={})",
                System.currentTimeMillis() - startTime, texts.size(), batch.dimension());
        return batch;
    }

    @Override
    public String model() {
        return model;
    }

    static EmbeddingBatch parse(String json, int expected) {
        JsonNode data;
        try {
            data = Json.MAPPER.readTree(json).get("data");
        } catch (Exception e) {
            throw new EmbeddingException("Bad embed response JSON", e);
        }
        if (data == null || !data.isArray() || data.size() != expected) {
            throw new EmbeddingException("Bad embed response: expected " + expected + " embeddings - " + json);
        }

        // The API may return items out of order, "index" is authoritative
        @SuppressWarnings("unchecked")
        List<Double>[] ordered = new List[expected];
        int dimension = -1;
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.has("index") ? item.get("index").asInt() : i;
            JsonNode vec = item.get("embedding");
            if (vec == null || !vec.isArray() || index < 0 || index >= expected) {
                throw new EmbeddingException("Bad embed response: malformed item " + i);
            }

            List<Double> out = new ArrayList<>(vec.size());
            for (JsonNode n : vec) out.add(n.asDouble());

            if (dimension < 0) {
                dimension = out.size();
            } else if (out.size() != dimension) {
                throw new EmbeddingException("Inconsistent embedding dimensions: " + dimension + " vs " + out.size());
            }
            ordered[index] = out;
        }
        if (dimension <= 1) {
            throw new EmbeddingException("Embedding vector looks wrong (dim=" + dimension + ")");
        }
        if (Arrays.asList(ordered).contains(null)) {
            throw new EmbeddingException("Bad embed response: duplicate or missing indexes");
        }
        return new EmbeddingBatch(List.of(ordered), dimension);
    }
}
