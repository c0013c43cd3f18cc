package com.guardian.rag.rerank;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardian.rag.http.Http;
import com.guardian.rag.index.ScoredCandidate;
import com.guardian.rag.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Re-ranking service to improve retrieval precision.
 *
 * Supports two backends:
 * - local: cross-encoder behind a rerank endpoint (text-embeddings-inference, vLLM, llama.cpp)
 * - cohere: Cohere Rerank API
 *
 * The cross-encoder score replaces the vector similarity score. When the
 * service is disabled or the backend fails, candidates come back unchanged,
 * so callers must not assume a reranking took place.
 */
@Service
public class RerankerService {

    private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

    private static final String COHERE_URL = "https://api.cohere.ai/v1/rerank";

    private final boolean enabled;
    private final String provider;
    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Duration timeout;

    public RerankerService(
            @Value("${guardian.rerank.enabled:false}") boolean enabled,
            @Value("${guardian.rerank.provider:local}") String provider,
            @Value("${guardian.rerank.base-url:http://localhost:8001}") String baseUrl,
            @Value("${guardian.rerank.model:cross-encoder/ms-marco-MiniLM-L-6-v2}") String model,
            @Value("${guardian.rerank.api-key:}") String apiKey,
            @Value("${guardian.rerank.timeout:30s}") Duration timeout
    ) {
        this.enabled = enabled;
        this.provider = provider;
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.timeout = timeout;

        log.info("[RERANK] Initialized: enabled={}, provider={}, model={}", enabled, provider, model);
    }

    /**
     * Re-rank candidates for a query.
     *
     * @return the same candidates, sorted by descending cross-encoder score
     */
    public List<ScoredCandidate> rerank(String query, List<ScoredCandidate> candidates) {
        if (!enabled) {
            log.debug("[RERANK] Disabled, returning original order");
            return candidates;
        }
        if (candidates.isEmpty()) {
            return candidates;
        }

        long startTime = System.currentTimeMillis();
        try {
            List<Double> scores = switch (provider.toLowerCase()) {
                case "cohere" -> scoreWithCohere(query, candidates);
                default -> scoreWithLocal(query, candidates);
            };

            List<ScoredCandidate> reranked = new ArrayList<>(candidates.size());
            for (int i = 0; i < candidates.size(); i++) {
                reranked.add(candidates.get(i).withScore(scores.get(i)));
            }
            reranked.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());

            log.info("[RERANK TIMING] {}ms for {} candidates (provider={})",
                    System.currentTimeMillis() - startTime, candidates.size(), provider);
            return reranked;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RERANK] Interrupted, returning original order");
            return candidates;
        } catch (Exception e) {
            log.error("[RERANK] Failed, returning original order: {}", e.getMessage());
            return candidates;
        }
    }

    /**
     * Local cross-encoder.
     *
     * Expected endpoint: POST /v1/rerank or POST /rerank
     * Request format: { "query": "...", "documents": ["...", "..."], "model": "..." }
     */
    private List<Double> scoreWithLocal(String query, List<ScoredCandidate> candidates) throws Exception {
        ObjectNode requestBody = requestBody(query, candidates, model);

        // Try /v1/rerank first, then /rerank
        String[] endpoints = {"/v1/rerank", "/rerank"};
        HttpResponse<String> response = null;

        for (String endpoint : endpoints) {
            try {
                HttpRequest request = HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + endpoint))
                        .timeout(timeout)
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(requestBody)))
                        .build();

                response = Http.CLIENT.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() == 200) {
                    break;
                }
            } catch (java.io.IOException e) {
                log.debug("[RERANK] Endpoint {} failed: {}", endpoint, e.getMessage());
            }
        }

        if (response == null || response.statusCode() != 200) {
            throw new IllegalStateException("Local reranker request failed");
        }

        return parseScores(response.body(), candidates.size());
    }

    /**
     * Cohere Rerank API
     * https://docs.cohere.com/reference/rerank
     */
    private List<Double> scoreWithCohere(String query, List<ScoredCandidate> candidates) throws Exception {
        ObjectNode requestBody = requestBody(query, candidates, model.isBlank() ? "rerank-english-v3.0" : model);
        requestBody.put("return_documents", false);

        HttpRequest request = Http.withBearer(HttpRequest.newBuilder(), apiKey)
                .uri(URI.create(COHERE_URL))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(requestBody)))
                .build();

        HttpResponse<String> response = Http.CLIENT.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new IllegalStateException("Cohere rerank failed: " + response.statusCode() + " - " + response.body());
        }

        return parseScores(response.body(), candidates.size());
    }

    private static ObjectNode requestBody(String query, List<ScoredCandidate> candidates, String model) {
        ObjectNode requestBody = Json.MAPPER.createObjectNode();
        requestBody.put("query", query);
        requestBody.put("model", model);
        requestBody.put("top_n", candidates.size());

        ArrayNode docsArray = requestBody.putArray("documents");
        for (ScoredCandidate c : candidates) {
            docsArray.add(c.text());
        }
        return requestBody;
    }

    /**
     * Parse standard rerank response format, one score per input document.
     * { "results": [{ "index": 0, "relevance_score": 0.95 }, ...] } or a bare array
     */
    static List<Double> parseScores(String json, int expected) throws Exception {
        JsonNode root = Json.MAPPER.readTree(json);
        JsonNode results = root.has("results") ? root.get("results") : root;
        if (!results.isArray()) {
            throw new IllegalStateException("Rerank response has no results array");
        }

        Double[] scores = new Double[expected];
        for (JsonNode result : results) {
            int index = result.path("index").asInt(-1);
            if (index < 0 || index >= expected) continue;
            scores[index] = result.has("relevance_score")
                    ? result.path("relevance_score").asDouble()
                    : result.path("score").asDouble();
        }

        List<Double> out = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            if (scores[i] == null) {
                throw new IllegalStateException("Rerank response is missing a score for document " + i);
            }
            out.add(scores[i]);
        }
        return out;
    }
}
