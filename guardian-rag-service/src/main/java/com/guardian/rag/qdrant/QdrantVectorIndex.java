package com.guardian.rag.qdrant;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardian.rag.http.Http;
import com.guardian.rag.index.ChunkPayload;
import com.guardian.rag.index.Distance;
import com.guardian.rag.index.IndexException;
import com.guardian.rag.index.IndexedPoint;
import com.guardian.rag.index.ScoredCandidate;
import com.guardian.rag.index.VectorIndex;
import com.guardian.rag.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link VectorIndex} over the Qdrant REST API.
 */
public final class QdrantVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    // Collection dimensions never change once created, so entries are never invalidated
    private final Map<String, Integer> dimensions = new ConcurrentHashMap<>();

    public QdrantVectorIndex(String baseUrl, String apiKey, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public boolean ensureCollection(String collection, int dimension, Distance distance) {
        OptionalInt existing = dimension(collection);
        if (existing.isPresent()) {
            if (existing.getAsInt() != dimension) {
                log.warn("Collection '{}' exists with dimension {} but embedder produces {}",
                        collection, existing.getAsInt(), dimension);
            }
            return false;
        }

        ObjectNode vectors = Json.MAPPER.createObjectNode()
                .put("size", dimension)
                .put("distance", distance.qdrantName());

        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("vectors", vectors);
        body.putObject("optimizers_config").put("default_segment_number", 2);

        HttpResponse<String> resp = send(request(collectionPath(collection)).PUT(json(body)).build(), "create collection");
        if (resp.statusCode() == 409) {
            // Created concurrently by another writer
            return false;
        }
        requireSuccess(resp, "create collection");

        dimensions.put(collection, dimension);
        log.info("Created Qdrant collection '{}' (dim={}, distance={})", collection, dimension, distance.qdrantName());
        return true;
    }

    @Override
    public OptionalInt dimension(String collection) {
        Integer cached = dimensions.get(collection);
        if (cached != null) return OptionalInt.of(cached);

        HttpResponse<String> resp = send(request(collectionPath(collection)).GET().build(), "get collection");
        if (resp.statusCode() == 404) return OptionalInt.empty();
        requireSuccess(resp, "get collection");

        JsonNode vectors = readTree(resp.body()).at("/result/config/params/vectors");
        JsonNode size = vectors.get("size");
        if (size == null && vectors.isObject() && vectors.size() > 0) {
            // Named vectors: every name carries its own params
            size = vectors.elements().next().get("size");
        }
        if (size == null || !size.canConvertToInt()) {
            throw new IndexException("Qdrant collection '" + collection + "' has no readable vector size");
        }
        dimensions.put(collection, size.asInt());
        return OptionalInt.of(size.asInt());
    }

    @Override
    public void upsert(String collection, List<IndexedPoint> points) {
        if (points.isEmpty()) return;

        int expected = dimension(collection)
                .orElseThrow(() -> new IndexException("Qdrant collection '" + collection + "' does not exist"));

        ArrayNode arr = Json.MAPPER.createArrayNode();
        for (IndexedPoint p : points) {
            if (p.vector() == null || p.vector().size() != expected) {
                throw new IndexException("Vector dimension mismatch for id=" + p.id()
                        + " expected=" + expected
                        + " got=" + (p.vector() == null ? "null" : p.vector().size()));
            }

            ObjectNode obj = Json.MAPPER.createObjectNode();
            obj.put("id", p.id());
            obj.set("vector", toArray(p.vector()));
            obj.set("payload", Json.MAPPER.valueToTree(p.payload()));
            arr.add(obj);
        }

        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("points", arr);

        HttpResponse<String> resp = send(
                request(collectionPath(collection) + "/points?wait=true").PUT(json(body)).build(), "upsert");
        requireSuccess(resp, "upsert");
    }

    @Override
    public List<ScoredCandidate> search(String collection, List<Double> vector, int limit) {
        long startTime = System.currentTimeMillis();

        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("vector", toArray(vector));
        body.put("limit", limit);
        body.put("with_payload", true);
        body.put("with_vector", false);

        HttpResponse<String> resp = send(
                request(collectionPath(collection) + "/points/search").POST(json(body)).build(), "search");
        if (resp.statusCode() == 404) return List.of();
        requireSuccess(resp, "search");

        List<ScoredCandidate> results = parseSearchResults(resp.body());
        log.debug("[QDRANT TIMING] search {}ms collection={} limit={} hits={}",
                System.currentTimeMillis() - startTime, collection, limit, results.size());
        return results;
    }

    @Override
    public long count(String collection) {
        ObjectNode body = Json.MAPPER.createObjectNode().put("exact", true);
        HttpResponse<String> resp = send(
                request(collectionPath(collection) + "/points/count").POST(json(body)).build(), "count");
        if (resp.statusCode() == 404) return 0;
        requireSuccess(resp, "count");
        return readTree(resp.body()).at("/result/count").asLong();
    }

    @Override
    public void deleteByDocId(String collection, String docId) {
        ObjectNode matchVal = Json.MAPPER.createObjectNode();
        matchVal.put("value", docId);

        ObjectNode keyFilter = Json.MAPPER.createObjectNode();
        keyFilter.put("key", ChunkPayload.DOC_ID);
        keyFilter.set("match", matchVal);

        ObjectNode filter = Json.MAPPER.createObjectNode();
        filter.set("must", Json.MAPPER.createArrayNode().add(keyFilter));

        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("filter", filter);

        HttpResponse<String> resp = send(
                request(collectionPath(collection) + "/points/delete?wait=true").POST(json(body)).build(), "delete");
        if (resp.statusCode() == 404) {
            log.info("Nothing to delete for doc_id={}: collection '{}' does not exist", docId, collection);
            return;
        }
        requireSuccess(resp, "delete");
    }

    static String collectionPath(String collection) {
        // URLEncoder is form encoding; a path segment needs %20 for spaces
        return "/collections/" + URLEncoder.encode(collection, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpRequest.Builder request(String path) {
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
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexException("Qdrant " + operation + " interrupted", e);
        } catch (Exception e) {
            throw new IndexException("Qdrant " + operation + " failed", e);
        }
    }

    private static void requireSuccess(HttpResponse<String> resp, String operation) {
        if (resp.statusCode() / 100 != 2) {
            throw new IndexException("Qdrant " + operation + " HTTP " + resp.statusCode() + ": " + resp.body());
        }
    }

    private static HttpRequest.BodyPublisher json(JsonNode body) {
        try {
            return HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body));
        } catch (Exception e) {
            throw new IndexException("Failed to serialize Qdrant request", e);
        }
    }

    private static JsonNode readTree(String json) {
        try {
            return Json.MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IndexException("Bad Qdrant JSON", e);
        }
    }

    private static ArrayNode toArray(List<Double> v) {
        ArrayNode a = Json.MAPPER.createArrayNode();
        for (Double d : v) a.add(d);
        return a;
    }

    static List<ScoredCandidate> parseSearchResults(String json) {
        JsonNode result = readTree(json).get("result");
        if (result == null || !result.isArray()) return List.of();

        List<ScoredCandidate> out = new ArrayList<>();
        for (JsonNode hit : result) {
            JsonNode payload = hit.get("payload");
            JsonNode score = hit.get("score");
            if (payload == null || score == null) continue;

            Map<String, Object> map = Json.MAPPER.convertValue(payload, PAYLOAD_TYPE);
            out.add(new ScoredCandidate(hit.path("id").asText(), ChunkPayload.fromMap(map), score.asDouble()));
        }
        return out;
    }
}
