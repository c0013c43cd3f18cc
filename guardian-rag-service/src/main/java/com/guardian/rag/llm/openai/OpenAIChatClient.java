package com.guardian.rag.llm.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardian.rag.http.Http;
import com.guardian.rag.json.Json;
import com.guardian.rag.llm.ChatClient;
import com.guardian.rag.llm.ChatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Client for OpenAI-compatible {@code /v1/chat/completions} endpoints. Groq is
 * the default deployment target.
 */
public final class OpenAIChatClient implements ChatClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIChatClient.class);

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Duration timeout;

    public OpenAIChatClient(String baseUrl, String model, String apiKey, Duration timeout) {
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public String chatOnce(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
        ObjectNode body = baseBody(systemPrompt, userPrompt, temperature);
        body.put("max_tokens", maxTokens);
        return send(body);
    }

    @Override
    public String chatStructured(String systemPrompt, String userPrompt, String schemaName, JsonNode schema,
                                 double temperature) {
        ObjectNode body = baseBody(systemPrompt, userPrompt, temperature);

        ObjectNode jsonSchema = Json.MAPPER.createObjectNode().put("name", schemaName);
        jsonSchema.set("schema", schema);
        ObjectNode responseFormat = body.putObject("response_format");
        responseFormat.put("type", "json_schema");
        responseFormat.set("json_schema", jsonSchema);

        return send(body);
    }

    private ObjectNode baseBody(String systemPrompt, String userPrompt, double temperature) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("stream", false);

        ArrayNode messages = body.putArray("messages");
        messages.addObject()
                .put("role", "system")
                .put("content", systemPrompt);
        messages.addObject()
                .put("role", "user")
                .put("content", userPrompt);
        return body;
    }

    private String send(ObjectNode body) {
        long startTime = System.currentTimeMillis();
        HttpResponse<String> resp;
        try {
            HttpRequest req = Http.withBearer(HttpRequest.newBuilder(), apiKey)
                    .uri(URI.create(baseUrl + "/v1/chat/completions"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();
            resp = Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatException("Chat call interrupted", e);
        } catch (Exception e) {
            throw new ChatException("OpenAI-compatible chat failed", e);
        }

        if (resp.statusCode() / 100 != 2) {
            throw new ChatException("OpenAI-compatible chat HTTP " + resp.statusCode() + ": " + resp.body());
        }

        String content = extractContent(resp.body());
        log.debug("[CHAT TIMING] {}ms model={} contentLen={}",
                System.currentTimeMillis() - startTime, model, content.length());
        return content;
    }

    static String extractContent(String json) {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(json);
        } catch (Exception e) {
            throw new ChatException("Bad chat response JSON", e);
        }
        JsonNode content = root.at("/choices/0/message/content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new ChatException("Chat response has no message content: " + json);
        }
        return content.asText().strip();
    }
}
