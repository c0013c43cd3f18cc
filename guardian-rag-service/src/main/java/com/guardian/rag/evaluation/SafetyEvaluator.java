package com.guardian.rag.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardian.rag.json.Json;
import com.guardian.rag.llm.ChatClient;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Asks the chat model for a schema-constrained verdict on a text, judged only
 * against the given policy snippets, and validates what comes back.
 *
 * <p>Never throws: every failure is returned as an {@link EvaluationOutcome}.
 */
@Slf4j
public class SafetyEvaluator {

    static final String SCHEMA_NAME = "safety_evaluation";

    static final String SYSTEM_PROMPT = """
            You are the GuardianAI. Your task is to evaluate a given text based on a set of rules and guidelines \
            provided as context. Determine if the text is 'safe' or 'not safe'.
            - 'safe' means the text does not violate any of the rules.
            - 'not safe' means the text violates one or more rules.
            Provide a clear reason for your decision based *only* on the given context snippets.""";

    static final JsonNode SCHEMA = buildSchema();

    private final ChatClient chat;
    private final double temperature;

    /**
     * @param chat may be {@code null}; every evaluation then fails as {@code UPSTREAM}
     */
    public SafetyEvaluator(ChatClient chat, double temperature) {
        this.chat = chat;
        this.temperature = temperature;
    }

    public EvaluationOutcome evaluate(String text, List<String> contexts) {
        if (chat == null) {
            return EvaluationOutcome.failure(EvaluationFailure.Kind.UPSTREAM, "No chat model configured");
        }

        String raw;
        try {
            raw = chat.chatStructured(SYSTEM_PROMPT, buildPrompt(text, contexts), SCHEMA_NAME, SCHEMA, temperature);
        } catch (RuntimeException e) {
            EvaluationFailure.Kind kind = hasCause(e, HttpTimeoutException.class)
                    ? EvaluationFailure.Kind.TIMEOUT
                    : EvaluationFailure.Kind.UPSTREAM;
            log.warn("Safety evaluation call failed ({}): {}", kind, e.getMessage());
            return EvaluationOutcome.failure(kind, e.getMessage());
        }

        return parse(raw, contexts, contexts.isEmpty());
    }

    /**
     * Validates a raw model response against the evaluation schema.
     */
    public static EvaluationOutcome parse(String raw, List<String> contexts, boolean degraded) {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(raw);
        } catch (Exception e) {
            return EvaluationOutcome.failure(EvaluationFailure.Kind.MALFORMED_RESPONSE, "Response is not JSON: " + e.getMessage());
        }
        if (root == null || !root.isObject()) {
            return EvaluationOutcome.failure(EvaluationFailure.Kind.MALFORMED_RESPONSE, "Response is not a JSON object");
        }

        JsonNode level = root.get("safety_level");
        JsonNode reason = root.get("reason");
        if (level == null || !level.isTextual()) {
            return EvaluationOutcome.failure(EvaluationFailure.Kind.SCHEMA_VIOLATION, "safety_level missing or not a string");
        }
        if (reason == null || !reason.isTextual()) {
            return EvaluationOutcome.failure(EvaluationFailure.Kind.SCHEMA_VIOLATION, "reason missing or not a string");
        }

        SafetyLevel safetyLevel;
        try {
            safetyLevel = SafetyLevel.fromValue(level.asText());
        } catch (IllegalArgumentException e) {
            return EvaluationOutcome.failure(EvaluationFailure.Kind.SCHEMA_VIOLATION, e.getMessage());
        }

        SafetyEvaluation evaluation = new SafetyEvaluation(safetyLevel, reason.asText());
        return EvaluationOutcome.success(new EvaluationReport(evaluation, contexts, degraded));
    }

    static String buildPrompt(String text, List<String> contexts) {
        String contextBlock = IntStream.range(0, contexts.size())
                .mapToObj(i -> "[Context Snippet " + (i + 1) + "]:\n" + contexts.get(i))
                .collect(Collectors.joining("\n\n"));

        return """
                Please evaluate the following text:

                --- TEXT TO EVALUATE ---
                '%s'

                --- RULES AND GUIDELINES ---
                %s

                Based on these rules, is the text safe or not safe? Provide your answer in the requested JSON format."""
                .formatted(text, contextBlock);
    }

    private static JsonNode buildSchema() {
        ObjectNode schema = Json.MAPPER.createObjectNode();
        schema.put("title", "SafetyEvaluation");
        schema.put("type", "object");

        ObjectNode properties = schema.putObject("properties");
        ObjectNode level = properties.putObject("safety_level");
        level.put("type", "string");
        level.putArray("enum").add(SafetyLevel.SAFE.value()).add(SafetyLevel.NOT_SAFE.value());
        level.put("description",
                "Indicates whether the provided text is considered safe or not safe based on the given context.");

        ObjectNode reason = properties.putObject("reason");
        reason.put("type", "string");
        reason.put("description", "A brief explanation for the safety evaluation decision.");

        schema.putArray("required").add("safety_level").add("reason");
        schema.put("additionalProperties", false);
        return schema;
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c)) return true;
        }
        return false;
    }
}
