package com.guardian.rag.llm;

import com.fasterxml.jackson.databind.JsonNode;

public interface ChatClient {

    /**
     * Free-text completion.
     */
    String chatOnce(String systemPrompt, String userPrompt, double temperature, int maxTokens);

    /**
     * Completion constrained to a JSON schema. Returns the raw message content,
     * which the caller still has to parse and validate.
     */
    String chatStructured(String systemPrompt, String userPrompt, String schemaName, JsonNode schema, double temperature);
}
